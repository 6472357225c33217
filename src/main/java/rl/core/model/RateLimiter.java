package rl.core.model;

/**
 * Single-budget limiter contract: no I/O, no threads, no blocking.
 *
 * Every method is safe to call concurrently from any number of threads.
 */
public interface RateLimiter {

    /**
     * Tests and consumes one permit.
     *
     * @return true if the caller is rate-limited (nothing consumed), false if a permit was taken
     */
    boolean limit();

    /**
     * Refunds one permit taken by a previous {@link #limit()} that returned false.
     * Calling it without such a permit over-credits the budget; pairing is the caller's job.
     */
    void undo();

    /**
     * Changes the permits granted per unit. Values below 1 are treated as 1.
     * Banked allowance is kept and trimmed to the new ceiling on the next {@link #limit()}.
     */
    void updateRate(long rate);

    /**
     * Same decision as {@link #limit()}, reported with a retry-after hint when rejected.
     */
    RateLimitResult tryAcquire();
}
