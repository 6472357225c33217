package rl.core.algorithms.token_bucket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rl.core.clock.Clock;
import rl.core.clock.SystemClock;
import rl.core.model.RateLimitResult;
import rl.core.model.RateLimiter;
import rl.core.model.RateLimiterConfig;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Token Bucket, lock-free:
 * - rate: permits per unit
 * - unit: nanoseconds in one unit, also the allowance cost of one permit
 * - allowance: budget in nanosecond-scaled tokens (tokens x unit), capped at max = rate x unit
 *
 * Every nanosecond that passes adds {@code rate} to the allowance, so one permit
 * refills every {@code unit / rate} nanoseconds. Starts full.
 *
 * Thread-safety: each field is an independent atomic. Accrual is a CAS retry loop,
 * consumption is a conditional CAS, nothing blocks. A reader may pair a fresh rate
 * with a stale max (or the reverse) during {@link #updateRate(long)}; the next call
 * sees both. The allowance may sit above max between an accrual or refund and the
 * following clamp.
 *
 * Supported range: rate x unit must not exceed {@link #MAX_BUDGET}.
 */
public final class TokenBucket implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucket.class);

    /**
     * Largest accepted rate x unit. Leaves headroom so allowance plus one accrual
     * plus refunds stays below Long.MAX_VALUE.
     */
    public static final long MAX_BUDGET = Long.MAX_VALUE / 4;

    private static final long ALLOWANCE_CEILING = MAX_BUDGET * 2;
    private static final long DEFAULT_UNIT_NANOS = 1_000_000_000L;

    private final Clock clock;
    private final long unit;

    private final AtomicLong rate;
    private final AtomicLong max;
    private final AtomicLong allowance;
    private final AtomicLong lastCheck;

    /**
     * Creates a limiter on the wall clock.
     *
     * @see #TokenBucket(Clock, long, Duration)
     */
    public TokenBucket(long rate, Duration period) {
        this(SystemClock.instance(), rate, period);
    }

    /**
     * Creates a full limiter granting {@code rate} permits per {@code period}.
     *
     * @param clock Time source (injected for testability)
     * @param rate Permits per period; values below 1 are treated as 1
     * @param period Period length; zero or negative means one second
     * @throws IllegalArgumentException if clock or period is null, the period does not fit
     *         in a long of nanoseconds, or rate x period exceeds {@link #MAX_BUDGET}
     */
    public TokenBucket(Clock clock, long rate, Duration period) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (period == null) throw new IllegalArgumentException("period cannot be null");

        long unitNanos = toUnitNanos(period);
        long clampedRate = Math.max(1L, rate);
        long budget = budget(clampedRate, unitNanos);

        this.clock = clock;
        this.unit = unitNanos;
        this.rate = new AtomicLong(clampedRate);
        this.max = new AtomicLong(budget);
        this.allowance = new AtomicLong(budget);
        this.lastCheck = new AtomicLong(clock.nowNanos());

        log.debug("Created token bucket: rate={}, unit={}ns, max={}", clampedRate, unitNanos, budget);
    }

    public static TokenBucket create(Clock clock, RateLimiterConfig config) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        return new TokenBucket(clock, config.rate(), config.period());
    }

    @Override
    public void updateRate(long newRate) {
        long clampedRate = Math.max(1L, newRate);
        long budget = budget(clampedRate, unit);

        rate.set(clampedRate);
        max.set(budget);

        log.debug("Updated token bucket rate: rate={}, max={}", clampedRate, budget);
    }

    @Override
    public boolean limit() {
        long currentRate = rate.get();

        // lastCheck only moves forward, so a regressed reading neither accrues nor re-credits later
        long now = clock.nowNanos();
        long prevCheck = lastCheck.getAndAccumulate(now, Math::max);
        long passed = Math.max(0L, now - prevCheck);

        if (passed > 0) {
            accrue(accrual(passed, currentRate));
        }

        long current = allowance.accumulateAndGet(max.get(), Math::min);

        while (current >= unit) {
            if (allowance.compareAndSet(current, current - unit)) {
                return false;
            }
            current = allowance.get();
        }

        log.trace("Rate-limited: allowance={} below unit={}", current, unit);
        return true;
    }

    @Override
    public void undo() {
        long ceiling = max.get();
        long prev = allowance.getAndAdd(unit);

        if (prev + unit > ceiling) {
            allowance.accumulateAndGet(ceiling, Math::min);
            log.trace("Refund clamped to max={}", ceiling);
        }
    }

    @Override
    public RateLimitResult tryAcquire() {
        if (!limit()) {
            return RateLimitResult.allow();
        }

        long deficit = unit - allowance.get();
        if (deficit <= 0) {
            return RateLimitResult.reject(0L);
        }
        long currentRate = rate.get();
        return RateLimitResult.reject((deficit + currentRate - 1) / currentRate);
    }

    public long rate() {
        return rate.get();
    }

    public long unit() {
        return unit;
    }

    public long max() {
        return max.get();
    }

    /**
     * Current budget in nanosecond-scaled tokens. Does not accrue elapsed time.
     */
    public long allowance() {
        return allowance.get();
    }

    /**
     * Whole permits in the current budget. Does not accrue elapsed time.
     */
    public long availableTokens() {
        return allowance.get() / unit;
    }

    /**
     * Adds accrued allowance. On contention the same accrual is re-applied to the
     * fresh value; the elapsed time it came from is not re-read.
     */
    private void accrue(long accrued) {
        long prev = allowance.get();
        long next = Math.min(prev + accrued, ALLOWANCE_CEILING);

        while (!allowance.compareAndSet(prev, next)) {
            prev = allowance.get();
            next = Math.min(prev + accrued, ALLOWANCE_CEILING);
        }
    }

    // Saturates at MAX_BUDGET: anything above max is clamped away anyway.
    private static long accrual(long passed, long rate) {
        if (passed > MAX_BUDGET / rate) {
            return MAX_BUDGET;
        }
        return passed * rate;
    }

    private static long toUnitNanos(Duration period) {
        long nanos;
        try {
            nanos = period.toNanos();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("period too long to express in nanoseconds: " + period, e);
        }
        return nanos < 1 ? DEFAULT_UNIT_NANOS : nanos;
    }

    private static long budget(long rate, long unit) {
        if (rate > MAX_BUDGET / unit) {
            throw new IllegalArgumentException(
                "rate x unit exceeds supported budget: rate=" + rate + ", unit=" + unit + "ns");
        }
        return rate * unit;
    }

    @Override
    public String toString() {
        return "TokenBucket{rate=" + rate.get()
            + ", unit=" + unit
            + ", allowance=" + allowance.get()
            + ", max=" + max.get()
            + ", lastCheck=" + lastCheck.get()
            + '}';
    }
}
