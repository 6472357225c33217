package rl.core.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock driven by hand. Safe to read from many threads while one thread moves it.
 */
public final class ManualClock implements Clock {
    private final AtomicLong now;

    public ManualClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    /**
     * Jumps to an absolute reading. Going backwards simulates a clock regression.
     */
    public void setNanos(long value) {
        now.set(value);
    }
}
