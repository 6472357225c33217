package rl.core.clock;

import java.time.Instant;

/**
 * Wall clock - nanoseconds since the Unix epoch.
 * Resolution depends on the platform; regressions (NTP steps) are possible
 * and are absorbed by the limiter.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        Instant now = Instant.now();
        return now.getEpochSecond() * NANOS_PER_SECOND + now.getNano();
    }
}
