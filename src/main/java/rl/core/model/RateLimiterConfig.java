package rl.core.model;

import java.time.Duration;

/**
 * Configuration for creating a limiter.
 *
 * Values are coerced the same way the limiter coerces them, so every config
 * describes a constructible limiter:
 * - rate below 1 becomes 1
 * - a null, zero or negative period becomes {@link #DEFAULT_PERIOD}
 *
 * @param rate Permits granted per period
 * @param period Length of one period
 */
public record RateLimiterConfig(
    long rate,
    Duration period
) {
    public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(1);

    public RateLimiterConfig {
        rate = Math.max(1L, rate);
        if (period == null || period.isNegative() || period.isZero()) {
            period = DEFAULT_PERIOD;
        }
    }

    public static RateLimiterConfig of(long rate, Duration period) {
        return new RateLimiterConfig(rate, period);
    }

    public static RateLimiterConfig perSecond(long rate) {
        return new RateLimiterConfig(rate, Duration.ofSeconds(1));
    }

    public static RateLimiterConfig perMinute(long rate) {
        return new RateLimiterConfig(rate, Duration.ofMinutes(1));
    }
}
