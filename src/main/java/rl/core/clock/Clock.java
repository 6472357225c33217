package rl.core.clock;

/**
 * Time source for limiters, in nanoseconds from a fixed epoch.
 *
 * Readings only need to be non-decreasing in practice. Callers tolerate
 * small regressions by treating them as zero elapsed time.
 */
@FunctionalInterface
public interface Clock {
    long nowNanos();
}
