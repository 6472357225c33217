package rl.benchmarks;

import org.openjdk.jmh.annotations.*;
import rl.core.algorithms.token_bucket.TokenBucket;
import rl.core.clock.SystemClock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for the lock-free TokenBucket.
 *
 * Scenarios:
 * - allow: budget never runs out (hot path, one CAS to consume)
 * - reject: budget exhausted, refill far slower than calls
 * - limitUndo: consume and refund
 * - parallel: 8 threads contending on one shared bucket
 *
 * Run (after test-compile):
 *   java -cp target/test-classes:target/classes:$(deps) org.openjdk.jmh.Main TokenBucketBenchmark
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class TokenBucketBenchmark {

    @State(Scope.Thread)
    public static class PerThread {
        TokenBucket allow;
        TokenBucket reject;

        @Setup
        public void setup() {
            SystemClock clock = SystemClock.instance();
            allow = new TokenBucket(clock, 1_000_000_000L, Duration.ofMillis(1));
            reject = new TokenBucket(clock, 1, Duration.ofHours(1));
            reject.limit();
        }
    }

    @State(Scope.Benchmark)
    public static class Shared {
        TokenBucket bucket;

        @Setup
        public void setup() {
            bucket = new TokenBucket(SystemClock.instance(), 1_000_000_000L, Duration.ofMillis(1));
        }
    }

    @Benchmark
    public boolean tokenBucket_allow(PerThread state) {
        return state.allow.limit();
    }

    @Benchmark
    public boolean tokenBucket_reject(PerThread state) {
        return state.reject.limit();
    }

    @Benchmark
    public void tokenBucket_limitUndo(PerThread state) {
        if (!state.allow.limit()) {
            state.allow.undo();
        }
    }

    @Benchmark
    @Threads(8)
    public boolean tokenBucket_parallel(Shared state) {
        return state.bucket.limit();
    }
}
