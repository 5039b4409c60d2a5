package io.github.hongjungwan.avl.core.metrics;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * 고정 버킷 Latency 히스토그램 (lock-free).
 */
public final class LatencyHistogram {

    private static final long[] BUCKET_BOUNDARIES = {
            100_000,        // 0.1ms
            1_000_000,      // 1ms
            5_000_000,      // 5ms
            25_000_000,     // 25ms
            100_000_000,    // 100ms
            1_000_000_000   // 1s
    };

    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNanos = new LongAdder();
    private final AtomicLong maxNanos = new AtomicLong();
    private final LongAdder[] buckets = new LongAdder[BUCKET_BOUNDARIES.length + 1];

    public LatencyHistogram(String name) {
        this.name = name;
        for (int i = 0; i < buckets.length; i++) {
            buckets[i] = new LongAdder();
        }
    }

    public void record(long nanos) {
        count.increment();
        totalNanos.add(nanos);
        maxNanos.accumulateAndGet(nanos, Math::max);
        buckets[bucketOf(nanos)].increment();
    }

    private static int bucketOf(long nanos) {
        for (int i = 0; i < BUCKET_BOUNDARIES.length; i++) {
            if (nanos <= BUCKET_BOUNDARIES[i]) {
                return i;
            }
        }
        return BUCKET_BOUNDARIES.length;
    }

    public Stats getStats() {
        long c = count.sum();
        if (c == 0) {
            return new Stats(name, 0, 0, 0, 0);
        }
        return new Stats(name, c,
                (double) totalNanos.sum() / c / 1_000_000,
                (double) maxNanos.get() / 1_000_000,
                percentile(0.99, c));
    }

    private double percentile(double percentile, long total) {
        long target = (long) Math.ceil(total * percentile);
        long cumulative = 0;
        for (int i = 0; i < buckets.length; i++) {
            cumulative += buckets[i].sum();
            if (cumulative >= target && i < BUCKET_BOUNDARIES.length) {
                return (double) BUCKET_BOUNDARIES[i] / 1_000_000;
            }
        }
        return (double) maxNanos.get() / 1_000_000;
    }

    public record Stats(String name, long count, double avgMs, double maxMs, double p99Ms) {
    }
}
