package io.github.hongjungwan.avl.core.metrics;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Ledger 메트릭 수집 (LongAdder 기반 lock-free). Ledger 인스턴스마다 하나씩 생성한다.
 */
public final class LedgerMetrics {

    private final Instant startTime = Instant.now();

    private final Map<AppendKey, LongAdder> appends = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> verifyRequests = new ConcurrentHashMap<>();
    private final Map<String, Double> trustScores = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> chainLengths = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> continuityBreaks = new ConcurrentHashMap<>();
    private final AtomicBoolean degraded = new AtomicBoolean();
    private final AtomicLong fallbackActivations = new AtomicLong();
    private final LongAdder checkpoints = new LongAdder();
    private final LongAdder backfilledRecords = new LongAdder();
    private final LatencyHistogram appendLatency = new LatencyHistogram("append");
    private final LatencyHistogram verifyLatency = new LatencyHistogram("verify");

    /** Append outcome 라벨 */
    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_CONFLICT = "conflict";
    public static final String OUTCOME_ENCODING_ERROR = "encoding_error";
    public static final String OUTCOME_BACKEND_ERROR = "backend_error";

    public record AppendKey(String anchor, String kind, String outcome) {
    }

    public void recordAppend(String anchor, String kind, String outcome, long nanos) {
        appends.computeIfAbsent(new AppendKey(anchor, kind, outcome), k -> new LongAdder()).increment();
        appendLatency.record(nanos);
    }

    /** 체인 길이 gauge (단조 증가만 반영) */
    public void recordChainLength(String anchor, long length) {
        chainLengths.computeIfAbsent(anchor, k -> new AtomicLong()).accumulateAndGet(length, Math::max);
    }

    public void recordVerification(String anchor, String result, Double trustScore, long chainLength,
                                   boolean continuityBroken, long nanos) {
        verifyRequests.computeIfAbsent(result, k -> new LongAdder()).increment();
        if (trustScore != null) {
            trustScores.put(anchor, trustScore);
        }
        chainLengths.computeIfAbsent(anchor, k -> new AtomicLong()).set(chainLength);
        if (continuityBroken) {
            continuityBreaks.computeIfAbsent(anchor, k -> new LongAdder()).increment();
        }
        verifyLatency.record(nanos);
    }

    public void recordVerifyCancelled() {
        verifyRequests.computeIfAbsent("cancelled", k -> new LongAdder()).increment();
    }

    /** Degraded 전환. 최초 전환일 때만 true */
    public boolean recordDegraded() {
        boolean switched = degraded.compareAndSet(false, true);
        if (switched) {
            fallbackActivations.incrementAndGet();
        }
        return switched;
    }

    public void recordRecovered() {
        degraded.set(false);
    }

    public void recordCheckpoint() {
        checkpoints.increment();
    }

    public void recordBackfill(long records) {
        backfilledRecords.add(records);
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public Snapshot getSnapshot() {
        Map<AppendKey, Long> appendCounts = new TreeMap<>((a, b) -> {
            int c = a.anchor().compareTo(b.anchor());
            if (c != 0) return c;
            c = a.kind().compareTo(b.kind());
            return c != 0 ? c : a.outcome().compareTo(b.outcome());
        });
        appends.forEach((k, v) -> appendCounts.put(k, v.sum()));

        Map<String, Long> verifyCounts = new TreeMap<>();
        verifyRequests.forEach((k, v) -> verifyCounts.put(k, v.sum()));

        Map<String, Long> lengths = new TreeMap<>();
        chainLengths.forEach((k, v) -> lengths.put(k, v.get()));

        Map<String, Long> breaks = new TreeMap<>();
        continuityBreaks.forEach((k, v) -> breaks.put(k, v.sum()));

        return new Snapshot(
                Instant.now(),
                startTime,
                appendCounts,
                verifyCounts,
                new TreeMap<>(trustScores),
                lengths,
                breaks,
                degraded.get(),
                fallbackActivations.get(),
                checkpoints.sum(),
                backfilledRecords.sum(),
                appendLatency.getStats(),
                verifyLatency.getStats()
        );
    }

    public record Snapshot(
            Instant snapshotTime,
            Instant startTime,
            Map<AppendKey, Long> appends,
            Map<String, Long> verifyRequests,
            Map<String, Double> trustScores,
            Map<String, Long> chainLengths,
            Map<String, Long> continuityBreaks,
            boolean degraded,
            long fallbackActivations,
            long checkpoints,
            long backfilledRecords,
            LatencyHistogram.Stats appendLatency,
            LatencyHistogram.Stats verifyLatency
    ) {
        public long totalAppends(String outcome) {
            return appends.entrySet().stream()
                    .filter(e -> e.getKey().outcome().equals(outcome))
                    .mapToLong(Map.Entry::getValue)
                    .sum();
        }
    }
}
