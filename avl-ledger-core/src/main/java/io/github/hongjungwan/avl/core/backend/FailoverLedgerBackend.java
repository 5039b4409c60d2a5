package io.github.hongjungwan.avl.core.backend;

import io.github.hongjungwan.avl.api.config.AvlConfig;
import io.github.hongjungwan.avl.api.domain.BackendMode;
import io.github.hongjungwan.avl.api.domain.BackendStats;
import io.github.hongjungwan.avl.api.domain.BackfillReport;
import io.github.hongjungwan.avl.api.domain.ChainTail;
import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.SearchQuery;
import io.github.hongjungwan.avl.api.exception.BackendUnavailableException;
import io.github.hongjungwan.avl.core.metrics.LedgerMetrics;
import io.github.hongjungwan.avl.core.resilience.CircuitBreaker;
import io.github.hongjungwan.avl.core.resilience.RetryPolicy;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Durable 저장소 + volatile fallback.
 *
 * <p>재시도 후에도 실패한 durable 쓰기, 또는 Circuit Breaker를 연 durable 읽기는 즉시 DEGRADED로 전환한다.
 * 전환은 단방향이며 자동 재동기화는 없다. 복구는 운영자가 {@link #backfill()}로 수행한다.</p>
 *
 * <p>DEGRADED 상태의 volatile 체인은 이 프로세스가 마지막으로 본 durable tail에서 이어진다.</p>
 */
@Slf4j
public class FailoverLedgerBackend implements LedgerBackend {

    public static final String NAME = "failover";

    private static final Duration WRITE_RETRY_DELAY = Duration.ofMillis(50);
    private static final Duration READ_OPEN_DURATION = Duration.ofSeconds(30);

    private final Supplier<LedgerBackend> durableFactory;
    private final VolatileLedgerBackend fallback;
    private final LedgerMetrics metrics;
    private final RetryPolicy writeRetry;
    private final CircuitBreaker readBreaker;

    /** Append는 read lock, backfill은 write lock */
    private final ReentrantReadWriteLock appendGate = new ReentrantReadWriteLock();
    private final AtomicReference<BackendMode> mode = new AtomicReference<>(BackendMode.DURABLE);
    private final Map<String, ChainTail> lastDurableTails = new ConcurrentHashMap<>();

    private volatile LedgerBackend durable;
    private volatile String degradedReason;
    private volatile Instant degradedSince;

    public FailoverLedgerBackend(Supplier<LedgerBackend> durableFactory, VolatileLedgerBackend fallback,
                                 AvlConfig config, LedgerMetrics metrics) {
        this.durableFactory = durableFactory;
        this.fallback = fallback;
        this.metrics = metrics;

        this.writeRetry = RetryPolicy.builder("durable-write")
                .maxAttempts(config.getAppendRetries())
                .fixedDelay(WRITE_RETRY_DELAY)
                .retryOnExceptions(BackendUnavailableException.class)
                .build();

        this.readBreaker = CircuitBreaker.builder("durable-read")
                .failureThreshold(config.getFailureThreshold())
                .openDuration(READ_OPEN_DURATION)
                .countFailuresWhen(e -> e instanceof BackendUnavailableException)
                .onStateChange((name, from, to) -> {
                    if (to == CircuitBreaker.State.OPEN) {
                        degrade("circuit breaker '" + name + "' opened");
                    }
                })
                .build();

        try {
            this.durable = durableFactory.get();
        } catch (BackendUnavailableException e) {
            log.error("Durable backend unavailable at startup: {}", e.getMessage());
            degrade("startup failure: " + e.getMessage());
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    public BackendMode getMode() {
        return mode.get();
    }

    public boolean isDegraded() {
        return mode.get() == BackendMode.DEGRADED;
    }

    public String getDegradedReason() {
        return degradedReason;
    }

    public Instant getDegradedSince() {
        return degradedSince;
    }

    /**
     * DEGRADED로 전환. 이미 전환된 경우 무시.
     */
    public void degrade(String reason) {
        if (mode.compareAndSet(BackendMode.DURABLE, BackendMode.DEGRADED)) {
            degradedReason = reason;
            degradedSince = Instant.now();
            metrics.recordDegraded();
            log.warn("Durable backend unavailable ({}); switching to volatile fallback until backfill()", reason);
        }
    }

    private boolean durableMode() {
        return mode.get() == BackendMode.DURABLE && durable != null;
    }

    // ---- write path ----

    @Override
    public Optional<ChainTail> tail(String anchorId) {
        if (durableMode()) {
            try {
                Optional<ChainTail> tail = writeRetry.execute(() -> durable.tail(anchorId));
                tail.ifPresent(t -> lastDurableTails.put(anchorId, t));
                return tail;
            } catch (RetryPolicy.RetryExhaustedException e) {
                degrade("tail lookup failed: " + e.getCause().getMessage());
            }
        }
        Optional<ChainTail> volatileTail = fallback.tail(anchorId);
        if (volatileTail.isPresent()) {
            return volatileTail;
        }
        ChainTail seen = lastDurableTails.get(anchorId);
        if (seen != null) {
            return Optional.of(seen);
        }
        return tryDurable(() -> durable.tail(anchorId)).flatMap(t -> t);
    }

    @Override
    public void append(LedgerRecord record) {
        appendGate.readLock().lock();
        try {
            if (durableMode()) {
                try {
                    writeRetry.execute(() -> durable.append(record));
                    lastDurableTails.put(record.getAnchorId(),
                            new ChainTail(record.getSequence(), record.getHash(), record.getRecordId()));
                    return;
                } catch (RetryPolicy.RetryExhaustedException e) {
                    log.error("Durable append of {} failed after {} attempts", record.getRecordId(), e.getAttempts());
                    degrade("append failed: " + e.getCause().getMessage());
                }
            }
            fallback.append(record);
        } finally {
            appendGate.readLock().unlock();
        }
    }

    @Override
    public void appendCheckpoint(Checkpoint checkpoint) {
        appendGate.readLock().lock();
        try {
            if (durableMode()) {
                try {
                    writeRetry.execute(() -> durable.appendCheckpoint(checkpoint));
                    return;
                } catch (RetryPolicy.RetryExhaustedException e) {
                    degrade("checkpoint write failed: " + e.getCause().getMessage());
                }
            }
            fallback.appendCheckpoint(checkpoint);
        } finally {
            appendGate.readLock().unlock();
        }
    }

    // ---- read path ----

    /** Durable 모드에서는 Circuit Breaker를 거쳐 durable에서 읽는다 */
    private <T> T read(Supplier<T> durableRead, Supplier<T> degradedRead) {
        if (durableMode()) {
            try {
                return readBreaker.execute(durableRead);
            } catch (CircuitBreaker.CircuitBreakerOpenException e) {
                degrade("durable reads failing");
            } catch (BackendUnavailableException e) {
                if (!isDegraded()) {
                    throw e;
                }
            }
        }
        return degradedRead.get();
    }

    /** DEGRADED 상태에서 durable 이력 조회 시도 (실패 시 empty) */
    private <T> Optional<T> tryDurable(Supplier<T> durableRead) {
        LedgerBackend current = durable;
        if (current == null || readBreaker.getState() == CircuitBreaker.State.OPEN) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(readBreaker.execute(durableRead));
        } catch (BackendUnavailableException | CircuitBreaker.CircuitBreakerOpenException e) {
            log.debug("Durable history unavailable while degraded: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<LedgerRecord> fetch(String anchorId, long fromSeq, long toSeq, int limit) {
        return read(() -> durable.fetch(anchorId, fromSeq, toSeq, limit), () -> {
            List<LedgerRecord> volatilePart = fallback.fetch(anchorId, fromSeq, toSeq, limit);
            long volatileStart = fallback.tail(anchorId).isPresent()
                    ? fallback.fetch(anchorId, 0, Long.MAX_VALUE, 1).get(0).getSequence()
                    : Long.MAX_VALUE;
            if (fromSeq >= volatileStart) {
                return volatilePart;
            }
            List<LedgerRecord> merged = new ArrayList<>(
                    tryDurable(() -> durable.fetch(anchorId, fromSeq, Math.min(toSeq, volatileStart - 1), limit))
                            .orElse(List.of()));
            for (LedgerRecord record : volatilePart) {
                if (merged.size() >= limit) {
                    break;
                }
                merged.add(record);
            }
            return merged;
        });
    }

    @Override
    public Optional<LedgerRecord> findById(String recordId) {
        return read(() -> durable.findById(recordId), () -> fallback.findById(recordId)
                .or(() -> tryDurable(() -> durable.findById(recordId)).flatMap(r -> r)));
    }

    @Override
    public Optional<LedgerRecord> findByHash(String hash) {
        return read(() -> durable.findByHash(hash), () -> fallback.findByHash(hash)
                .or(() -> tryDurable(() -> durable.findByHash(hash)).flatMap(r -> r)));
    }

    @Override
    public List<LedgerRecord> search(SearchQuery query) {
        return read(() -> durable.search(query), () -> {
            List<LedgerRecord> merged = new ArrayList<>(fallback.search(query));
            merged.addAll(tryDurable(() -> durable.search(query)).orElse(List.of()));
            return merged.stream()
                    .sorted(Comparator.comparing(LedgerRecord::getTimestamp)
                            .thenComparing(LedgerRecord::getRecordId)
                            .reversed())
                    .limit(Math.max(0, query.getLimit()))
                    .collect(Collectors.toList());
        });
    }

    @Override
    public List<String> anchors() {
        return read(() -> durable.anchors(), () -> {
            Set<String> anchors = new TreeSet<>(fallback.anchors());
            anchors.addAll(tryDurable(() -> durable.anchors()).orElse(List.of()));
            return new ArrayList<>(anchors);
        });
    }

    @Override
    public Optional<Checkpoint> findCheckpoint(String checkpointId) {
        return read(() -> durable.findCheckpoint(checkpointId), () -> fallback.findCheckpoint(checkpointId)
                .or(() -> tryDurable(() -> durable.findCheckpoint(checkpointId)).flatMap(c -> c)));
    }

    @Override
    public Optional<Checkpoint> latestCheckpoint(String anchorId) {
        return read(() -> durable.latestCheckpoint(anchorId), () -> fallback.latestCheckpoint(anchorId)
                .or(() -> tryDurable(() -> durable.latestCheckpoint(anchorId)).flatMap(c -> c)));
    }

    @Override
    public List<Checkpoint> checkpoints(String anchorId) {
        return read(() -> durable.checkpoints(anchorId), () -> {
            List<Checkpoint> merged = new ArrayList<>(tryDurable(() -> durable.checkpoints(anchorId)).orElse(List.of()));
            merged.addAll(fallback.checkpoints(anchorId));
            return merged;
        });
    }

    @Override
    public BackendStats stats() {
        return read(() -> durable.stats(), () -> {
            BackendStats volatileStats = fallback.stats();
            Optional<BackendStats> durableStats = tryDurable(() -> durable.stats());
            if (durableStats.isEmpty()) {
                return volatileStats;
            }
            return new BackendStats(
                    durableStats.get().totalRecords() + volatileStats.totalRecords(),
                    anchors().size(),
                    durableStats.get().totalCheckpoints() + volatileStats.totalCheckpoints());
        });
    }

    @Override
    public boolean isHealthy() {
        return durableMode() && durable.isHealthy();
    }

    // ---- recovery ----

    /**
     * Volatile 레코드를 anchor 단위로 durable에 복사하고 DURABLE 모드로 복귀.
     * 진행 중에는 append가 대기한다. 연결이 맞지 않는 anchor는 건너뛰고 volatile에 남긴다.
     *
     * @throws BackendUnavailableException durable이 아직 도달 불가
     */
    public BackfillReport backfill() {
        appendGate.writeLock().lock();
        try {
            if (mode.get() != BackendMode.DEGRADED) {
                log.info("Backfill requested in {} mode, nothing to do", mode.get());
                return BackfillReport.nothingToDo(mode.get());
            }
            if (durable == null) {
                durable = durableFactory.get();
            }
            if (!durable.isHealthy()) {
                throw new BackendUnavailableException(durable.getName(), "still unreachable, backfill aborted");
            }

            log.info("Backfill started: {} anchor(s) in volatile fallback", fallback.anchors().size());
            long recordsCopied = 0;
            long checkpointsCopied = 0;
            int anchorsCopied = 0;
            Map<String, String> skipped = new TreeMap<>();

            for (String anchorId : fallback.anchors()) {
                List<LedgerRecord> records = fallback.fetch(anchorId, 0, Long.MAX_VALUE, Integer.MAX_VALUE);
                if (records.isEmpty()) {
                    continue;
                }
                String problem = linkageProblem(records.get(0), durable.tail(anchorId));
                if (problem != null) {
                    log.warn("Backfill skipped anchor '{}': {}", anchorId, problem);
                    skipped.put(anchorId, problem);
                    continue;
                }
                try {
                    durable.appendAll(records);
                } catch (SequenceConflictException e) {
                    log.warn("Backfill skipped anchor '{}': {}", anchorId, e.getMessage());
                    skipped.put(anchorId, e.getMessage());
                    continue;
                }
                recordsCopied += records.size();

                for (Checkpoint checkpoint : fallback.checkpoints(anchorId)) {
                    try {
                        durable.appendCheckpoint(checkpoint);
                        checkpointsCopied++;
                    } catch (SequenceConflictException e) {
                        log.warn("Backfill dropped overlapping checkpoint {} of '{}'", checkpoint.getCheckpointId(), anchorId);
                    }
                }

                LedgerRecord last = records.get(records.size() - 1);
                lastDurableTails.put(anchorId, new ChainTail(last.getSequence(), last.getHash(), last.getRecordId()));
                fallback.removeAnchor(anchorId);
                anchorsCopied++;
            }

            if (skipped.isEmpty()) {
                mode.set(BackendMode.DURABLE);
                degradedReason = null;
                degradedSince = null;
                readBreaker.reset();
                metrics.recordRecovered();
            }
            metrics.recordBackfill(recordsCopied);
            log.info("Backfill finished: {} record(s), {} checkpoint(s), {} anchor(s) copied, {} skipped, mode {}",
                    recordsCopied, checkpointsCopied, anchorsCopied, skipped.size(), mode.get());
            return new BackfillReport(recordsCopied, checkpointsCopied, anchorsCopied, Map.copyOf(skipped), mode.get());
        } finally {
            appendGate.writeLock().unlock();
        }
    }

    private static String linkageProblem(LedgerRecord first, Optional<ChainTail> durableTail) {
        if (durableTail.isEmpty()) {
            return first.getSequence() == 0
                    ? null
                    : "durable store has no history before sequence " + first.getSequence();
        }
        ChainTail tail = durableTail.get();
        if (first.getSequence() != tail.nextSequence()) {
            return "volatile segment starts at sequence " + first.getSequence()
                    + " but durable tail is at " + tail.sequence();
        }
        if (!first.getPrevHash().equals(tail.hash())) {
            return "volatile segment does not link to durable tail " + tail.hash();
        }
        return null;
    }

    @Override
    public void close() {
        BackendStats pending = fallback.stats();
        if (isDegraded() && pending.totalRecords() > 0) {
            log.warn("Closing while degraded: {} record(s) in volatile fallback were never backfilled",
                    pending.totalRecords());
        }
        fallback.close();
        if (durable != null) {
            durable.close();
        }
    }
}
