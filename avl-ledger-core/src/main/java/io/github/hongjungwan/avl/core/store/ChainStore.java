package io.github.hongjungwan.avl.core.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.hongjungwan.avl.api.domain.ChainTail;
import io.github.hongjungwan.avl.api.domain.DraftRecord;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.RecordKind;
import io.github.hongjungwan.avl.api.exception.BackendUnavailableException;
import io.github.hongjungwan.avl.api.exception.ChainConflictException;
import io.github.hongjungwan.avl.api.exception.EncodingException;
import io.github.hongjungwan.avl.core.canonical.CanonicalEncoder;
import io.github.hongjungwan.avl.core.canonical.RecordHasher;
import io.github.hongjungwan.avl.core.id.RecordIdGenerator;
import io.github.hongjungwan.avl.core.kind.KindRegistry;
import io.github.hongjungwan.avl.core.metrics.LedgerMetrics;
import io.github.hongjungwan.avl.core.resilience.RetryPolicy;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Anchor별 append-only 해시 체인 저장소.
 *
 * <p>같은 anchor에 대한 append는 anchor 락으로 직렬화되고, 락 안에서 tail을 읽어 prev_hash를 계산한다.
 * 다른 writer(다른 프로세스)가 같은 sequence를 먼저 차지하면 backend가 충돌을 보고하고,
 * tail을 backend에서 다시 읽어 제한된 횟수만큼 재시도한다.</p>
 */
@Slf4j
public class ChainStore {

    public static final int DEFAULT_PAGE_SIZE = 256;

    private static final Duration CONFLICT_RETRY_DELAY = Duration.ofMillis(10);

    private final LedgerBackend backend;
    private final RecordHasher hasher;
    private final KindRegistry kindRegistry;
    private final RecordIdGenerator idGenerator;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final RetryPolicy conflictRetry;
    private final AnchorLocks anchorLocks = new AnchorLocks();
    private final List<AppendListener> listeners = new CopyOnWriteArrayList<>();

    /** Anchor -> 마지막 tail. 미스 시 backend 조회 */
    private final Cache<String, ChainTail> tailCache = Caffeine.newBuilder()
            .maximumSize(100_000)
            .build();

    /**
     * Commit 직후 호출되는 리스너 (체크포인트 트리거 등). Producer 스레드에서 실행되므로 가벼워야 한다.
     */
    @FunctionalInterface
    public interface AppendListener {
        void onAppend(LedgerRecord record);
    }

    public ChainStore(LedgerBackend backend, RecordHasher hasher, KindRegistry kindRegistry,
                      RecordIdGenerator idGenerator, LedgerMetrics metrics, Clock clock, int appendRetries) {
        this.backend = backend;
        this.hasher = hasher;
        this.kindRegistry = kindRegistry;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
        this.conflictRetry = RetryPolicy.builder("chain-append")
                .maxAttempts(appendRetries)
                .fixedDelay(CONFLICT_RETRY_DELAY)
                .retryOnExceptions(LedgerBackend.SequenceConflictException.class)
                .onRetry((attempt, e) -> tailCache.invalidate(
                        ((LedgerBackend.SequenceConflictException) e).getAnchorId()))
                .build();
    }

    public void addListener(AppendListener listener) {
        listeners.add(listener);
    }

    /**
     * Draft를 검증, 해시, 연결하여 원자적으로 저장.
     *
     * @throws EncodingException       payload 또는 kind가 거부됨 (아무것도 저장되지 않음)
     * @throws ChainConflictException  tail 경합이 재시도 후에도 해소되지 않음
     */
    public LedgerRecord append(DraftRecord draft) {
        long start = System.nanoTime();
        String anchorId = draft.getAnchorId();
        String kindLabel = draft.getKind() == null ? "null" : draft.getKind().code();

        RecordKind kind;
        Map<String, Object> payload;
        try {
            requireText("anchorId", anchorId);
            requireText("slot", draft.getSlot());
            kind = kindRegistry.validate(draft.getKind());
            payload = hasher.getEncoder().normalizePayload(draft.getPayload());
        } catch (EncodingException e) {
            metrics.recordAppend(String.valueOf(anchorId), kindLabel, LedgerMetrics.OUTCOME_ENCODING_ERROR,
                    System.nanoTime() - start);
            throw e;
        }
        Instant timestamp = CanonicalEncoder.truncate(draft.getTimestamp() != null ? draft.getTimestamp() : clock.instant());

        ReentrantLock lock = anchorLocks.lockFor(anchorId);
        lock.lock();
        LedgerRecord committed;
        try {
            committed = conflictRetry.execute(() -> appendOnce(draft, anchorId, kind, timestamp, payload));
        } catch (RetryPolicy.RetryExhaustedException e) {
            metrics.recordAppend(anchorId, kind.code(), LedgerMetrics.OUTCOME_CONFLICT, System.nanoTime() - start);
            log.warn("Append to anchor '{}' gave up after {} conflicting attempts", anchorId, e.getAttempts());
            throw new ChainConflictException(anchorId, e.getAttempts(), e.getCause());
        } catch (BackendUnavailableException e) {
            metrics.recordAppend(anchorId, kind.code(), LedgerMetrics.OUTCOME_BACKEND_ERROR, System.nanoTime() - start);
            throw e;
        } finally {
            lock.unlock();
        }

        metrics.recordAppend(anchorId, kind.code(), LedgerMetrics.OUTCOME_SUCCESS, System.nanoTime() - start);
        metrics.recordChainLength(anchorId, committed.getSequence() + 1);
        log.debug("Appended {} to anchor '{}' at seq {} ({})", committed.getRecordId(), anchorId,
                committed.getSequence(), kind.code());
        notifyListeners(committed);
        return committed;
    }

    private LedgerRecord appendOnce(DraftRecord draft, String anchorId, RecordKind kind, Instant timestamp,
                                    Map<String, Object> payload) {
        Optional<ChainTail> tail = currentTail(anchorId);
        long sequence = tail.map(ChainTail::nextSequence).orElse(0L);
        String prevHash = tail.map(ChainTail::hash).orElseGet(hasher::genesisHash);

        LedgerRecord record = LedgerRecord.builder()
                .recordId(idGenerator.next())
                .anchorId(anchorId)
                .sequence(sequence)
                .slot(draft.getSlot())
                .kind(kind)
                .timestamp(timestamp)
                .prevHash(prevHash)
                .hash(hasher.hash(anchorId, draft.getSlot(), kind, timestamp, prevHash, payload))
                .payload(payload)
                .signature(draft.getSignature())
                .producer(draft.getProducer())
                .schemaVersion(draft.getSchemaVersion())
                .build();

        try {
            backend.append(record);
        } catch (RuntimeException e) {
            tailCache.invalidate(anchorId);
            throw e;
        }
        tailCache.put(anchorId, new ChainTail(sequence, record.getHash(), record.getRecordId()));
        return record;
    }

    private Optional<ChainTail> currentTail(String anchorId) {
        ChainTail cached = tailCache.getIfPresent(anchorId);
        if (cached != null) {
            return Optional.of(cached);
        }
        return backend.tail(anchorId);
    }

    private void notifyListeners(LedgerRecord record) {
        for (AppendListener listener : listeners) {
            try {
                listener.onAppend(record);
            } catch (RuntimeException e) {
                log.warn("Append listener failed for {}", record.getRecordId(), e);
            }
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new EncodingException(null, field + " must not be blank");
        }
    }

    // ---- queries ----

    public Optional<ChainTail> tail(String anchorId) {
        return backend.tail(anchorId);
    }

    /** 포함 범위 [fromSeq, toSeq] 오름차순 */
    public List<LedgerRecord> fetchChain(String anchorId, long fromSeq, long toSeq) {
        if (toSeq < fromSeq) {
            return List.of();
        }
        long span = toSeq - fromSeq + 1;
        int limit = span > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) span;
        return backend.fetch(anchorId, fromSeq, toSeq, limit);
    }

    /** 체인 전체를 페이지 단위로 지연 조회 */
    public Stream<LedgerRecord> streamChain(String anchorId) {
        return streamChain(anchorId, 0, Long.MAX_VALUE, DEFAULT_PAGE_SIZE);
    }

    public Stream<LedgerRecord> streamChain(String anchorId, long fromSeq, long toSeq, int pageSize) {
        Iterator<LedgerRecord> pages = new PagingIterator(anchorId, fromSeq, toSeq, pageSize);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pages,
                Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE), false);
    }

    public LedgerBackend getBackend() {
        return backend;
    }

    /**
     * Backend를 pageSize씩 조회하는 iterator. 다음 페이지는 마지막으로 받은 sequence 이후부터.
     */
    private final class PagingIterator implements Iterator<LedgerRecord> {
        private final String anchorId;
        private final long toSeq;
        private final int pageSize;
        private long nextSeq;
        private Iterator<LedgerRecord> page = List.<LedgerRecord>of().iterator();
        private boolean exhausted;

        PagingIterator(String anchorId, long fromSeq, long toSeq, int pageSize) {
            this.anchorId = anchorId;
            this.nextSeq = fromSeq;
            this.toSeq = toSeq;
            this.pageSize = pageSize;
        }

        @Override
        public boolean hasNext() {
            if (page.hasNext()) {
                return true;
            }
            if (exhausted || nextSeq > toSeq) {
                return false;
            }
            List<LedgerRecord> records = backend.fetch(anchorId, nextSeq, toSeq, pageSize);
            if (records.size() < pageSize) {
                exhausted = true;
            }
            if (!records.isEmpty()) {
                nextSeq = records.get(records.size() - 1).getSequence() + 1;
            }
            page = records.iterator();
            return page.hasNext();
        }

        @Override
        public LedgerRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.next();
        }
    }
}
