package io.github.hongjungwan.avl.core.backend;

import io.github.hongjungwan.avl.api.domain.BackendStats;
import io.github.hongjungwan.avl.api.domain.ChainTail;
import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.SearchQuery;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 프로세스 메모리 저장소. 재시작 시 소실.
 *
 * <p>Anchor 체인은 임의의 sequence에서 시작할 수 있다 (durable tail에서 이어지는 degraded 구간).
 * 이후 레코드는 반드시 직전 sequence + 1이어야 한다.</p>
 */
@Slf4j
public class VolatileLedgerBackend implements LedgerBackend {

    public static final String NAME = "volatile";

    private final Map<String, AnchorChain> chains = new ConcurrentHashMap<>();
    private final Map<String, LedgerRecord> byId = new ConcurrentHashMap<>();
    private final Map<String, LedgerRecord> byHash = new ConcurrentHashMap<>();
    private final Map<String, List<Checkpoint>> checkpointsByAnchor = new ConcurrentHashMap<>();
    private final Map<String, Checkpoint> checkpointsById = new ConcurrentHashMap<>();

    /** 단일 anchor 체인. 레코드 목록은 락으로 보호 */
    private static final class AnchorChain {
        private final ReadWriteLock lock = new ReentrantReadWriteLock();
        private final List<LedgerRecord> records = new ArrayList<>();

        long firstSequence() {
            return records.get(0).getSequence();
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<ChainTail> tail(String anchorId) {
        AnchorChain chain = chains.get(anchorId);
        if (chain == null) {
            return Optional.empty();
        }
        chain.lock.readLock().lock();
        try {
            if (chain.records.isEmpty()) {
                return Optional.empty();
            }
            LedgerRecord last = chain.records.get(chain.records.size() - 1);
            return Optional.of(new ChainTail(last.getSequence(), last.getHash(), last.getRecordId()));
        } finally {
            chain.lock.readLock().unlock();
        }
    }

    @Override
    public void append(LedgerRecord record) {
        AnchorChain chain = chains.computeIfAbsent(record.getAnchorId(), k -> new AnchorChain());
        chain.lock.writeLock().lock();
        try {
            if (!chain.records.isEmpty()) {
                long expected = chain.records.get(chain.records.size() - 1).getSequence() + 1;
                if (record.getSequence() != expected) {
                    throw new SequenceConflictException(record.getAnchorId(), record.getSequence(), null);
                }
            }
            if (byHash.putIfAbsent(record.getHash(), record) != null) {
                throw new SequenceConflictException(record.getAnchorId(), record.getSequence(), null);
            }
            chain.records.add(record);
            byId.put(record.getRecordId(), record);
        } finally {
            chain.lock.writeLock().unlock();
        }
    }

    @Override
    public List<LedgerRecord> fetch(String anchorId, long fromSeq, long toSeq, int limit) {
        AnchorChain chain = chains.get(anchorId);
        if (chain == null || limit <= 0 || toSeq < fromSeq) {
            return List.of();
        }
        chain.lock.readLock().lock();
        try {
            if (chain.records.isEmpty()) {
                return List.of();
            }
            long base = chain.firstSequence();
            int from = (int) Math.max(0, fromSeq - base);
            int to = (int) Math.min(chain.records.size() - 1L, toSeq - base);
            if (from > to) {
                return List.of();
            }
            int end = (int) Math.min(to + 1L, (long) from + limit);
            return List.copyOf(chain.records.subList(from, end));
        } finally {
            chain.lock.readLock().unlock();
        }
    }

    @Override
    public Optional<LedgerRecord> findById(String recordId) {
        return Optional.ofNullable(byId.get(recordId));
    }

    @Override
    public Optional<LedgerRecord> findByHash(String hash) {
        return Optional.ofNullable(byHash.get(hash));
    }

    @Override
    public List<LedgerRecord> search(SearchQuery query) {
        return byId.values().stream()
                .filter(r -> query.getSlot() == null || query.getSlot().equals(r.getSlot()))
                .filter(r -> query.getKind() == null || query.getKind().code().equals(r.getKind().code()))
                .filter(r -> query.getSince() == null || !r.getTimestamp().isBefore(query.getSince()))
                .sorted(Comparator.comparing(LedgerRecord::getTimestamp)
                        .thenComparing(LedgerRecord::getRecordId)
                        .reversed())
                .limit(Math.max(0, query.getLimit()))
                .collect(Collectors.toList());
    }

    @Override
    public List<String> anchors() {
        return chains.keySet().stream().sorted().collect(Collectors.toList());
    }

    @Override
    public void appendCheckpoint(Checkpoint checkpoint) {
        List<Checkpoint> list = checkpointsByAnchor.computeIfAbsent(checkpoint.getAnchorId(), k -> new ArrayList<>());
        synchronized (list) {
            if (!list.isEmpty() && list.get(list.size() - 1).getRangeEndSeq() >= checkpoint.getRangeStartSeq()) {
                throw new SequenceConflictException(checkpoint.getAnchorId(), checkpoint.getRangeStartSeq(), null);
            }
            list.add(checkpoint);
            checkpointsById.put(checkpoint.getCheckpointId(), checkpoint);
        }
    }

    @Override
    public Optional<Checkpoint> findCheckpoint(String checkpointId) {
        return Optional.ofNullable(checkpointsById.get(checkpointId));
    }

    @Override
    public Optional<Checkpoint> latestCheckpoint(String anchorId) {
        List<Checkpoint> list = checkpointsByAnchor.get(anchorId);
        if (list == null) {
            return Optional.empty();
        }
        synchronized (list) {
            return list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1));
        }
    }

    @Override
    public List<Checkpoint> checkpoints(String anchorId) {
        List<Checkpoint> list = checkpointsByAnchor.get(anchorId);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    @Override
    public BackendStats stats() {
        long anchors = chains.values().stream().filter(c -> tailSize(c) > 0).count();
        return new BackendStats(byId.size(), anchors, checkpointsById.size());
    }

    private static int tailSize(AnchorChain chain) {
        chain.lock.readLock().lock();
        try {
            return chain.records.size();
        } finally {
            chain.lock.readLock().unlock();
        }
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    /** 특정 anchor의 레코드와 체크포인트 제거 (backfill 완료 anchor) */
    void removeAnchor(String anchorId) {
        AnchorChain chain = chains.remove(anchorId);
        if (chain != null) {
            chain.records.forEach(r -> {
                byId.remove(r.getRecordId());
                byHash.remove(r.getHash());
            });
        }
        List<Checkpoint> list = checkpointsByAnchor.remove(anchorId);
        if (list != null) {
            list.forEach(cp -> checkpointsById.remove(cp.getCheckpointId()));
        }
    }

    @Override
    public void close() {
        log.debug("Volatile backend closed with {} records", byId.size());
    }
}
