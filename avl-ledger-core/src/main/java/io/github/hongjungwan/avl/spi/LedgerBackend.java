package io.github.hongjungwan.avl.spi;

import io.github.hongjungwan.avl.api.domain.BackendStats;
import io.github.hongjungwan.avl.api.domain.ChainTail;
import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.SearchQuery;

import java.util.List;
import java.util.Optional;

/**
 * SPI for record and checkpoint storage.
 *
 * <p>Implementations persist records atomically: {@link #append(LedgerRecord)} either
 * stores the whole record or nothing. A backend must reject a record whose
 * {@code (anchorId, sequence)} is already taken by throwing
 * {@link SequenceConflictException}; that is how the chain store detects a lost
 * tail race.</p>
 *
 * <p>Connectivity problems are reported as
 * {@link io.github.hongjungwan.avl.api.exception.BackendUnavailableException}.</p>
 */
public interface LedgerBackend extends AutoCloseable {

    /**
     * Backend name for logs and metrics.
     */
    String getName();

    /**
     * Last record position of the anchor, empty for an unknown anchor.
     */
    Optional<ChainTail> tail(String anchorId);

    /**
     * Persist a fully linked record.
     *
     * @throws SequenceConflictException if the sequence position is already occupied
     */
    void append(LedgerRecord record);

    /**
     * Persist consecutive records of one anchor. Backends with transactions store all
     * of them or none; the default stores them one by one.
     */
    default void appendAll(List<LedgerRecord> records) {
        records.forEach(this::append);
    }

    /**
     * Records of the anchor with {@code fromSeq <= sequence <= toSeq}, ascending,
     * at most {@code limit} records.
     */
    List<LedgerRecord> fetch(String anchorId, long fromSeq, long toSeq, int limit);

    Optional<LedgerRecord> findById(String recordId);

    Optional<LedgerRecord> findByHash(String hash);

    /**
     * Records matching the query, most recent first.
     */
    List<LedgerRecord> search(SearchQuery query);

    List<String> anchors();

    void appendCheckpoint(Checkpoint checkpoint);

    Optional<Checkpoint> findCheckpoint(String checkpointId);

    Optional<Checkpoint> latestCheckpoint(String anchorId);

    /**
     * Checkpoints of the anchor in range order.
     */
    List<Checkpoint> checkpoints(String anchorId);

    BackendStats stats();

    /**
     * Cheap connectivity probe.
     */
    boolean isHealthy();

    @Override
    void close();

    /**
     * Thrown when another writer already occupies the sequence position.
     */
    class SequenceConflictException extends RuntimeException {
        private final String anchorId;
        private final long sequence;

        public SequenceConflictException(String anchorId, long sequence, Throwable cause) {
            super("Sequence " + sequence + " of anchor '" + anchorId + "' is already taken", cause);
            this.anchorId = anchorId;
            this.sequence = sequence;
        }

        public String getAnchorId() {
            return anchorId;
        }

        public long getSequence() {
            return sequence;
        }
    }
}
