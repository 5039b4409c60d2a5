package io.github.hongjungwan.avl.core.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.hongjungwan.avl.api.domain.ChainTail;
import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.CheckpointVerification;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.MerkleProof;
import io.github.hongjungwan.avl.api.exception.EncodingException;
import io.github.hongjungwan.avl.core.canonical.CanonicalEncoder;
import io.github.hongjungwan.avl.core.hash.HashFunctions;
import io.github.hongjungwan.avl.core.id.RecordIdGenerator;
import io.github.hongjungwan.avl.core.metrics.LedgerMetrics;
import io.github.hongjungwan.avl.core.signature.SignatureVerifierRegistry;
import io.github.hongjungwan.avl.core.store.AnchorLocks;
import io.github.hongjungwan.avl.core.store.ChainStore;
import io.github.hongjungwan.avl.spi.CheckpointSigner;
import io.github.hongjungwan.avl.spi.HashFunction;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import io.github.hongjungwan.avl.spi.SignatureVerifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Anchor의 마지막 체크포인트 이후 commit된 레코드를 Merkle root로 묶는다.
 * 같은 anchor의 빌드는 직렬화되며 구간은 직전 체크포인트와 연속이다.
 */
@Slf4j
public class CheckpointBuilder {

    private static final ObjectMapper HEADER_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final ChainStore store;
    private final LedgerBackend backend;
    private final HashFunction hashFunction;
    private final CheckpointSigner signer;
    private final SignatureVerifierRegistry signatureVerifiers;
    private final RecordIdGenerator idGenerator;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final AnchorLocks buildLocks = new AnchorLocks();

    public CheckpointBuilder(ChainStore store, HashFunction hashFunction, CheckpointSigner signer,
                             SignatureVerifierRegistry signatureVerifiers, RecordIdGenerator idGenerator,
                             LedgerMetrics metrics, Clock clock) {
        this.store = store;
        this.backend = store.getBackend();
        this.hashFunction = hashFunction;
        this.signer = signer;
        this.signatureVerifiers = signatureVerifiers;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * 새 레코드가 있으면 체크포인트를 만들어 저장. 없으면 empty.
     */
    public Optional<Checkpoint> build(String anchorId) {
        ReentrantLock lock = buildLocks.lockFor(anchorId);
        lock.lock();
        try {
            Optional<Checkpoint> previous = backend.latestCheckpoint(anchorId);
            long start = previous.map(cp -> cp.getRangeEndSeq() + 1).orElse(0L);
            Optional<ChainTail> tail = store.tail(anchorId);
            if (tail.isEmpty() || tail.get().sequence() < start) {
                return Optional.empty();
            }

            List<LedgerRecord> records = contiguous(store.fetchChain(anchorId, start, tail.get().sequence()));
            if (records.isEmpty()) {
                return Optional.empty();
            }
            LedgerRecord first = records.get(0);
            if (previous.isPresent() && first.getSequence() != start) {
                log.warn("Cannot checkpoint anchor '{}': records from seq {} are not available (first is {})",
                        anchorId, start, first.getSequence());
                return Optional.empty();
            }
            LedgerRecord last = records.get(records.size() - 1);

            List<String> leafHashes = records.stream().map(LedgerRecord::getHash).toList();
            Checkpoint unsigned = Checkpoint.builder()
                    .checkpointId(idGenerator.next())
                    .anchorId(anchorId)
                    .rangeStartSeq(first.getSequence())
                    .rangeEndSeq(last.getSequence())
                    .rangeStartRecordId(first.getRecordId())
                    .rangeEndRecordId(last.getRecordId())
                    .merkleRoot(MerkleTree.rootHex(leafHashes, hashFunction))
                    .prevRoot(previous.map(Checkpoint::getMerkleRoot).orElse(null))
                    .hashAlgorithm(hashFunction.getName())
                    .createdAt(CanonicalEncoder.truncate(clock.instant()))
                    .recordCount(records.size())
                    .build();
            Checkpoint checkpoint = signer == null ? unsigned : withSignature(unsigned);

            try {
                backend.appendCheckpoint(checkpoint);
            } catch (LedgerBackend.SequenceConflictException e) {
                log.warn("Checkpoint for anchor '{}' starting at seq {} already exists", anchorId, first.getSequence());
                return Optional.empty();
            }
            metrics.recordCheckpoint();
            log.info("Checkpoint {} for anchor '{}' covers seq {}..{} ({} records), root {}",
                    checkpoint.getCheckpointId(), anchorId, checkpoint.getRangeStartSeq(),
                    checkpoint.getRangeEndSeq(), checkpoint.getRecordCount(), checkpoint.getMerkleRoot());
            return Optional.of(checkpoint);
        } finally {
            lock.unlock();
        }
    }

    /** Sequence가 끊기는 지점 앞까지만 사용 */
    private static List<LedgerRecord> contiguous(List<LedgerRecord> records) {
        List<LedgerRecord> result = new ArrayList<>(records.size());
        for (LedgerRecord record : records) {
            if (!result.isEmpty() && record.getSequence() != result.get(result.size() - 1).getSequence() + 1) {
                log.warn("Sequence gap in anchor '{}' before seq {}", record.getAnchorId(), record.getSequence());
                break;
            }
            result.add(record);
        }
        return result;
    }

    private Checkpoint withSignature(Checkpoint unsigned) {
        return Checkpoint.builder()
                .checkpointId(unsigned.getCheckpointId())
                .anchorId(unsigned.getAnchorId())
                .rangeStartSeq(unsigned.getRangeStartSeq())
                .rangeEndSeq(unsigned.getRangeEndSeq())
                .rangeStartRecordId(unsigned.getRangeStartRecordId())
                .rangeEndRecordId(unsigned.getRangeEndRecordId())
                .merkleRoot(unsigned.getMerkleRoot())
                .prevRoot(unsigned.getPrevRoot())
                .hashAlgorithm(unsigned.getHashAlgorithm())
                .createdAt(unsigned.getCreatedAt())
                .recordCount(unsigned.getRecordCount())
                .signature(signer.sign(headerBytes(unsigned)))
                .build();
    }

    /**
     * 서명 대상 canonical 헤더 (키 정렬 JSON, 서명 필드 제외).
     */
    public static byte[] headerBytes(Checkpoint checkpoint) {
        Map<String, Object> header = new TreeMap<>();
        header.put("anchor_id", checkpoint.getAnchorId());
        header.put("checkpoint_id", checkpoint.getCheckpointId());
        header.put("created_at", CanonicalEncoder.formatTimestamp(checkpoint.getCreatedAt()));
        header.put("hash_alg", checkpoint.getHashAlgorithm());
        header.put("merkle_root", checkpoint.getMerkleRoot());
        header.put("prev_root", checkpoint.getPrevRoot());
        header.put("range_end", checkpoint.getRangeEndRecordId());
        header.put("range_end_seq", checkpoint.getRangeEndSeq());
        header.put("range_start", checkpoint.getRangeStartRecordId());
        header.put("range_start_seq", checkpoint.getRangeStartSeq());
        header.put("record_count", checkpoint.getRecordCount());
        try {
            return HEADER_MAPPER.writeValueAsBytes(header);
        } catch (JsonProcessingException e) {
            throw new EncodingException("$", "Failed to encode checkpoint header: " + e.getMessage());
        }
    }

    /**
     * 체크포인트 구간 안의 레코드에 대한 포함 증명. 구간 밖이거나 없는 레코드면 empty.
     */
    public Optional<MerkleProof> proveInclusion(String checkpointId, String recordId) {
        Optional<Checkpoint> found = backend.findCheckpoint(checkpointId);
        Optional<LedgerRecord> record = backend.findById(recordId);
        if (found.isEmpty() || record.isEmpty()) {
            return Optional.empty();
        }
        Checkpoint checkpoint = found.get();
        LedgerRecord target = record.get();
        if (!checkpoint.getAnchorId().equals(target.getAnchorId()) || !checkpoint.covers(target.getSequence())) {
            return Optional.empty();
        }

        List<LedgerRecord> records = store.fetchChain(checkpoint.getAnchorId(),
                checkpoint.getRangeStartSeq(), checkpoint.getRangeEndSeq());
        int index = (int) (target.getSequence() - checkpoint.getRangeStartSeq());
        if (index >= records.size() || !records.get(index).getRecordId().equals(recordId)) {
            return Optional.empty();
        }
        List<byte[]> leaves = MerkleTree.decode(records.stream().map(LedgerRecord::getHash).toList());
        HashFunction checkpointHash = hashFunctionFor(checkpoint);
        return Optional.of(new MerkleProof(checkpointId, recordId, target.getHash(), index, leaves.size(),
                MerkleTree.path(leaves, index, checkpointHash)));
    }

    /**
     * 증명이 가리키는 레코드가 체크포인트 구간의 해당 위치에 실제로 있고, 그 hash가 path를 따라 root가 되는지 확인.
     */
    public boolean verifyProof(MerkleProof proof) {
        Optional<Checkpoint> found = backend.findCheckpoint(proof.checkpointId());
        Optional<LedgerRecord> record = backend.findById(proof.recordId());
        if (found.isEmpty() || record.isEmpty()) {
            return false;
        }
        Checkpoint checkpoint = found.get();
        LedgerRecord target = record.get();
        if (!checkpoint.getAnchorId().equals(target.getAnchorId())
                || !checkpoint.covers(target.getSequence())
                || target.getSequence() - checkpoint.getRangeStartSeq() != proof.leafIndex()
                || proof.leafCount() != checkpoint.getRecordCount()
                || !target.getHash().equalsIgnoreCase(proof.leafHash())) {
            log.debug("Proof for record {} does not match checkpoint {}", proof.recordId(), proof.checkpointId());
            return false;
        }
        try {
            return proof.verify(checkpoint.getMerkleRoot(), hashFunctionFor(checkpoint));
        } catch (IllegalArgumentException e) {
            log.debug("Malformed proof for record {}: {}", proof.recordId(), e.getMessage());
            return false;
        }
    }

    /**
     * 저장된 레코드로 root, 레코드 수, 서명을 재검증.
     */
    public Optional<CheckpointVerification> verify(String checkpointId) {
        return backend.findCheckpoint(checkpointId).map(checkpoint -> {
            List<LedgerRecord> records = store.fetchChain(checkpoint.getAnchorId(),
                    checkpoint.getRangeStartSeq(), checkpoint.getRangeEndSeq());
            boolean countMatches = records.size() == checkpoint.getRecordCount();
            boolean rootMatches = !records.isEmpty() && MerkleTree.rootHex(
                    records.stream().map(LedgerRecord::getHash).toList(), hashFunctionFor(checkpoint))
                    .equals(checkpoint.getMerkleRoot());
            Boolean signatureValid = null;
            String message = null;
            if (checkpoint.getSignature() != null) {
                Optional<SignatureVerifier> verifier = signatureVerifiers.find(checkpoint.getSignature().algorithm());
                if (verifier.isEmpty()) {
                    signatureValid = false;
                    message = "No verifier registered for " + checkpoint.getSignature().algorithm();
                } else {
                    try {
                        signatureValid = verifier.get().verify(headerBytes(checkpoint),
                                checkpoint.getSignature().value(), checkpoint.getSignature().keyRef());
                    } catch (RuntimeException e) {
                        signatureValid = false;
                        message = "Verifier error: " + e.getMessage();
                    }
                }
            }
            if (!rootMatches || !countMatches || Boolean.FALSE.equals(signatureValid)) {
                log.warn("Checkpoint {} of anchor '{}' failed verification: root={}, count={}, signature={}",
                        checkpointId, checkpoint.getAnchorId(), rootMatches, countMatches, signatureValid);
            }
            return new CheckpointVerification(checkpointId, rootMatches, countMatches, signatureValid, message);
        });
    }

    /** 체크포인트에 기록된 알고리즘으로 재계산 */
    public HashFunction hashFunctionFor(Checkpoint checkpoint) {
        return hashFunction.getName().equalsIgnoreCase(checkpoint.getHashAlgorithm())
                ? hashFunction
                : HashFunctions.forName(checkpoint.getHashAlgorithm());
    }
}
