package io.github.hongjungwan.avl.api;

import io.github.hongjungwan.avl.api.domain.BackfillReport;
import io.github.hongjungwan.avl.api.domain.BackendMode;
import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.CheckpointVerification;
import io.github.hongjungwan.avl.api.domain.CustomKind;
import io.github.hongjungwan.avl.api.domain.DraftRecord;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.LedgerStats;
import io.github.hongjungwan.avl.api.domain.MerkleProof;
import io.github.hongjungwan.avl.api.domain.SearchQuery;
import io.github.hongjungwan.avl.api.domain.VerificationReport;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Autonomous Verification Ledger의 메인 인터페이스. Anchor별 해시 체인에 레코드를 추가하고 검증한다.
 *
 * <p>프로세스 시작 시 {@link VerificationLedgerFactory}로 한 번 생성하여 producer와 consumer에 전달한다.
 * 전역 인스턴스는 없다.</p>
 */
public interface VerificationLedger extends AutoCloseable {

    // ---- append ----

    /**
     * 레코드를 anchor 체인 끝에 원자적으로 추가.
     *
     * @throws io.github.hongjungwan.avl.api.exception.EncodingException      payload/kind 거부
     * @throws io.github.hongjungwan.avl.api.exception.ChainConflictException 경합 재시도 소진
     */
    LedgerRecord append(DraftRecord draft);

    /** Custom kind 등록 (upper-snake-case) */
    CustomKind registerKind(String name);

    /**
     * 서명 대상 canonical payload bytes. Producer는 이 bytes에 서명해야 검증을 통과한다.
     */
    byte[] canonicalPayload(Map<String, ?> payload);

    // ---- query ----

    List<LedgerRecord> fetchChain(String anchorId);

    /** 포함 범위 [fromSeq, toSeq] */
    List<LedgerRecord> fetchChain(String anchorId, long fromSeq, long toSeq);

    /** 페이지 단위 지연 조회. 사용 후 close 불필요 */
    Stream<LedgerRecord> streamChain(String anchorId);

    Optional<LedgerRecord> findById(String recordId);

    Optional<LedgerRecord> findByHash(String hash);

    /** 최신순 */
    List<LedgerRecord> search(SearchQuery query);

    LedgerStats stats();

    // ---- verification ----

    /**
     * 체인 전체를 재계산하여 연속성과 trust score를 보고. 체인이 깨져도 예외가 아닌 결과로 반환한다.
     */
    VerificationReport verify(String anchorId);

    /**
     * 별도 스레드에서 검증. 반환된 future를 cancel하면 다음 레코드에서 중단된다.
     */
    CompletableFuture<VerificationReport> verifyAsync(String anchorId);

    // ---- checkpoints ----

    /** 마지막 체크포인트 이후 레코드가 있으면 즉시 생성 */
    Optional<Checkpoint> buildCheckpoint(String anchorId);

    List<Checkpoint> checkpoints(String anchorId);

    Optional<Checkpoint> latestCheckpoint(String anchorId);

    Optional<MerkleProof> proveInclusion(String checkpointId, String recordId);

    /** Proof를 체크포인트 root와 비교 */
    boolean verifyProof(MerkleProof proof);

    Optional<CheckpointVerification> verifyCheckpoint(String checkpointId);

    // ---- operations ----

    BackendMode getMode();

    /**
     * Volatile fallback에 쌓인 레코드를 durable로 복사 (운영자 수동 실행).
     */
    BackfillReport backfill();

    /** Prometheus text exposition */
    String scrapeMetrics();

    /** 백그라운드 체크포인트 스케줄러 시작 */
    void start();

    @Override
    void close();
}
