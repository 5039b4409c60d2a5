package io.github.hongjungwan.avl.api.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Stats() 조회 결과.
 *
 * @param anchors anchor별 마지막 검증 상태 (이 프로세스에서 검증된 anchor만)
 */
public record LedgerStats(
        long totalRecords,
        long totalAnchors,
        long totalCheckpoints,
        BackendMode mode,
        boolean degraded,
        Map<String, AnchorStatus> anchors
) {

    /** Anchor별 마지막 검증 결과 */
    public record AnchorStatus(Instant lastVerifiedAt, Double lastTrustScore, boolean lastValid, long chainLength) {
    }
}
