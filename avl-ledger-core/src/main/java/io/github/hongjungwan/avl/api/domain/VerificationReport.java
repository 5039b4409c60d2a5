package io.github.hongjungwan.avl.api.domain;

import io.github.hongjungwan.avl.api.config.TrustWeights;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Anchor 체인 검증 결과. 체인 단절과 서명 실패는 이 보고서의 필드로만 표현된다.
 */
@Getter
@Builder
@ToString
public class VerificationReport {

    private final String anchorId;

    /** 모든 레코드의 해시 연결이 유효하면 true */
    private final boolean valid;

    /** 첫 단절 위치 (없으면 null) */
    private final ContinuityBreak brokenAt;

    /** 빈 체인이면 null */
    private final Double trustScore;

    /** 빈 체인이면 null */
    private final TrustComponents components;

    private final TrustWeights weights;

    private final long recordCount;

    private final long signedCount;

    private final long verifiedCount;

    @Singular
    private final List<SignatureFinding> signatureFindings;

    @Singular
    private final List<String> details;

    /** Sequence 0부터 시작하지 않는 구간을 검증한 경우 */
    private final boolean partial;

    private final Instant verifiedAt;

    public Optional<ContinuityBreak> getBrokenAtIfAny() {
        return Optional.ofNullable(brokenAt);
    }

    public boolean isEmptyChain() {
        return recordCount == 0;
    }

    /** Metrics 라벨: pass, low_trust, broken, empty */
    public String resultLabel(double lowTrustThreshold) {
        if (recordCount == 0) {
            return "empty";
        }
        if (!valid) {
            return "broken";
        }
        return trustScore >= lowTrustThreshold ? "pass" : "low_trust";
    }
}
