package io.github.hongjungwan.avl.core.verify;

import io.github.hongjungwan.avl.api.config.TrustWeights;
import io.github.hongjungwan.avl.api.domain.TrustComponents;

/**
 * 네 하위 지표의 가중합으로 trust score 계산.
 *
 * <ul>
 *   <li>fidelity: producer quality 값 평균 (값이 하나도 없으면 1.0)</li>
 *   <li>pqc_rate: 서명된 레코드 비율</li>
 *   <li>verify_rate: 서명 검증 성공 비율 (서명이 없으면 1.0)</li>
 *   <li>continuity: 단절이 없으면 1.0, 있으면 0.0</li>
 * </ul>
 */
public final class TrustScorer {

    private final TrustWeights weights;

    public TrustScorer(TrustWeights weights) {
        this.weights = weights;
    }

    public TrustWeights getWeights() {
        return weights;
    }

    /** 체인 walk 중 누적되는 집계. 단일 스레드 전용 */
    public static final class Tally {
        private long records;
        private long signed;
        private long verified;
        private long qualityCount;
        private double qualitySum;
        private boolean continuous = true;

        public void record() {
            records++;
        }

        public void signed(boolean valid) {
            signed++;
            if (valid) {
                verified++;
            }
        }

        public void quality(double value) {
            qualityCount++;
            qualitySum += value;
        }

        public void broken() {
            continuous = false;
        }

        public long records() {
            return records;
        }

        public long signedCount() {
            return signed;
        }

        public long verifiedCount() {
            return verified;
        }

        public boolean isContinuous() {
            return continuous;
        }
    }

    /** 빈 체인이면 null */
    public TrustComponents components(Tally tally) {
        if (tally.records == 0) {
            return null;
        }
        double fidelity = tally.qualityCount == 0 ? 1.0 : tally.qualitySum / tally.qualityCount;
        double pqcRate = (double) tally.signed / tally.records;
        double verifyRate = tally.signed == 0 ? 1.0 : (double) tally.verified / tally.signed;
        double continuity = tally.continuous ? 1.0 : 0.0;
        return new TrustComponents(fidelity, pqcRate, verifyRate, continuity);
    }

    /** [0,1]로 clamp한 가중합. components가 null이면 null */
    public Double score(TrustComponents components) {
        if (components == null) {
            return null;
        }
        double score = weights.fidelity() * components.fidelityMean()
                + weights.pqcRate() * components.pqcRate()
                + weights.verifyRate() * components.verifyRate()
                + weights.continuity() * components.continuity();
        return Math.max(0.0, Math.min(1.0, score));
    }
}
