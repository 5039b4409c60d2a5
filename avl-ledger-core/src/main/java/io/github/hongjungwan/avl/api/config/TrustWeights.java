package io.github.hongjungwan.avl.api.config;

/**
 * Trust score 가중치 벡터. 네 성분 모두 [0,1], 합계 1.0 (오차 1e-6).
 *
 * @param fidelity   producer가 제공한 quality 평균의 가중치
 * @param pqcRate    서명된 레코드 비율의 가중치
 * @param verifyRate 서명 검증 성공률의 가중치
 * @param continuity 체인 연속성의 가중치
 */
public record TrustWeights(double fidelity, double pqcRate, double verifyRate, double continuity) {

    public static final double SUM_TOLERANCE = 1e-6;

    public TrustWeights {
        requireUnit("fidelity", fidelity);
        requireUnit("pqcRate", pqcRate);
        requireUnit("verifyRate", verifyRate);
        requireUnit("continuity", continuity);
        double sum = fidelity + pqcRate + verifyRate + continuity;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Trust weights must sum to 1.0 but sum to " + sum);
        }
    }

    /** 기본 가중치 [0.5, 0.2, 0.2, 0.1] */
    public static TrustWeights defaults() {
        return new TrustWeights(0.5, 0.2, 0.2, 0.1);
    }

    public static TrustWeights of(double... weights) {
        if (weights.length != 4) {
            throw new IllegalArgumentException("Expected 4 trust weights but got " + weights.length);
        }
        return new TrustWeights(weights[0], weights[1], weights[2], weights[3]);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Trust weight '" + name + "' must be in [0,1]: " + value);
        }
    }
}
