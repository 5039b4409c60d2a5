package io.github.hongjungwan.avl.api.domain;

/**
 * Trust score를 구성하는 네 개의 [0,1] 하위 지표.
 */
public record TrustComponents(
        double fidelityMean,
        double pqcRate,
        double verifyRate,
        double continuity
) {
}
