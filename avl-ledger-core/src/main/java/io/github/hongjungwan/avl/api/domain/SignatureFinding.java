package io.github.hongjungwan.avl.api.domain;

/**
 * 레코드 단위 서명 검증 실패. Walk를 중단하지 않고 verify_rate만 낮춘다.
 */
public record SignatureFinding(
        String recordId,
        long sequence,
        String algorithm,
        Outcome outcome,
        String message
) {

    public enum Outcome {
        /** Verifier가 false 반환 */
        INVALID,
        /** 해당 알고리즘의 verifier 미등록 */
        NO_VERIFIER,
        /** Verifier 실행 중 예외 */
        ERROR
    }
}
