package io.github.hongjungwan.avl.api.domain;

/**
 * 저장된 레코드로 체크포인트를 재계산한 결과.
 *
 * @param signatureValid 서명이 없으면 null
 */
public record CheckpointVerification(
        String checkpointId,
        boolean rootMatches,
        boolean countMatches,
        Boolean signatureValid,
        String message
) {

    public boolean isValid() {
        return rootMatches && countMatches && !Boolean.FALSE.equals(signatureValid);
    }
}
