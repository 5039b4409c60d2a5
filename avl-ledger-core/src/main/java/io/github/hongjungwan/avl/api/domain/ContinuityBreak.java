package io.github.hongjungwan.avl.api.domain;

/**
 * 검증 중 발견된 첫 번째 연속성 단절 위치. 예외가 아닌 보고서의 값.
 *
 * @param recordId 단절이 시작된 레코드
 * @param sequence 해당 레코드의 체인 내 위치
 * @param position 검증 walk에서의 0 기반 순번
 * @param reason   단절 원인
 * @param expected 기대값 (재계산 해시 또는 기대 prev_hash/sequence)
 * @param actual   저장된 값
 */
public record ContinuityBreak(
        String recordId,
        long sequence,
        long position,
        Reason reason,
        String expected,
        String actual
) {

    public enum Reason {
        /** 저장된 hash가 재계산 결과와 다름 */
        HASH_MISMATCH,
        /** prev_hash가 직전 레코드의 hash와 다름 */
        PREV_HASH_MISMATCH,
        /** 첫 레코드의 prev_hash가 genesis sentinel이 아님 */
        GENESIS_MISMATCH,
        /** Sequence 누락 또는 중복 */
        SEQUENCE_GAP
    }
}
