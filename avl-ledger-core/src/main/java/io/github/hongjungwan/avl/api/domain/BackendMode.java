package io.github.hongjungwan.avl.api.domain;

/**
 * 현재 레코드가 기록되는 저장소 상태.
 */
public enum BackendMode {
    /** 설정상 volatile 전용 */
    VOLATILE,
    /** Durable 정상 */
    DURABLE,
    /** Durable 장애로 volatile fallback 중 (backfill 전까지 유지) */
    DEGRADED
}
