package io.github.hongjungwan.avl.api.config;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ledger 설정. 백엔드 선택, 커넥션 풀, 체크포인트 트리거, trust 가중치, 해시 알고리즘 포함.
 */
@Getter
@Builder(toBuilder = true)
public class AvlConfig {

    public static final Set<String> SUPPORTED_HASH_ALGORITHMS = Set.of("SHA-256", "SHA3-256", "BLAKE2B-256");

    /** 저장소 백엔드: VOLATILE, DURABLE */
    @Builder.Default
    private final BackendType backend = BackendType.VOLATILE;

    /** Durable 백엔드 JDBC URL */
    private final String jdbcUrl;

    private final String jdbcUsername;

    private final String jdbcPassword;

    /** 커넥션 풀 크기 */
    @Builder.Default
    private final int poolSize = 5;

    /** Durable 연산 타임아웃 (커넥션 획득 + statement 실행) */
    @Builder.Default
    private final Duration operationTimeout = Duration.ofSeconds(5);

    @Builder.Default
    private final TrustWeights trustWeights = TrustWeights.defaults();

    /** N개 레코드마다 체크포인트 생성 */
    @Builder.Default
    private final int checkpointRecordCount = 100;

    /** 마지막 체크포인트 이후 최대 경과 시간 */
    @Builder.Default
    private final Duration checkpointInterval = Duration.ofSeconds(60);

    /** 해시 알고리즘: SHA-256, SHA3-256, BLAKE2B-256 */
    @Builder.Default
    private final String hashAlgorithm = "SHA-256";

    /** Canonical payload 최대 크기 (bytes) */
    @Builder.Default
    private final int maxPayloadBytes = 1024 * 1024;

    /** Append 경합 및 일시적 durable 실패 재시도 횟수 */
    @Builder.Default
    private final int appendRetries = 3;

    /** Circuit Breaker 실패 임계치 (durable 읽기) */
    @Builder.Default
    private final int failureThreshold = 3;

    /** 미등록 custom kind 거부 */
    @Builder.Default
    private final boolean strictKinds = true;

    @Builder.Default
    private final Set<String> customKinds = Set.of();

    /** Quality 값으로 읽을 payload 키 (첫 매칭 사용) */
    @Builder.Default
    private final List<String> qualityFields = List.of("quality", "confidence", "fidelity");

    /** 검증 결과 "pass" 판정 최소 trust */
    @Builder.Default
    private final double lowTrustThreshold = 0.7;

    public enum BackendType {
        /** 프로세스 내 메모리 (재시작 시 소실) */
        VOLATILE,
        /** JDBC 관계형 저장소 + volatile 자동 fallback */
        DURABLE;

        public static BackendType parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown backend '" + value + "', expected volatile or durable", e);
            }
        }
    }

    /**
     * 설정값 검증. 잘못된 값이면 IllegalArgumentException.
     */
    public AvlConfig validate() {
        if (backend == null) {
            throw new IllegalArgumentException("backend is required");
        }
        if (backend == BackendType.DURABLE && (jdbcUrl == null || jdbcUrl.isBlank())) {
            throw new IllegalArgumentException("jdbcUrl is required for the durable backend");
        }
        requirePositive("poolSize", poolSize);
        requirePositive("operationTimeout", operationTimeout);
        if (trustWeights == null) {
            throw new IllegalArgumentException("trustWeights is required");
        }
        requirePositive("checkpointRecordCount", checkpointRecordCount);
        requirePositive("checkpointInterval", checkpointInterval);
        if (hashAlgorithm == null || !SUPPORTED_HASH_ALGORITHMS.contains(hashAlgorithm.toUpperCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Unsupported hash algorithm '" + hashAlgorithm
                    + "', expected one of " + SUPPORTED_HASH_ALGORITHMS);
        }
        requirePositive("maxPayloadBytes", maxPayloadBytes);
        requirePositive("appendRetries", appendRetries);
        requirePositive("failureThreshold", failureThreshold);
        if (qualityFields == null) {
            throw new IllegalArgumentException("qualityFields must not be null");
        }
        if (Double.isNaN(lowTrustThreshold) || lowTrustThreshold < 0.0 || lowTrustThreshold > 1.0) {
            throw new IllegalArgumentException("lowTrustThreshold must be in [0,1]: " + lowTrustThreshold);
        }
        return this;
    }

    private static void requirePositive(String name, long value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1: " + value);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration: " + value);
        }
    }

    /** 개발용 기본 설정 (volatile) */
    public static AvlConfig defaultConfig() {
        return AvlConfig.builder().build();
    }

    /** 프로덕션 설정 (durable + fallback) */
    public static AvlConfig durableConfig(String jdbcUrl, String username, String password) {
        return AvlConfig.builder()
                .backend(BackendType.DURABLE)
                .jdbcUrl(jdbcUrl)
                .jdbcUsername(username)
                .jdbcPassword(password)
                .build();
    }
}
