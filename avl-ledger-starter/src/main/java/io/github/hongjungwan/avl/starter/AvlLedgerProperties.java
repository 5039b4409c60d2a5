package io.github.hongjungwan.avl.starter;

import io.github.hongjungwan.avl.api.config.AvlConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * AVL Ledger 설정 Properties (prefix: avl.ledger).
 */
@Data
@ConfigurationProperties(prefix = "avl.ledger")
public class AvlLedgerProperties {

    /** Ledger 활성화 여부 */
    private boolean enabled = true;

    /** 저장소: VOLATILE, DURABLE */
    private AvlConfig.BackendType backend = AvlConfig.BackendType.VOLATILE;

    /** 해시 알고리즘: SHA-256, SHA3-256, BLAKE2B-256 */
    private String hashAlgorithm = "SHA-256";

    /** Canonical payload 최대 크기 (bytes) */
    private int maxPayloadBytes = 1024 * 1024;

    /** Append 경합 및 일시적 durable 실패 재시도 횟수 */
    private int appendRetries = 3;

    /** Durable 읽기 Circuit Breaker 임계치 */
    private int failureThreshold = 3;

    /** 미등록 custom kind 거부 */
    private boolean strictKinds = true;

    /** 시작 시 등록할 custom kind */
    private Set<String> customKinds = new LinkedHashSet<>();

    /** Quality로 읽을 payload 키 (순서대로 첫 매칭) */
    private List<String> qualityFields = new ArrayList<>(List.of("quality", "confidence", "fidelity"));

    /** 검증 결과 pass 판정 최소 trust */
    private double lowTrustThreshold = 0.7;

    /** JDBC 설정 (backend=durable) */
    private JdbcProperties jdbc = new JdbcProperties();

    /** Trust score 가중치 */
    private TrustWeightsProperties trustWeights = new TrustWeightsProperties();

    /** 체크포인트 설정 */
    private CheckpointProperties checkpoint = new CheckpointProperties();

    @Data
    public static class JdbcProperties {
        private String url;
        private String username;
        private String password;
        private int poolSize = 5;
        private Duration operationTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class TrustWeightsProperties {
        private double fidelity = 0.5;
        private double pqcRate = 0.2;
        private double verifyRate = 0.2;
        private double continuity = 0.1;
    }

    @Data
    public static class CheckpointProperties {
        private int recordCount = 100;
        private Duration interval = Duration.ofSeconds(60);

        /** Ed25519 체크포인트 서명 개인키 (Base64, 32 bytes). 없으면 서명하지 않음 */
        private String signingKey;

        private String keyRef = "checkpoint";
    }
}
