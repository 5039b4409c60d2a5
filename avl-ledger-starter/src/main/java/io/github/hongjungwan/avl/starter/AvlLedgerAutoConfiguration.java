package io.github.hongjungwan.avl.starter;

import io.github.hongjungwan.avl.api.VerificationLedger;
import io.github.hongjungwan.avl.api.VerificationLedgerFactory;
import io.github.hongjungwan.avl.api.config.AvlConfig;
import io.github.hongjungwan.avl.api.config.TrustWeights;
import io.github.hongjungwan.avl.core.signature.Ed25519CheckpointSigner;
import io.github.hongjungwan.avl.core.signature.Ed25519SignatureVerifier;
import io.github.hongjungwan.avl.spi.CheckpointSigner;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import io.github.hongjungwan.avl.spi.SignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AVL Ledger Spring Boot 자동 설정.
 *
 * <p>컨텍스트의 {@link SignatureVerifier} 빈은 모두 verifier로 등록된다.
 * {@code avl.ledger.checkpoint.signing-key}가 있으면 Ed25519로 체크포인트를 서명하고,
 * Ed25519 verifier 빈이 없을 때는 서명 검증용 verifier도 함께 등록한다.</p>
 */
@AutoConfiguration
@EnableConfigurationProperties(AvlLedgerProperties.class)
@ConditionalOnProperty(prefix = "avl.ledger", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class AvlLedgerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AvlConfig avlConfig(AvlLedgerProperties properties) {
        AvlLedgerProperties.TrustWeightsProperties weights = properties.getTrustWeights();
        return AvlConfig.builder()
                .backend(properties.getBackend())
                .jdbcUrl(properties.getJdbc().getUrl())
                .jdbcUsername(properties.getJdbc().getUsername())
                .jdbcPassword(properties.getJdbc().getPassword())
                .poolSize(properties.getJdbc().getPoolSize())
                .operationTimeout(properties.getJdbc().getOperationTimeout())
                .trustWeights(new TrustWeights(weights.getFidelity(), weights.getPqcRate(),
                        weights.getVerifyRate(), weights.getContinuity()))
                .checkpointRecordCount(properties.getCheckpoint().getRecordCount())
                .checkpointInterval(properties.getCheckpoint().getInterval())
                .hashAlgorithm(properties.getHashAlgorithm())
                .maxPayloadBytes(properties.getMaxPayloadBytes())
                .appendRetries(properties.getAppendRetries())
                .failureThreshold(properties.getFailureThreshold())
                .strictKinds(properties.isStrictKinds())
                .customKinds(Set.copyOf(properties.getCustomKinds()))
                .qualityFields(List.copyOf(properties.getQualityFields()))
                .lowTrustThreshold(properties.getLowTrustThreshold())
                .build()
                .validate();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "avl.ledger.checkpoint", name = "signing-key")
    public CheckpointSigner checkpointSigner(AvlLedgerProperties properties) {
        AvlLedgerProperties.CheckpointProperties checkpoint = properties.getCheckpoint();
        byte[] key;
        try {
            key = Base64.getDecoder().decode(checkpoint.getSigningKey().trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("avl.ledger.checkpoint.signing-key is not valid Base64", e);
        }
        if (key.length != 32) {
            throw new IllegalStateException("avl.ledger.checkpoint.signing-key must be 32 bytes but is " + key.length);
        }
        log.info("Checkpoints will be signed with Ed25519 key '{}'", checkpoint.getKeyRef());
        return new Ed25519CheckpointSigner(key, checkpoint.getKeyRef());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public VerificationLedger verificationLedger(AvlConfig config,
                                                 AvlLedgerProperties properties,
                                                 ObjectProvider<SignatureVerifier> verifiers,
                                                 ObjectProvider<CheckpointSigner> checkpointSigner,
                                                 ObjectProvider<LedgerBackend> backend) {
        List<SignatureVerifier> registered = new ArrayList<>(verifiers.orderedStream().collect(Collectors.toList()));
        CheckpointSigner signer = checkpointSigner.getIfAvailable();

        boolean hasEd25519 = registered.stream()
                .anyMatch(v -> Ed25519SignatureVerifier.ALGORITHM.equalsIgnoreCase(v.getAlgorithm()));
        if (signer instanceof Ed25519CheckpointSigner ed25519 && !hasEd25519) {
            registered.add(Ed25519SignatureVerifier.withKeys(
                    Map.of(properties.getCheckpoint().getKeyRef(), ed25519.publicKey())));
        }

        VerificationLedgerFactory.Builder builder = VerificationLedgerFactory.builder(config)
                .verifiers(registered)
                .checkpointSigner(signer);
        backend.ifAvailable(builder::backend);
        return builder.build();
    }

    @Bean
    public AvlLedgerLifecycle avlLedgerLifecycle(VerificationLedger ledger) {
        return new AvlLedgerLifecycle(ledger);
    }

    /**
     * 시작 진단과 체크포인트 스케줄러를 컨텍스트 lifecycle에 연결.
     * Ledger close는 중복 호출을 무시하므로 빈 destroy 단계와 겹쳐도 된다.
     */
    static class AvlLedgerLifecycle implements SmartLifecycle {

        private final VerificationLedger ledger;
        private volatile boolean running = false;

        AvlLedgerLifecycle(VerificationLedger ledger) {
            this.ledger = ledger;
        }

        @Override
        public void start() {
            log.info("Starting AVL ledger in {} mode...", ledger.getMode());
            ledger.start();
            running = true;
            log.info("AVL ledger started in {} mode", ledger.getMode());
        }

        @Override
        public void stop() {
            log.info("Stopping AVL ledger...");
            ledger.close();
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }
}
