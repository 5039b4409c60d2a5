package io.github.hongjungwan.avl.core.diagnostics;

import io.github.hongjungwan.avl.api.config.AvlConfig;
import io.github.hongjungwan.avl.api.config.TrustWeights;
import io.github.hongjungwan.avl.core.backend.FailoverLedgerBackend;
import io.github.hongjungwan.avl.core.hash.HashFunctions;
import io.github.hongjungwan.avl.core.signature.SignatureVerifierRegistry;
import io.github.hongjungwan.avl.spi.HashFunction;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Doctor Service - Ledger 자가 진단
 *
 * 시작 시 (SmartLifecycle.start) 다음을 확인:
 * 1. Hash 알고리즘 사용 가능 여부
 * 2. Trust 가중치 유효성
 * 3. Durable backend 연결
 * 4. Signature verifier 등록 상태
 *
 * Durable 연결 실패 시 즉시 DEGRADED 모드로 전환
 */
@Slf4j
public class LedgerDoctor {

    private static final byte[] PROBE = "avl-doctor".getBytes(StandardCharsets.UTF_8);

    private final AvlConfig config;
    private final LedgerBackend backend;
    private final SignatureVerifierRegistry signatureVerifiers;

    public LedgerDoctor(AvlConfig config, LedgerBackend backend, SignatureVerifierRegistry signatureVerifiers) {
        this.config = config;
        this.backend = backend;
        this.signatureVerifiers = signatureVerifiers;
    }

    /**
     * 전체 진단 실행
     */
    public DiagnosticReport diagnose() {
        log.info("Running ledger diagnostic checks...");

        List<DiagnosticResult> results = new ArrayList<>();
        results.add(checkHashAlgorithm());
        results.add(checkTrustWeights());
        results.add(checkDurableConnectivity());
        results.add(checkSignatureVerifiers());

        DiagnosticReport report = new DiagnosticReport(results);
        if (report.hasFailures()) {
            log.warn("Diagnostic failures detected:");
            report.getFailedChecks().forEach(result ->
                    log.warn("  - {}: {}", result.getName(), result.getMessage()));
        } else {
            log.info("All diagnostic checks passed successfully");
        }
        return report;
    }

    private DiagnosticResult checkHashAlgorithm() {
        String name = "Hash Algorithm";
        try {
            HashFunction hashFunction = HashFunctions.forName(config.getHashAlgorithm());
            byte[] digest = hashFunction.digest(PROBE);
            if (digest.length != hashFunction.digestLength()) {
                return DiagnosticResult.failure(name, hashFunction.getName() + " produced " + digest.length
                        + " bytes, expected " + hashFunction.digestLength());
            }
            return DiagnosticResult.success(name, hashFunction.getName() + " available");
        } catch (RuntimeException e) {
            return DiagnosticResult.failure(name, "Unavailable: " + e.getMessage());
        }
    }

    private DiagnosticResult checkTrustWeights() {
        String name = "Trust Weights";
        TrustWeights weights = config.getTrustWeights();
        if (weights == null) {
            return DiagnosticResult.failure(name, "Not configured");
        }
        double sum = weights.fidelity() + weights.pqcRate() + weights.verifyRate() + weights.continuity();
        if (Math.abs(sum - 1.0) > TrustWeights.SUM_TOLERANCE) {
            return DiagnosticResult.failure(name, "Weights sum to " + sum);
        }
        return DiagnosticResult.success(name, weights.toString());
    }

    private DiagnosticResult checkDurableConnectivity() {
        String name = "Durable Backend";
        if (config.getBackend() != AvlConfig.BackendType.DURABLE) {
            return DiagnosticResult.warning(name, "Volatile backend configured - records are not persisted");
        }
        if (backend instanceof FailoverLedgerBackend failover) {
            if (failover.isDegraded()) {
                return DiagnosticResult.failure(name, "Already degraded: " + failover.getDegradedReason());
            }
            if (!failover.isHealthy()) {
                failover.degrade("startup diagnostics: durable health check failed");
                return DiagnosticResult.failure(name, "Health check failed - switched to volatile fallback");
            }
            return DiagnosticResult.success(name, "Connected");
        }
        return backend.isHealthy()
                ? DiagnosticResult.success(name, "Connected")
                : DiagnosticResult.failure(name, "Health check failed");
    }

    private DiagnosticResult checkSignatureVerifiers() {
        String name = "Signature Verifiers";
        if (signatureVerifiers.algorithms().isEmpty()) {
            return DiagnosticResult.warning(name, "No verifier registered - signed records will count as unverified");
        }
        return DiagnosticResult.success(name, "Registered: " + signatureVerifiers.algorithms());
    }

    /**
     * 진단 결과
     */
    public static class DiagnosticResult {
        private final String name;
        private final Status status;
        private final String message;

        public enum Status {
            SUCCESS, WARNING, FAILURE
        }

        private DiagnosticResult(String name, Status status, String message) {
            this.name = name;
            this.status = status;
            this.message = message;
        }

        public static DiagnosticResult success(String name, String message) {
            return new DiagnosticResult(name, Status.SUCCESS, message);
        }

        public static DiagnosticResult warning(String name, String message) {
            return new DiagnosticResult(name, Status.WARNING, message);
        }

        public static DiagnosticResult failure(String name, String message) {
            return new DiagnosticResult(name, Status.FAILURE, message);
        }

        public String getName() {
            return name;
        }

        public Status getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }

        public boolean isFailure() {
            return status == Status.FAILURE;
        }
    }

    /**
     * 진단 보고서
     */
    public static class DiagnosticReport {
        private final List<DiagnosticResult> results;

        public DiagnosticReport(List<DiagnosticResult> results) {
            this.results = List.copyOf(results);
        }

        public boolean hasFailures() {
            return results.stream().anyMatch(DiagnosticResult::isFailure);
        }

        public List<DiagnosticResult> getFailedChecks() {
            return results.stream()
                    .filter(DiagnosticResult::isFailure)
                    .toList();
        }

        public List<DiagnosticResult> getAllResults() {
            return results;
        }
    }
}
