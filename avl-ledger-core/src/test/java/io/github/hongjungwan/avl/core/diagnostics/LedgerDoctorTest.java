package io.github.hongjungwan.avl.core.diagnostics;

import io.github.hongjungwan.avl.api.config.AvlConfig;
import io.github.hongjungwan.avl.api.domain.BackendMode;
import io.github.hongjungwan.avl.core.backend.FailoverLedgerBackend;
import io.github.hongjungwan.avl.core.backend.VolatileLedgerBackend;
import io.github.hongjungwan.avl.core.metrics.LedgerMetrics;
import io.github.hongjungwan.avl.core.signature.Ed25519SignatureVerifier;
import io.github.hongjungwan.avl.core.signature.SignatureVerifierRegistry;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("LedgerDoctor 테스트")
class LedgerDoctorTest {

    private final AvlConfig durableConfig = AvlConfig.builder()
            .backend(AvlConfig.BackendType.DURABLE)
            .jdbcUrl("jdbc:postgresql://db/avl")
            .build();

    private LedgerDoctor.DiagnosticResult result(LedgerDoctor.DiagnosticReport report, String name) {
        return report.getAllResults().stream()
                .filter(r -> r.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("volatile 설정은 경고만 남긴다")
    void volatileBackendIsWarning() {
        LedgerDoctor doctor = new LedgerDoctor(AvlConfig.defaultConfig(), new VolatileLedgerBackend(),
                SignatureVerifierRegistry.empty());

        LedgerDoctor.DiagnosticReport report = doctor.diagnose();

        assertThat(report.hasFailures()).isFalse();
        assertThat(result(report, "Hash Algorithm").getStatus()).isEqualTo(LedgerDoctor.DiagnosticResult.Status.SUCCESS);
        assertThat(result(report, "Trust Weights").getStatus()).isEqualTo(LedgerDoctor.DiagnosticResult.Status.SUCCESS);
        assertThat(result(report, "Durable Backend").getStatus()).isEqualTo(LedgerDoctor.DiagnosticResult.Status.WARNING);
        assertThat(result(report, "Signature Verifiers").getStatus()).isEqualTo(LedgerDoctor.DiagnosticResult.Status.WARNING);
    }

    @Test
    @DisplayName("durable health check 실패 시 fallback으로 전환하고 실패를 보고한다")
    void unhealthyDurableDegrades() {
        // given
        LedgerBackend durable = mock(LedgerBackend.class);
        when(durable.isHealthy()).thenReturn(false);
        FailoverLedgerBackend failover = new FailoverLedgerBackend(() -> durable, new VolatileLedgerBackend(),
                durableConfig, new LedgerMetrics());
        LedgerDoctor doctor = new LedgerDoctor(durableConfig, failover, SignatureVerifierRegistry.empty());

        // when
        LedgerDoctor.DiagnosticReport report = doctor.diagnose();

        // then
        assertThat(report.hasFailures()).isTrue();
        assertThat(report.getFailedChecks()).extracting(LedgerDoctor.DiagnosticResult::getName)
                .containsExactly("Durable Backend");
        assertThat(failover.getMode()).isEqualTo(BackendMode.DEGRADED);
        assertThat(failover.getDegradedReason()).startsWith("startup diagnostics");
    }

    @Test
    @DisplayName("정상 durable과 등록된 verifier는 모두 성공")
    void healthyDurablePasses() {
        LedgerBackend durable = mock(LedgerBackend.class);
        when(durable.isHealthy()).thenReturn(true);
        FailoverLedgerBackend failover = new FailoverLedgerBackend(() -> durable, new VolatileLedgerBackend(),
                durableConfig, new LedgerMetrics());
        SignatureVerifierRegistry verifiers = new SignatureVerifierRegistry(List.of(
                Ed25519SignatureVerifier.withKeys(Map.of())));

        LedgerDoctor.DiagnosticReport report = new LedgerDoctor(durableConfig, failover, verifiers).diagnose();

        assertThat(report.getAllResults())
                .allMatch(r -> r.getStatus() == LedgerDoctor.DiagnosticResult.Status.SUCCESS);
        assertThat(failover.getMode()).isEqualTo(BackendMode.DURABLE);
    }
}
