package io.github.hongjungwan.avl.core.backend;

import io.github.hongjungwan.avl.api.VerificationLedger;
import io.github.hongjungwan.avl.api.VerificationLedgerFactory;
import io.github.hongjungwan.avl.api.config.AvlConfig;
import io.github.hongjungwan.avl.api.domain.BackendMode;
import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.CoreKind;
import io.github.hongjungwan.avl.api.domain.DraftRecord;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.VerificationReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PostgreSQL 통합 테스트 (Docker 없으면 skip)
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PostgreSQL 통합 테스트")
class PostgresLedgerBackendIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

    private VerificationLedger ledger;
    private String anchor;

    @BeforeEach
    void setUp() {
        AvlConfig config = AvlConfig.durableConfig(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword())
                .toBuilder()
                .poolSize(4)
                .build();
        ledger = VerificationLedgerFactory.create(config);
        anchor = "pg-" + UUID.randomUUID();
    }

    @AfterEach
    void tearDown() {
        ledger.close();
    }

    @Test
    @DisplayName("여러 스레드의 append가 하나의 연속된 체인을 만든다")
    void concurrentAppendsFormOneChain() throws Exception {
        // given
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<LedgerRecord>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < 40; i++) {
            int n = i;
            futures.add(pool.submit(() -> ledger.append(
                    DraftRecord.of(anchor, "worker", CoreKind.UPDATE).payload(Map.of("n", n)).build())));
        }
        for (Future<LedgerRecord> future : futures) {
            future.get();
        }
        pool.shutdown();

        // then
        VerificationReport report = ledger.verify(anchor);
        assertThat(report.isValid()).isTrue();
        assertThat(report.getRecordCount()).isEqualTo(40);
        assertThat(ledger.getMode()).isEqualTo(BackendMode.DURABLE);
    }

    @Test
    @DisplayName("DB에서 직접 변조한 레코드를 찾아낸다")
    void detectsTamperingInDatabase() throws Exception {
        // given
        ledger.append(DraftRecord.of(anchor, "s", CoreKind.CREATE).payload(Map.of("v", 1)).build());
        LedgerRecord target = ledger.append(DraftRecord.of(anchor, "s", CoreKind.UPDATE)
                .payload(Map.of("v", 2)).build());

        // when
        try (Connection connection = DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(),
                postgres.getPassword());
             PreparedStatement ps = connection.prepareStatement(
                     "UPDATE avl_records SET payload = '{\"v\":3}' WHERE record_id = ?")) {
            ps.setString(1, target.getRecordId());
            ps.executeUpdate();
        }
        VerificationReport report = ledger.verify(anchor);

        // then
        assertThat(report.isValid()).isFalse();
        assertThat(report.getBrokenAt().recordId()).isEqualTo(target.getRecordId());
    }

    @Test
    @DisplayName("체크포인트는 재시작 후에도 검증된다")
    void checkpointsSurviveRestart() {
        for (int i = 0; i < 5; i++) {
            ledger.append(DraftRecord.of(anchor, "s", CoreKind.UPDATE).payload(Map.of("i", i)).build());
        }
        Checkpoint checkpoint = ledger.buildCheckpoint(anchor).orElseThrow();
        ledger.close();

        ledger = VerificationLedgerFactory.create(
                AvlConfig.durableConfig(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword()));

        assertThat(ledger.verifyCheckpoint(checkpoint.getCheckpointId()).orElseThrow().isValid()).isTrue();
        assertThat(ledger.fetchChain(anchor)).hasSize(5);
    }
}
