package io.github.hongjungwan.avl.core.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MetricsExporter 테스트")
class MetricsExporterTest {

    private LedgerMetrics metrics;
    private MetricsExporter exporter;

    @BeforeEach
    void setUp() {
        metrics = new LedgerMetrics();
        exporter = new MetricsExporter(metrics);
        metrics.recordAppend("model-7", "UPDATE", LedgerMetrics.OUTCOME_SUCCESS, 2_000_000);
        metrics.recordAppend("model-7", "UPDATE", LedgerMetrics.OUTCOME_SUCCESS, 1_000_000);
        metrics.recordAppend("model-7", "UPDATE", LedgerMetrics.OUTCOME_CONFLICT, 1_000_000);
        metrics.recordChainLength("model-7", 2);
        metrics.recordVerification("model-7", "broken", 0.41, 2, true, 5_000_000);
    }

    @Nested
    @DisplayName("Prometheus")
    class PrometheusTests {

        @Test
        @DisplayName("라벨별 카운터와 gauge를 출력한다")
        void shouldRenderCounters() {
            String text = exporter.toPrometheus();

            assertThat(text).contains("# TYPE avl_appends_total counter");
            assertThat(text).contains("avl_appends_total{anchor=\"model-7\",kind=\"UPDATE\",outcome=\"success\"} 2");
            assertThat(text).contains("avl_appends_total{anchor=\"model-7\",kind=\"UPDATE\",outcome=\"conflict\"} 1");
            assertThat(text).contains("avl_verify_requests_total{result=\"broken\"} 1");
            assertThat(text).contains("avl_trust_score{anchor=\"model-7\"} 0.410000");
            assertThat(text).contains("avl_continuity_breaks_total{anchor=\"model-7\"} 1");
            assertThat(text).contains("avl_backend_degraded 0");
            assertThat(text).contains("avl_append_latency_milliseconds_count 3");
        }

        @Test
        @DisplayName("degraded 전환은 gauge와 counter에 반영된다")
        void shouldReflectDegradation() {
            metrics.recordDegraded();
            metrics.recordDegraded();

            String text = exporter.toPrometheus();

            assertThat(text).contains("avl_backend_degraded 1");
            assertThat(text).contains("avl_fallback_activations_total 1");
        }

        @Test
        @DisplayName("라벨 값은 escape된다")
        void shouldEscapeLabels() {
            assertThat(MetricsExporter.escape("a\"b\\c\nd")).isEqualTo("a\\\"b\\\\c\\nd");
        }
    }

    @Test
    @DisplayName("JSON export")
    void shouldExportJson() throws Exception {
        JsonNode json = new ObjectMapper().readTree(exporter.toJson());

        assertThat(json.get("appends")).hasSize(2);
        assertThat(json.get("trust_scores").get("model-7").asDouble()).isEqualTo(0.41);
        assertThat(json.get("backend").get("degraded").asBoolean()).isFalse();
        assertThat(json.get("latency").get("append").get("count").asLong()).isEqualTo(3);
    }

    @Test
    @DisplayName("주기적 export는 중복 시작을 거부하고 정지할 수 있다")
    void shouldExportPeriodically() throws Exception {
        CountDownLatch exported = new CountDownLatch(1);
        AtomicReference<String> last = new AtomicReference<>();

        exporter.startPeriodicExport(Duration.ofMillis(20), text -> {
            last.set(text);
            exported.countDown();
        });
        try {
            assertThat(exported.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(last.get()).contains("avl_appends_total");
            assertThatThrownBy(() -> exporter.startPeriodicExport(Duration.ofMillis(20), text -> { }))
                    .isInstanceOf(IllegalStateException.class);
        } finally {
            exporter.stopPeriodicExport();
        }
    }
}
