package io.github.hongjungwan.avl.core.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Ledger 메트릭을 Prometheus text exposition 또는 JSON으로 내보냄 (pull 방식).
 */
@Slf4j
public final class MetricsExporter {

    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;
    private ScheduledExecutorService scheduler;

    public MetricsExporter(LedgerMetrics metrics) {
        this.metrics = metrics;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Prometheus text format
     */
    public String toPrometheus() {
        LedgerMetrics.Snapshot snapshot = metrics.getSnapshot();
        StringBuilder sb = new StringBuilder();

        header(sb, "avl_appends_total", "Append attempts by anchor, kind and outcome", "counter");
        snapshot.appends().forEach((key, count) ->
                sb.append("avl_appends_total{anchor=\"").append(escape(key.anchor()))
                        .append("\",kind=\"").append(escape(key.kind()))
                        .append("\",outcome=\"").append(key.outcome())
                        .append("\"} ").append(count).append('\n'));

        header(sb, "avl_verify_requests_total", "Verification requests by result", "counter");
        snapshot.verifyRequests().forEach((result, count) ->
                sb.append("avl_verify_requests_total{result=\"").append(result)
                        .append("\"} ").append(count).append('\n'));

        header(sb, "avl_trust_score", "Trust score of the last verification per anchor", "gauge");
        snapshot.trustScores().forEach((anchor, score) ->
                sb.append("avl_trust_score{anchor=\"").append(escape(anchor)).append("\"} ")
                        .append(String.format(Locale.ROOT, "%.6f", score)).append('\n'));

        header(sb, "avl_chain_length", "Records in the anchor chain", "gauge");
        snapshot.chainLengths().forEach((anchor, length) ->
                sb.append("avl_chain_length{anchor=\"").append(escape(anchor)).append("\"} ")
                        .append(length).append('\n'));

        header(sb, "avl_continuity_breaks_total", "Verifications that found a continuity break", "counter");
        snapshot.continuityBreaks().forEach((anchor, count) ->
                sb.append("avl_continuity_breaks_total{anchor=\"").append(escape(anchor)).append("\"} ")
                        .append(count).append('\n'));

        header(sb, "avl_backend_degraded", "1 while writes go to the volatile fallback", "gauge");
        sb.append("avl_backend_degraded ").append(snapshot.degraded() ? 1 : 0).append('\n');

        header(sb, "avl_fallback_activations_total", "Switches from durable to volatile storage", "counter");
        sb.append("avl_fallback_activations_total ").append(snapshot.fallbackActivations()).append('\n');

        header(sb, "avl_checkpoints_total", "Checkpoints built", "counter");
        sb.append("avl_checkpoints_total ").append(snapshot.checkpoints()).append('\n');

        header(sb, "avl_backfilled_records_total", "Records copied from volatile to durable storage", "counter");
        sb.append("avl_backfilled_records_total ").append(snapshot.backfilledRecords()).append('\n');

        appendLatency(sb, snapshot.appendLatency());
        appendLatency(sb, snapshot.verifyLatency());

        return sb.toString();
    }

    private static void header(StringBuilder sb, String name, String help, String type) {
        sb.append("# HELP ").append(name).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(name).append(' ').append(type).append('\n');
    }

    private static void appendLatency(StringBuilder sb, LatencyHistogram.Stats stats) {
        String name = "avl_" + stats.name() + "_latency_milliseconds";
        header(sb, name, stats.name() + " latency in milliseconds", "summary");
        sb.append(String.format(Locale.ROOT, "%s{quantile=\"0.99\"} %.3f\n", name, stats.p99Ms()));
        sb.append(String.format(Locale.ROOT, "%s_sum %.3f\n", name, stats.avgMs() * stats.count()));
        sb.append(String.format(Locale.ROOT, "%s_count %d\n", name, stats.count()));
    }

    /** Label 값 escape: backslash, 큰따옴표, 개행 */
    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    /**
     * JSON format
     */
    public String toJson() {
        LedgerMetrics.Snapshot snapshot = metrics.getSnapshot();
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", snapshot.snapshotTime().toString());
        json.put("uptime_seconds", Duration.between(snapshot.startTime(), snapshot.snapshotTime()).getSeconds());

        List<Map<String, Object>> appends = snapshot.appends().entrySet().stream()
                .map(e -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("anchor", e.getKey().anchor());
                    row.put("kind", e.getKey().kind());
                    row.put("outcome", e.getKey().outcome());
                    row.put("count", e.getValue());
                    return row;
                })
                .collect(Collectors.toList());
        json.put("appends", appends);
        json.put("verify_requests", snapshot.verifyRequests());
        json.put("trust_scores", snapshot.trustScores());
        json.put("chain_lengths", snapshot.chainLengths());
        json.put("continuity_breaks", snapshot.continuityBreaks());

        Map<String, Object> backend = new LinkedHashMap<>();
        backend.put("degraded", snapshot.degraded());
        backend.put("fallback_activations", snapshot.fallbackActivations());
        backend.put("backfilled_records", snapshot.backfilledRecords());
        json.put("backend", backend);
        json.put("checkpoints", snapshot.checkpoints());

        Map<String, Object> latency = new LinkedHashMap<>();
        latency.put("append", snapshot.appendLatency());
        latency.put("verify", snapshot.verifyLatency());
        json.put("latency", latency);

        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            log.error("Failed to export metrics as JSON", e);
            return "{}";
        }
    }

    /**
     * 주기적 export 시작 (예: 로그 또는 push gateway)
     */
    public synchronized void startPeriodicExport(Duration interval, Consumer<String> exporter) {
        if (scheduler != null) {
            throw new IllegalStateException("Periodic export already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "avl-metrics-exporter");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                exporter.accept(toPrometheus());
            } catch (RuntimeException e) {
                log.error("Failed to export metrics", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Started periodic metrics export every {}ms", interval.toMillis());
    }

    public synchronized void stopPeriodicExport() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Stopped periodic metrics export");
    }
}
