package io.github.hongjungwan.avl.core.internal;

import io.github.hongjungwan.avl.api.VerificationLedger;
import io.github.hongjungwan.avl.api.config.AvlConfig;
import io.github.hongjungwan.avl.api.domain.BackendMode;
import io.github.hongjungwan.avl.api.domain.BackendStats;
import io.github.hongjungwan.avl.api.domain.BackfillReport;
import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.CheckpointVerification;
import io.github.hongjungwan.avl.api.domain.CustomKind;
import io.github.hongjungwan.avl.api.domain.DraftRecord;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.LedgerStats;
import io.github.hongjungwan.avl.api.domain.MerkleProof;
import io.github.hongjungwan.avl.api.domain.SearchQuery;
import io.github.hongjungwan.avl.api.domain.VerificationReport;
import io.github.hongjungwan.avl.core.backend.FailoverLedgerBackend;
import io.github.hongjungwan.avl.core.backend.JdbcLedgerBackend;
import io.github.hongjungwan.avl.core.backend.VolatileLedgerBackend;
import io.github.hongjungwan.avl.core.canonical.CanonicalEncoder;
import io.github.hongjungwan.avl.core.canonical.RecordHasher;
import io.github.hongjungwan.avl.core.checkpoint.CheckpointBuilder;
import io.github.hongjungwan.avl.core.checkpoint.CheckpointScheduler;
import io.github.hongjungwan.avl.core.diagnostics.LedgerDoctor;
import io.github.hongjungwan.avl.core.hash.HashFunctions;
import io.github.hongjungwan.avl.core.id.RecordIdGenerator;
import io.github.hongjungwan.avl.core.kind.KindRegistry;
import io.github.hongjungwan.avl.core.metrics.LedgerMetrics;
import io.github.hongjungwan.avl.core.metrics.MetricsExporter;
import io.github.hongjungwan.avl.core.signature.SignatureVerifierRegistry;
import io.github.hongjungwan.avl.core.store.ChainStore;
import io.github.hongjungwan.avl.core.verify.ChainVerifier;
import io.github.hongjungwan.avl.core.verify.TrustScorer;
import io.github.hongjungwan.avl.spi.CheckpointSigner;
import io.github.hongjungwan.avl.spi.HashFunction;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import io.github.hongjungwan.avl.spi.SignatureVerifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * VerificationLedger 기본 구현. 설정에 따라 컴포넌트를 조립하고 append/verify 경로에 메트릭과 로그를 남긴다.
 */
@Slf4j
public class DefaultVerificationLedger implements VerificationLedger {

    private final AvlConfig config;
    private final LedgerMetrics metrics;
    private final LedgerBackend backend;
    private final FailoverLedgerBackend failover;
    private final CanonicalEncoder encoder;
    private final KindRegistry kindRegistry;
    private final ChainStore chainStore;
    private final ChainVerifier chainVerifier;
    private final CheckpointBuilder checkpointBuilder;
    private final CheckpointScheduler checkpointScheduler;
    private final LedgerDoctor doctor;
    private final MetricsExporter metricsExporter;
    private final Clock clock;
    private final ExecutorService verifyExecutor;

    /** 이 프로세스에서 검증된 anchor의 마지막 결과 */
    private final Map<String, LedgerStats.AnchorStatus> anchorStatus = new ConcurrentHashMap<>();

    private volatile boolean closed;

    public DefaultVerificationLedger(AvlConfig config, LedgerBackend backendOverride,
                                     Collection<? extends SignatureVerifier> verifiers,
                                     CheckpointSigner signer, Clock clock) {
        this.config = config.validate();
        this.clock = clock;
        this.metrics = new LedgerMetrics();

        HashFunction hashFunction = HashFunctions.forName(config.getHashAlgorithm());
        this.encoder = new CanonicalEncoder(config.getMaxPayloadBytes());
        RecordHasher hasher = new RecordHasher(encoder, hashFunction);

        this.backend = backendOverride != null ? backendOverride : createBackend(config, encoder, metrics);
        this.failover = backend instanceof FailoverLedgerBackend f ? f : null;

        RecordIdGenerator idGenerator = new RecordIdGenerator(clock);
        this.kindRegistry = new KindRegistry(config.isStrictKinds(), config.getCustomKinds());
        this.chainStore = new ChainStore(backend, hasher, kindRegistry, idGenerator, metrics, clock,
                config.getAppendRetries());

        SignatureVerifierRegistry signatureVerifiers = new SignatureVerifierRegistry(verifiers);
        this.chainVerifier = new ChainVerifier(hasher, signatureVerifiers, new TrustScorer(config.getTrustWeights()),
                config.getQualityFields(), clock);

        this.checkpointBuilder = new CheckpointBuilder(chainStore, hashFunction, signer, signatureVerifiers,
                idGenerator, metrics, clock);
        this.checkpointScheduler = new CheckpointScheduler(checkpointBuilder, config.getCheckpointRecordCount(),
                config.getCheckpointInterval(), clock);
        chainStore.addListener(checkpointScheduler);

        this.doctor = new LedgerDoctor(config, backend, signatureVerifiers);
        this.metricsExporter = new MetricsExporter(metrics);
        this.verifyExecutor = Executors.newCachedThreadPool(daemonThreads("avl-verify"));

        log.info("Verification ledger created: backend={}, mode={}, hash={}, checkpoint every {} records or {}",
                backend.getName(), getMode(), hashFunction.getName(), config.getCheckpointRecordCount(),
                config.getCheckpointInterval());
    }

    private static LedgerBackend createBackend(AvlConfig config, CanonicalEncoder encoder, LedgerMetrics metrics) {
        if (config.getBackend() == AvlConfig.BackendType.VOLATILE) {
            return new VolatileLedgerBackend();
        }
        return new FailoverLedgerBackend(() -> JdbcLedgerBackend.connect(config, encoder),
                new VolatileLedgerBackend(), config, metrics);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ---- append ----

    @Override
    public LedgerRecord append(DraftRecord draft) {
        ensureOpen();
        return chainStore.append(draft);
    }

    @Override
    public CustomKind registerKind(String name) {
        return kindRegistry.register(name);
    }

    @Override
    public byte[] canonicalPayload(Map<String, ?> payload) {
        return encoder.encodePayload(encoder.normalizePayload(payload));
    }

    // ---- query ----

    @Override
    public List<LedgerRecord> fetchChain(String anchorId) {
        return chainStore.fetchChain(anchorId, 0, Long.MAX_VALUE);
    }

    @Override
    public List<LedgerRecord> fetchChain(String anchorId, long fromSeq, long toSeq) {
        return chainStore.fetchChain(anchorId, fromSeq, toSeq);
    }

    @Override
    public Stream<LedgerRecord> streamChain(String anchorId) {
        return chainStore.streamChain(anchorId);
    }

    @Override
    public Optional<LedgerRecord> findById(String recordId) {
        return backend.findById(recordId);
    }

    @Override
    public Optional<LedgerRecord> findByHash(String hash) {
        return backend.findByHash(hash);
    }

    @Override
    public List<LedgerRecord> search(SearchQuery query) {
        return backend.search(query);
    }

    @Override
    public LedgerStats stats() {
        BackendStats totals = backend.stats();
        BackendMode mode = getMode();
        return new LedgerStats(totals.totalRecords(), totals.totalAnchors(), totals.totalCheckpoints(),
                mode, mode == BackendMode.DEGRADED, Map.copyOf(anchorStatus));
    }

    // ---- verification ----

    @Override
    public VerificationReport verify(String anchorId) {
        ensureOpen();
        return verifyInternal(anchorId, () -> Thread.currentThread().isInterrupted());
    }

    @Override
    public CompletableFuture<VerificationReport> verifyAsync(String anchorId) {
        ensureOpen();
        CompletableFuture<VerificationReport> future = new CompletableFuture<>();
        verifyExecutor.execute(() -> {
            if (future.isDone()) {
                return;
            }
            try {
                future.complete(verifyInternal(anchorId, future::isCancelled));
            } catch (CancellationException e) {
                future.cancel(false);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    private VerificationReport verifyInternal(String anchorId, BooleanSupplier cancelled) {
        long start = System.nanoTime();
        VerificationReport report;
        // DEGRADED에서만 durable 이력이 빠진 구간을 partial로 인정
        boolean allowPartial = getMode() == BackendMode.DEGRADED;
        try (Stream<LedgerRecord> records = chainStore.streamChain(anchorId)) {
            report = chainVerifier.verify(anchorId, records.iterator(), allowPartial, cancelled);
        } catch (CancellationException e) {
            metrics.recordVerifyCancelled();
            log.info("Verification of anchor '{}' cancelled", anchorId);
            throw e;
        }

        String result = report.resultLabel(config.getLowTrustThreshold());
        metrics.recordVerification(anchorId, result, report.getTrustScore(), report.getRecordCount(),
                report.getBrokenAt() != null, System.nanoTime() - start);
        anchorStatus.put(anchorId, new LedgerStats.AnchorStatus(report.getVerifiedAt(), report.getTrustScore(),
                report.isValid(), report.getRecordCount()));

        log.info("Verified anchor '{}': result={}, records={}, signed={}/{}, trust={}{}", anchorId, result,
                report.getRecordCount(), report.getVerifiedCount(), report.getSignedCount(), report.getTrustScore(),
                report.isPartial() ? " (partial)" : "");
        if ("low_trust".equals(result)) {
            log.warn("Trust score {} for anchor '{}' is below {}", report.getTrustScore(), anchorId,
                    config.getLowTrustThreshold());
        }
        return report;
    }

    // ---- checkpoints ----

    @Override
    public Optional<Checkpoint> buildCheckpoint(String anchorId) {
        ensureOpen();
        return checkpointScheduler.buildNow(anchorId);
    }

    @Override
    public List<Checkpoint> checkpoints(String anchorId) {
        return backend.checkpoints(anchorId);
    }

    @Override
    public Optional<Checkpoint> latestCheckpoint(String anchorId) {
        return backend.latestCheckpoint(anchorId);
    }

    @Override
    public Optional<MerkleProof> proveInclusion(String checkpointId, String recordId) {
        return checkpointBuilder.proveInclusion(checkpointId, recordId);
    }

    @Override
    public boolean verifyProof(MerkleProof proof) {
        return checkpointBuilder.verifyProof(proof);
    }

    @Override
    public Optional<CheckpointVerification> verifyCheckpoint(String checkpointId) {
        return checkpointBuilder.verify(checkpointId);
    }

    // ---- operations ----

    @Override
    public BackendMode getMode() {
        if (failover != null) {
            return failover.getMode();
        }
        return backend instanceof VolatileLedgerBackend ? BackendMode.VOLATILE : BackendMode.DURABLE;
    }

    @Override
    public BackfillReport backfill() {
        ensureOpen();
        if (failover == null) {
            log.info("Backfill requested but {} backend has no fallback", backend.getName());
            return BackfillReport.nothingToDo(getMode());
        }
        return failover.backfill();
    }

    @Override
    public String scrapeMetrics() {
        return metricsExporter.toPrometheus();
    }

    public MetricsExporter getMetricsExporter() {
        return metricsExporter;
    }

    public LedgerMetrics getMetrics() {
        return metrics;
    }

    /** 시작 진단. Durable 실패 시 DEGRADED로 전환된다 */
    public LedgerDoctor.DiagnosticReport diagnose() {
        return doctor.diagnose();
    }

    @Override
    public void start() {
        ensureOpen();
        diagnose();
        checkpointScheduler.start();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        checkpointScheduler.stop();
        metricsExporter.stopPeriodicExport();
        verifyExecutor.shutdown();
        try {
            if (!verifyExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                verifyExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            verifyExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        backend.close();
        log.info("Verification ledger closed ({} records appended this session)",
                metrics.getSnapshot().totalAppends(LedgerMetrics.OUTCOME_SUCCESS));
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Verification ledger is closed");
        }
    }
}
