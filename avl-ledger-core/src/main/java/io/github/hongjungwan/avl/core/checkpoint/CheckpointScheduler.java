package io.github.hongjungwan.avl.core.checkpoint;

import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.core.store.ChainStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 레코드 수 또는 경과 시간 조건으로 anchor별 체크포인트를 백그라운드에서 생성.
 *
 * <p>Append 경로에서는 카운터만 갱신하고 실제 빌드는 단일 "avl-checkpoint" 스레드에서 수행한다.
 * Anchor당 대기 중인 빌드는 최대 하나.</p>
 */
@Slf4j
public class CheckpointScheduler implements ChainStore.AppendListener, AutoCloseable {

    private static final Duration MIN_TICK = Duration.ofMillis(50);

    private final CheckpointBuilder builder;
    private final int recordCount;
    private final Duration interval;
    private final Clock clock;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    private volatile ScheduledExecutorService executor;

    public CheckpointScheduler(CheckpointBuilder builder, int recordCount, Duration interval, Clock clock) {
        this.builder = builder;
        this.recordCount = recordCount;
        this.interval = interval;
        this.clock = clock;
    }

    /** Anchor별 미체크포인트 상태 */
    private static final class Pending {
        long lastSequence = -1;
        long checkpointedThrough = -1;
        Instant oldestPendingAt;
        boolean buildQueued;

        synchronized boolean onAppend(long sequence, Instant now, int threshold) {
            lastSequence = Math.max(lastSequence, sequence);
            if (oldestPendingAt == null) {
                oldestPendingAt = now;
            }
            return claimIf(lastSequence - checkpointedThrough >= threshold);
        }

        synchronized boolean onTick(Instant now, Duration interval) {
            return claimIf(oldestPendingAt != null && !now.isBefore(oldestPendingAt.plus(interval)));
        }

        synchronized boolean hasPending() {
            return lastSequence > checkpointedThrough;
        }

        private boolean claimIf(boolean due) {
            if (due && !buildQueued) {
                buildQueued = true;
                return true;
            }
            return false;
        }

        synchronized void completed(Optional<Checkpoint> checkpoint, Instant now) {
            buildQueued = false;
            checkpoint.ifPresent(cp -> checkpointedThrough = Math.max(checkpointedThrough, cp.getRangeEndSeq()));
            // 빌드 중 들어온 레코드나 실패한 구간은 다음 interval에 다시 시도
            oldestPendingAt = lastSequence > checkpointedThrough ? now : null;
        }

        synchronized void released() {
            buildQueued = false;
        }
    }

    @Override
    public void onAppend(LedgerRecord record) {
        Pending state = pending.computeIfAbsent(record.getAnchorId(), k -> new Pending());
        if (state.onAppend(record.getSequence(), clock.instant(), recordCount)) {
            submit(record.getAnchorId(), state);
        }
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "avl-checkpoint");
            t.setDaemon(true);
            return t;
        });
        long tickMillis = Math.max(interval.dividedBy(2).toMillis(), MIN_TICK.toMillis());
        scheduler.scheduleAtFixedRate(this::tick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        executor = scheduler;
        log.info("Checkpoint scheduler started (every {} records or {})", recordCount, interval);
    }

    public synchronized void stop() {
        ScheduledExecutorService scheduler = executor;
        if (scheduler == null) {
            return;
        }
        executor = null;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Checkpoint scheduler stopped");
    }

    public boolean isRunning() {
        return executor != null;
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * 미체크포인트 레코드가 있는 모든 anchor를 호출 스레드에서 즉시 빌드.
     */
    public List<Checkpoint> flush() {
        List<Checkpoint> built = new ArrayList<>();
        pending.forEach((anchorId, state) -> {
            if (state.hasPending()) {
                buildNow(anchorId).ifPresent(built::add);
            }
        });
        return built;
    }

    /** 조건과 무관하게 anchor 체크포인트 생성 */
    public Optional<Checkpoint> buildNow(String anchorId) {
        Optional<Checkpoint> checkpoint = builder.build(anchorId);
        Pending state = pending.get(anchorId);
        if (state != null) {
            synchronized (state) {
                checkpoint.ifPresent(cp -> state.checkpointedThrough = Math.max(state.checkpointedThrough, cp.getRangeEndSeq()));
                if (state.lastSequence <= state.checkpointedThrough) {
                    state.oldestPendingAt = null;
                }
            }
        }
        return checkpoint;
    }

    void tick() {
        Instant now = clock.instant();
        pending.forEach((anchorId, state) -> {
            if (state.onTick(now, interval)) {
                submit(anchorId, state);
            }
        });
    }

    private void submit(String anchorId, Pending state) {
        ScheduledExecutorService scheduler = executor;
        if (scheduler == null) {
            state.released();
            return;
        }
        try {
            scheduler.execute(() -> runBuild(anchorId, state));
        } catch (RejectedExecutionException e) {
            state.released();
            log.debug("Checkpoint for anchor '{}' not scheduled, scheduler is shutting down", anchorId);
        }
    }

    private void runBuild(String anchorId, Pending state) {
        Optional<Checkpoint> checkpoint = Optional.empty();
        try {
            checkpoint = builder.build(anchorId);
        } catch (RuntimeException e) {
            log.error("Checkpoint build failed for anchor '{}'", anchorId, e);
        } finally {
            state.completed(checkpoint, clock.instant());
        }
    }
}
