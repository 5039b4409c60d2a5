package io.github.hongjungwan.avl.core.store;

import io.github.hongjungwan.avl.api.domain.ChainTail;
import io.github.hongjungwan.avl.api.domain.CoreKind;
import io.github.hongjungwan.avl.api.domain.CustomKind;
import io.github.hongjungwan.avl.api.domain.DraftRecord;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.exception.ChainConflictException;
import io.github.hongjungwan.avl.api.exception.EncodingException;
import io.github.hongjungwan.avl.core.backend.VolatileLedgerBackend;
import io.github.hongjungwan.avl.core.canonical.CanonicalEncoder;
import io.github.hongjungwan.avl.core.canonical.RecordHasher;
import io.github.hongjungwan.avl.core.hash.HashFunctions;
import io.github.hongjungwan.avl.core.id.RecordIdGenerator;
import io.github.hongjungwan.avl.core.kind.KindRegistry;
import io.github.hongjungwan.avl.core.metrics.LedgerMetrics;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ChainStore 테스트")
class ChainStoreTest {

    private final RecordHasher hasher = new RecordHasher(new CanonicalEncoder(), HashFunctions.sha256());
    private final LedgerMetrics metrics = new LedgerMetrics();
    private VolatileLedgerBackend backend;
    private ChainStore store;

    @BeforeEach
    void setUp() {
        backend = new VolatileLedgerBackend();
        store = newStore(backend);
    }

    private ChainStore newStore(LedgerBackend target) {
        return new ChainStore(target, hasher, new KindRegistry(true, Set.of("REGIME_SHIFT")),
                new RecordIdGenerator(), metrics, Clock.systemUTC(), 3);
    }

    @Nested
    @DisplayName("Append")
    class AppendTests {

        @Test
        @DisplayName("두 번째 레코드의 prev_hash는 첫 레코드의 hash다")
        void shouldLinkToPreviousRecord() {
            // when
            LedgerRecord a1 = store.append(DraftRecord.of("x", "s", CoreKind.CREATE).payload(Map.of("v", 1)).build());
            LedgerRecord a2 = store.append(DraftRecord.of("x", "s", CoreKind.UPDATE).payload(Map.of("v", 2)).build());

            // then
            assertThat(a1.getPrevHash()).isEqualTo(hasher.genesisHash());
            assertThat(a1.getSequence()).isZero();
            assertThat(a2.getPrevHash()).isEqualTo(a1.getHash());
            assertThat(a2.getSequence()).isEqualTo(1);
            assertThat(a2.getRecordId()).isGreaterThan(a1.getRecordId());
        }

        @Test
        @DisplayName("anchor마다 독립된 체인을 가진다")
        void shouldKeepAnchorsIndependent() {
            store.append(DraftRecord.of("a", "s", CoreKind.CREATE).build());
            LedgerRecord b = store.append(DraftRecord.of("b", "s", CoreKind.CREATE).build());

            assertThat(b.getSequence()).isZero();
            assertThat(b.getPrevHash()).isEqualTo(hasher.genesisHash());
        }

        @Test
        @DisplayName("거부된 payload는 아무것도 저장하지 않는다")
        void shouldStoreNothingOnEncodingError() {
            assertThatThrownBy(() -> store.append(DraftRecord.of("x", "s", CoreKind.CREATE)
                    .payload(Map.of("bad", new Object()))
                    .build()))
                    .isInstanceOf(EncodingException.class);

            assertThat(backend.tail("x")).isEmpty();
            assertThat(metrics.getSnapshot().totalAppends(LedgerMetrics.OUTCOME_ENCODING_ERROR)).isEqualTo(1);
        }

        @Test
        @DisplayName("미등록 custom kind와 빈 anchor는 거부된다")
        void shouldRejectInvalidDrafts() {
            assertThatThrownBy(() -> store.append(DraftRecord.of("x", "s", new CustomKind("UNKNOWN_KIND")).build()))
                    .isInstanceOf(EncodingException.class);
            assertThatThrownBy(() -> store.append(DraftRecord.of(" ", "s", CoreKind.CREATE).build()))
                    .isInstanceOf(EncodingException.class);

            LedgerRecord ok = store.append(DraftRecord.of("x", "s", new CustomKind("REGIME_SHIFT")).build());
            assertThat(ok.getKind().code()).isEqualTo("REGIME_SHIFT");
        }

        @Test
        @DisplayName("commit 후 리스너에 통지한다")
        void shouldNotifyListeners() {
            List<LedgerRecord> seen = new ArrayList<>();
            store.addListener(seen::add);

            LedgerRecord committed = store.append(DraftRecord.of("x", "s", CoreKind.CREATE).build());

            assertThat(seen).containsExactly(committed);
        }
    }

    @Nested
    @DisplayName("동시성")
    class ConcurrencyTests {

        @Test
        @DisplayName("같은 anchor에 N개 동시 append는 분기 없는 N개 체인을 만든다")
        void concurrentAppendsFormOneChain() throws InterruptedException {
            // given
            int threads = 8;
            int perThread = 50;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);

            // when
            for (int t = 0; t < threads; t++) {
                int writer = t;
                executor.submit(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            store.append(DraftRecord.of("shared", "writer-" + writer, CoreKind.UPDATE)
                                    .payload(Map.of("i", i))
                                    .build());
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            // then
            List<LedgerRecord> chain = store.fetchChain("shared", 0, Long.MAX_VALUE);
            assertThat(chain).hasSize(threads * perThread);
            for (int i = 0; i < chain.size(); i++) {
                assertThat(chain.get(i).getSequence()).isEqualTo(i);
                String expectedPrev = i == 0 ? hasher.genesisHash() : chain.get(i - 1).getHash();
                assertThat(chain.get(i).getPrevHash()).isEqualTo(expectedPrev);
            }
            assertThat(chain.stream().map(LedgerRecord::getHash).collect(Collectors.toSet()))
                    .hasSize(threads * perThread);
        }

        @Test
        @DisplayName("다른 writer가 tail을 선점하면 갱신된 tail로 재시도한다")
        void conflictIsRetriedAgainstRefreshedTail() {
            // given - 다른 프로세스가 seq 0을 먼저 기록한 상황
            LedgerBackend contended = mock(LedgerBackend.class);
            ChainTail foreign = new ChainTail(0, "f".repeat(64), "foreign-id");
            when(contended.tail("x")).thenReturn(Optional.empty(), Optional.of(foreign));
            doThrow(new LedgerBackend.SequenceConflictException("x", 0, null))
                    .doNothing()
                    .when(contended).append(any());
            ChainStore contendedStore = newStore(contended);

            // when
            LedgerRecord committed = contendedStore.append(DraftRecord.of("x", "s", CoreKind.UPDATE).build());

            // then
            assertThat(committed.getSequence()).isEqualTo(1);
            assertThat(committed.getPrevHash()).isEqualTo(foreign.hash());
            verify(contended, times(2)).append(any());
        }

        @Test
        @DisplayName("재시도를 소진하면 ChainConflictException")
        void conflictExhaustionFails() {
            LedgerBackend contended = mock(LedgerBackend.class);
            when(contended.tail("x")).thenReturn(Optional.empty());
            doThrow(new LedgerBackend.SequenceConflictException("x", 0, null)).when(contended).append(any());
            ChainStore contendedStore = newStore(contended);

            assertThatThrownBy(() -> contendedStore.append(DraftRecord.of("x", "s", CoreKind.UPDATE).build()))
                    .isInstanceOf(ChainConflictException.class);
            verify(contended, times(3)).append(any());
            assertThat(metrics.getSnapshot().totalAppends(LedgerMetrics.OUTCOME_CONFLICT)).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("streamChain은 페이지 경계를 넘어 모든 레코드를 순서대로 반환한다")
    void streamChainPagesThroughRecords() {
        for (int i = 0; i < 25; i++) {
            store.append(DraftRecord.of("x", "s", CoreKind.UPDATE).payload(Map.of("i", i)).build());
        }

        List<Long> sequences = store.streamChain("x", 0, Long.MAX_VALUE, 7)
                .map(LedgerRecord::getSequence)
                .collect(Collectors.toList());

        assertThat(sequences).hasSize(25).isSorted();
        assertThat(store.fetchChain("x", 10, 12)).extracting(LedgerRecord::getSequence).containsExactly(10L, 11L, 12L);
    }
}
