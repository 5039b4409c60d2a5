package io.github.hongjungwan.avl.core.backend;

import io.github.hongjungwan.avl.api.config.AvlConfig;
import io.github.hongjungwan.avl.api.domain.BackendStats;
import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.CoreKind;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.RecordSignature;
import io.github.hongjungwan.avl.api.domain.SearchQuery;
import io.github.hongjungwan.avl.api.exception.BackendUnavailableException;
import io.github.hongjungwan.avl.core.canonical.CanonicalEncoder;
import io.github.hongjungwan.avl.core.canonical.RecordHasher;
import io.github.hongjungwan.avl.core.hash.HashFunctions;
import io.github.hongjungwan.avl.core.id.RecordIdGenerator;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JdbcLedgerBackend (H2) 테스트")
class JdbcLedgerBackendTest {

    private final CanonicalEncoder encoder = new CanonicalEncoder();
    private final RecordHasher hasher = new RecordHasher(encoder, HashFunctions.sha256());
    private final RecordIdGenerator ids = new RecordIdGenerator();
    private JdbcLedgerBackend backend;

    @BeforeEach
    void setUp() {
        AvlConfig config = AvlConfig.builder()
                .backend(AvlConfig.BackendType.DURABLE)
                .jdbcUrl("jdbc:h2:mem:avl-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .jdbcUsername("sa")
                .jdbcPassword("")
                .poolSize(2)
                .build()
                .validate();
        backend = JdbcLedgerBackend.connect(config, encoder);
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private List<LedgerRecord> chain(String anchor, int count, Instant base) {
        List<LedgerRecord> records = new ArrayList<>();
        String prev = hasher.genesisHash();
        for (int i = 0; i < count; i++) {
            Map<String, Object> payload = encoder.normalizePayload(Map.of("i", i, "quality", 0.75));
            Instant ts = CanonicalEncoder.truncate(base.plusMillis(i));
            String hash = hasher.hash(anchor, "slot-" + (i % 2), CoreKind.UPDATE, ts, prev, payload);
            records.add(LedgerRecord.builder()
                    .recordId(ids.next())
                    .anchorId(anchor)
                    .sequence(i)
                    .slot("slot-" + (i % 2))
                    .kind(CoreKind.UPDATE)
                    .timestamp(ts)
                    .prevHash(prev)
                    .hash(hash)
                    .payload(payload)
                    .producer("test")
                    .schemaVersion(1)
                    .build());
            prev = hash;
        }
        return records;
    }

    @Nested
    @DisplayName("레코드")
    class RecordTests {

        @Test
        @DisplayName("저장한 레코드를 그대로 읽는다 (해시 재계산 일치)")
        void shouldRoundTripRecords() {
            // given
            List<LedgerRecord> records = chain("x", 3, Instant.parse("2024-05-01T00:00:00.123456Z"));
            LedgerRecord signed = records.get(2).toBuilder()
                    .signature(new RecordSignature("Ed25519", "key-1", new byte[]{1, 2, 3}))
                    .build();

            // when
            backend.append(records.get(0));
            backend.append(records.get(1));
            backend.append(signed);
            List<LedgerRecord> fetched = backend.fetch("x", 0, Long.MAX_VALUE, 100);

            // then
            assertThat(fetched).containsExactly(records.get(0), records.get(1), signed);
            assertThat(hasher.rehash(fetched.get(1), fetched.get(0).getHash())).isEqualTo(fetched.get(1).getHash());
            assertThat(backend.tail("x")).hasValueSatisfying(t -> assertThat(t.sequence()).isEqualTo(2));
        }

        @Test
        @DisplayName("같은 (anchor, seq) 재사용은 SequenceConflictException")
        void shouldDetectSequenceConflict() {
            List<LedgerRecord> records = chain("x", 1, Instant.now());
            backend.append(records.get(0));

            LedgerRecord fork = records.get(0).toBuilder().recordId(ids.next()).hash("ab".repeat(32)).build();

            assertThatThrownBy(() -> backend.append(fork))
                    .isInstanceOf(LedgerBackend.SequenceConflictException.class);
        }

        @Test
        @DisplayName("appendAll은 충돌 시 전체를 롤백한다")
        void appendAllIsAtomic() {
            List<LedgerRecord> records = chain("x", 3, Instant.now());
            backend.append(records.get(2));

            assertThatThrownBy(() -> backend.appendAll(records))
                    .isInstanceOf(LedgerBackend.SequenceConflictException.class);

            assertThat(backend.fetch("x", 0, 1, 10)).isEmpty();
        }

        @Test
        @DisplayName("hash와 id로 조회하고 slot/kind/since로 최신순 검색한다")
        void shouldFindAndSearch() {
            Instant base = Instant.parse("2024-05-01T00:00:00Z");
            List<LedgerRecord> records = chain("x", 4, base);
            backend.appendAll(records);

            assertThat(backend.findByHash(records.get(1).getHash())).contains(records.get(1));
            assertThat(backend.findById(records.get(3).getRecordId())).contains(records.get(3));
            assertThat(backend.findByHash("nope")).isEmpty();

            List<LedgerRecord> found = backend.search(SearchQuery.builder()
                    .slot("slot-0")
                    .kind(CoreKind.UPDATE)
                    .since(base)
                    .limit(10)
                    .build());
            assertThat(found).extracting(LedgerRecord::getSequence).containsExactly(2L, 0L);
        }

        @Test
        @DisplayName("통계는 레코드, anchor, 체크포인트 수를 센다")
        void shouldCountStats() {
            backend.appendAll(chain("a", 2, Instant.now()));
            backend.appendAll(chain("b", 3, Instant.now()));

            assertThat(backend.stats()).isEqualTo(new BackendStats(5, 2, 0));
            assertThat(backend.anchors()).containsExactly("a", "b");
            assertThat(backend.isHealthy()).isTrue();
        }
    }

    @Nested
    @DisplayName("체크포인트")
    class CheckpointTests {

        private Checkpoint checkpoint(long start, long end, String prevRoot) {
            return Checkpoint.builder()
                    .checkpointId(ids.next())
                    .anchorId("x")
                    .rangeStartSeq(start)
                    .rangeEndSeq(end)
                    .rangeStartRecordId("r" + start)
                    .rangeEndRecordId("r" + end)
                    .merkleRoot("cd".repeat(32))
                    .prevRoot(prevRoot)
                    .hashAlgorithm("SHA-256")
                    .createdAt(CanonicalEncoder.truncate(Instant.now()))
                    .recordCount(end - start + 1)
                    .build();
        }

        @Test
        @DisplayName("체크포인트를 저장하고 최신 것을 조회한다")
        void shouldStoreCheckpoints() {
            Checkpoint first = checkpoint(0, 9, null);
            Checkpoint second = checkpoint(10, 14, first.getMerkleRoot());

            backend.appendCheckpoint(first);
            backend.appendCheckpoint(second);

            assertThat(backend.latestCheckpoint("x")).hasValueSatisfying(cp -> {
                assertThat(cp.getCheckpointId()).isEqualTo(second.getCheckpointId());
                assertThat(cp.getPrevRoot()).isEqualTo(first.getMerkleRoot());
                assertThat(cp.getCreatedAt()).isEqualTo(second.getCreatedAt());
            });
            assertThat(backend.checkpoints("x")).hasSize(2);
            assertThat(backend.findCheckpoint(first.getCheckpointId())).isPresent();
        }

        @Test
        @DisplayName("같은 시작 위치의 체크포인트는 중복 저장되지 않는다")
        void shouldRejectOverlappingStart() {
            backend.appendCheckpoint(checkpoint(0, 9, null));

            assertThatThrownBy(() -> backend.appendCheckpoint(checkpoint(0, 4, null)))
                    .isInstanceOf(LedgerBackend.SequenceConflictException.class);
        }
    }

    @Test
    @DisplayName("연결할 수 없는 DB는 BackendUnavailableException")
    void unreachableDatabase() {
        AvlConfig unreachable = AvlConfig.builder()
                .backend(AvlConfig.BackendType.DURABLE)
                .jdbcUrl("jdbc:postgresql://127.0.0.1:1/avl")
                .operationTimeout(Duration.ofMillis(300))
                .build();

        assertThatThrownBy(() -> JdbcLedgerBackend.connect(unreachable, encoder))
                .isInstanceOf(BackendUnavailableException.class);
    }
}
