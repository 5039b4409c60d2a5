package io.github.hongjungwan.avl.core.checkpoint;

import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.CheckpointVerification;
import io.github.hongjungwan.avl.api.domain.CoreKind;
import io.github.hongjungwan.avl.api.domain.DraftRecord;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.MerkleProof;
import io.github.hongjungwan.avl.core.backend.VolatileLedgerBackend;
import io.github.hongjungwan.avl.core.canonical.CanonicalEncoder;
import io.github.hongjungwan.avl.core.canonical.RecordHasher;
import io.github.hongjungwan.avl.core.hash.HashFunctions;
import io.github.hongjungwan.avl.core.id.RecordIdGenerator;
import io.github.hongjungwan.avl.core.kind.KindRegistry;
import io.github.hongjungwan.avl.core.metrics.LedgerMetrics;
import io.github.hongjungwan.avl.core.signature.Ed25519CheckpointSigner;
import io.github.hongjungwan.avl.core.signature.Ed25519SignatureVerifier;
import io.github.hongjungwan.avl.core.signature.SignatureVerifierRegistry;
import io.github.hongjungwan.avl.core.store.ChainStore;
import io.github.hongjungwan.avl.spi.HashFunction;
import io.github.hongjungwan.avl.spi.SignatureVerifier;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("CheckpointBuilder 테스트")
class CheckpointBuilderTest {

    private final HashFunction sha256 = HashFunctions.sha256();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T09:00:00.123456789Z"), ZoneOffset.UTC);
    private final Ed25519CheckpointSigner signer =
            new Ed25519CheckpointSigner(new Ed25519PrivateKeyParameters(new SecureRandom()).getEncoded(), "cp-1");
    private final LedgerMetrics metrics = new LedgerMetrics();

    private VolatileLedgerBackend backend;
    private ChainStore store;

    @BeforeEach
    void setUp() {
        backend = new VolatileLedgerBackend();
        store = new ChainStore(backend, new RecordHasher(new CanonicalEncoder(), sha256), KindRegistry.permissive(),
                new RecordIdGenerator(), metrics, Clock.systemUTC(), 3);
    }

    private CheckpointBuilder builder(SignatureVerifierRegistry registry) {
        return new CheckpointBuilder(store, sha256, signer, registry, new RecordIdGenerator(), metrics, clock);
    }

    private CheckpointBuilder builder() {
        return builder(new SignatureVerifierRegistry(List.of(
                Ed25519SignatureVerifier.withKeys(Map.of("cp-1", signer.publicKey())))));
    }

    private List<LedgerRecord> append(String anchor, int count) {
        List<LedgerRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(store.append(DraftRecord.of(anchor, "s", CoreKind.UPDATE).payload(Map.of("i", i)).build()));
        }
        return records;
    }

    @Nested
    @DisplayName("빌드")
    class BuildTests {

        @Test
        @DisplayName("레코드 hash로 Merkle root를 계산하고 서명한다")
        void shouldBuildSignedCheckpoint() {
            // given
            List<LedgerRecord> records = append("a", 4);

            // when
            Checkpoint checkpoint = builder().build("a").orElseThrow();

            // then
            assertThat(checkpoint.getRangeStartSeq()).isZero();
            assertThat(checkpoint.getRangeEndSeq()).isEqualTo(3);
            assertThat(checkpoint.getRangeStartRecordId()).isEqualTo(records.get(0).getRecordId());
            assertThat(checkpoint.getRangeEndRecordId()).isEqualTo(records.get(3).getRecordId());
            assertThat(checkpoint.getRecordCount()).isEqualTo(4);
            assertThat(checkpoint.getPrevRoot()).isNull();
            assertThat(checkpoint.getHashAlgorithm()).isEqualTo("SHA-256");
            assertThat(checkpoint.getMerkleRoot())
                    .isEqualTo(MerkleTree.rootHex(records.stream().map(LedgerRecord::getHash).toList(), sha256));
            assertThat(checkpoint.getSignature().algorithm()).isEqualTo("Ed25519");
            assertThat(checkpoint.getSignature().keyRef()).isEqualTo("cp-1");
            assertThat(metrics.getSnapshot().checkpoints()).isEqualTo(1);
        }

        @Test
        @DisplayName("생성 시각은 마이크로초로 잘린다")
        void shouldTruncateCreatedAt() {
            append("a", 1);

            Checkpoint checkpoint = builder().build("a").orElseThrow();

            assertThat(checkpoint.getCreatedAt()).isEqualTo(Instant.parse("2026-03-01T09:00:00.123456Z"));
        }

        @Test
        @DisplayName("구간은 겹치지 않고 prevRoot로 연결된다")
        void shouldChainRanges() {
            CheckpointBuilder builder = builder();
            append("a", 3);
            Checkpoint first = builder.build("a").orElseThrow();
            append("a", 2);

            Checkpoint second = builder.build("a").orElseThrow();

            assertThat(second.getRangeStartSeq()).isEqualTo(first.getRangeEndSeq() + 1);
            assertThat(second.getRangeEndSeq()).isEqualTo(4);
            assertThat(second.getPrevRoot()).isEqualTo(first.getMerkleRoot());
        }

        @Test
        @DisplayName("새 레코드가 없거나 anchor가 없으면 empty")
        void shouldReturnEmptyWhenNothingNew() {
            CheckpointBuilder builder = builder();
            append("a", 2);
            builder.build("a");

            assertThat(builder.build("a")).isEmpty();
            assertThat(builder.build("unknown")).isEmpty();
        }

        @Test
        @DisplayName("서명자가 없으면 서명 없는 체크포인트")
        void shouldBuildUnsignedWithoutSigner() {
            append("a", 2);
            CheckpointBuilder unsigned = new CheckpointBuilder(store, sha256, null, SignatureVerifierRegistry.empty(),
                    new RecordIdGenerator(), metrics, clock);

            Checkpoint checkpoint = unsigned.build("a").orElseThrow();

            assertThat(checkpoint.getSignature()).isNull();
            assertThat(unsigned.verify(checkpoint.getCheckpointId()).orElseThrow().signatureValid()).isNull();
        }

        @Test
        @DisplayName("서명 헤더는 키 정렬된 JSON")
        void headerShouldBeSortedJson() {
            append("a", 1);
            Checkpoint checkpoint = builder().build("a").orElseThrow();

            String header = new String(CheckpointBuilder.headerBytes(checkpoint), StandardCharsets.UTF_8);

            assertThat(header).startsWith("{\"anchor_id\":\"a\",\"checkpoint_id\":");
            assertThat(header).contains("\"created_at\":\"2026-03-01T09:00:00.123456Z\"");
            assertThat(header).contains("\"prev_root\":null");
            assertThat(header).endsWith("\"record_count\":1}");
        }
    }

    @Nested
    @DisplayName("검증과 증명")
    class VerifyTests {

        @Test
        @DisplayName("저장된 레코드로 root, 개수, 서명을 재확인한다")
        void shouldVerifyCheckpoint() {
            append("a", 5);
            CheckpointBuilder builder = builder();
            Checkpoint checkpoint = builder.build("a").orElseThrow();

            CheckpointVerification verification = builder.verify(checkpoint.getCheckpointId()).orElseThrow();

            assertThat(verification.rootMatches()).isTrue();
            assertThat(verification.countMatches()).isTrue();
            assertThat(verification.signatureValid()).isTrue();
            assertThat(verification.isValid()).isTrue();
        }

        @Test
        @DisplayName("root가 맞지 않는 체크포인트는 실패")
        void shouldDetectWrongRoot() {
            List<LedgerRecord> records = append("b", 2);
            Checkpoint forged = Checkpoint.builder()
                    .checkpointId("forged")
                    .anchorId("b")
                    .rangeStartSeq(0)
                    .rangeEndSeq(1)
                    .rangeStartRecordId(records.get(0).getRecordId())
                    .rangeEndRecordId(records.get(1).getRecordId())
                    .merkleRoot("ab".repeat(32))
                    .hashAlgorithm("SHA-256")
                    .createdAt(clock.instant())
                    .recordCount(2)
                    .build();
            backend.appendCheckpoint(forged);

            CheckpointVerification verification = builder().verify("forged").orElseThrow();

            assertThat(verification.rootMatches()).isFalse();
            assertThat(verification.countMatches()).isTrue();
            assertThat(verification.isValid()).isFalse();
        }

        @Test
        @DisplayName("다른 키로 검증하면 서명 실패")
        void shouldRejectWrongKey() {
            append("a", 2);
            byte[] otherKey = new Ed25519PrivateKeyParameters(new SecureRandom()).generatePublicKey().getEncoded();
            CheckpointBuilder builder = builder(new SignatureVerifierRegistry(List.of(
                    Ed25519SignatureVerifier.withKeys(Map.of("cp-1", otherKey)))));
            Checkpoint checkpoint = builder.build("a").orElseThrow();

            CheckpointVerification verification = builder.verify(checkpoint.getCheckpointId()).orElseThrow();

            assertThat(verification.rootMatches()).isTrue();
            assertThat(verification.signatureValid()).isFalse();
        }

        @Test
        @DisplayName("verifier가 없거나 예외를 던지면 서명 실패로 보고")
        void shouldReportVerifierProblems() {
            append("a", 1);
            Checkpoint checkpoint = builder(SignatureVerifierRegistry.empty()).build("a").orElseThrow();

            SignatureVerifier broken = mock(SignatureVerifier.class);
            when(broken.getAlgorithm()).thenReturn("Ed25519");
            when(broken.verify(any(), any(), anyString())).thenThrow(new IllegalStateException("HSM offline"));

            CheckpointVerification missing = builder(SignatureVerifierRegistry.empty())
                    .verify(checkpoint.getCheckpointId()).orElseThrow();
            CheckpointVerification failing = builder(new SignatureVerifierRegistry(List.of(broken)))
                    .verify(checkpoint.getCheckpointId()).orElseThrow();

            assertThat(missing.signatureValid()).isFalse();
            assertThat(missing.message()).contains("No verifier registered for Ed25519");
            assertThat(failing.signatureValid()).isFalse();
            assertThat(failing.message()).isEqualTo("Verifier error: HSM offline");
        }

        @Test
        @DisplayName("포함 증명은 root로 재계산되고 구간 밖이나 다른 anchor는 empty")
        void shouldProveInclusion() {
            List<LedgerRecord> records = append("a", 7);
            List<LedgerRecord> others = append("other", 1);
            CheckpointBuilder builder = builder();
            Checkpoint checkpoint = builder.build("a").orElseThrow();
            LedgerRecord later = append("a", 1).get(0);

            for (LedgerRecord record : records) {
                MerkleProof proof = builder.proveInclusion(checkpoint.getCheckpointId(), record.getRecordId())
                        .orElseThrow();
                assertThat(proof.leafCount()).isEqualTo(7);
                assertThat(proof.verify(checkpoint.getMerkleRoot(), sha256)).isTrue();
            }
            assertThat(builder.proveInclusion(checkpoint.getCheckpointId(), later.getRecordId())).isEmpty();
            assertThat(builder.proveInclusion(checkpoint.getCheckpointId(), others.get(0).getRecordId())).isEmpty();
            assertThat(builder.proveInclusion("missing", records.get(0).getRecordId())).isEmpty();
        }

        @Test
        @DisplayName("없는 체크포인트 검증은 empty")
        void shouldReturnEmptyForUnknownCheckpoint() {
            assertThat(builder().verify("missing")).isEmpty();
        }
    }
}
