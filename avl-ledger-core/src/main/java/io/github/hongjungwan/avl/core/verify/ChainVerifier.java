package io.github.hongjungwan.avl.core.verify;

import io.github.hongjungwan.avl.api.domain.ContinuityBreak;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.RecordSignature;
import io.github.hongjungwan.avl.api.domain.SignatureFinding;
import io.github.hongjungwan.avl.api.domain.TrustComponents;
import io.github.hongjungwan.avl.api.domain.VerificationReport;
import io.github.hongjungwan.avl.core.canonical.RecordHasher;
import io.github.hongjungwan.avl.core.signature.SignatureVerifierRegistry;
import io.github.hongjungwan.avl.spi.SignatureVerifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * 체인을 처음부터 걸으며 각 레코드의 해시를 자신의 필드 + 직전 레코드 hash로 재계산한다.
 *
 * <p>첫 불일치 지점을 단절 위치로 보고한다. 서명 실패는 verify_rate만 낮추고 walk는 계속된다.
 * 읽기 전용이므로 레코드 단위로 취소를 확인하며 취소 시 CancellationException.</p>
 *
 * <p>sequence 0에서 시작하지 않는 구간은 호출자가 앞쪽 이력을 읽을 수 없다고 알린 경우(DEGRADED)에만
 * partial로 인정한다. 그 외에는 position 0의 SEQUENCE_GAP 단절이다.</p>
 */
@Slf4j
public class ChainVerifier {

    private final RecordHasher hasher;
    private final SignatureVerifierRegistry signatureVerifiers;
    private final TrustScorer trustScorer;
    private final List<String> qualityFields;
    private final Clock clock;

    public ChainVerifier(RecordHasher hasher, SignatureVerifierRegistry signatureVerifiers, TrustScorer trustScorer,
                         List<String> qualityFields, Clock clock) {
        this.hasher = hasher;
        this.signatureVerifiers = signatureVerifiers;
        this.trustScorer = trustScorer;
        this.qualityFields = List.copyOf(qualityFields);
        this.clock = clock;
    }

    public VerificationReport verify(String anchorId, Iterator<LedgerRecord> records, BooleanSupplier cancelled) {
        return verify(anchorId, records, false, cancelled);
    }

    /**
     * @param allowPartial true면 첫 레코드의 저장된 prev_hash에서 시작하는 구간을 허용
     */
    public VerificationReport verify(String anchorId, Iterator<LedgerRecord> records, boolean allowPartial,
                                     BooleanSupplier cancelled) {
        VerificationReport.VerificationReportBuilder report = VerificationReport.builder()
                .anchorId(anchorId)
                .weights(trustScorer.getWeights());
        TrustScorer.Tally tally = new TrustScorer.Tally();

        ContinuityBreak brokenAt = null;
        String expectedPrev = null;
        long expectedSeq = 0;
        long position = 0;
        boolean partial = false;

        while (records.hasNext()) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Verification of anchor '" + anchorId
                        + "' cancelled at position " + position);
            }
            LedgerRecord record = records.next();
            tally.record();

            if (position == 0) {
                if (record.getSequence() != 0 && allowPartial) {
                    partial = true;
                    expectedPrev = record.getPrevHash();
                    expectedSeq = record.getSequence();
                    report.detail("Chain segment starts at sequence " + record.getSequence()
                            + "; verified from its stored prev_hash");
                } else {
                    // 누락된 앞쪽 이력은 position 0의 SEQUENCE_GAP으로 보고된다
                    expectedPrev = hasher.genesisHash();
                    expectedSeq = 0;
                }
            }

            if (brokenAt == null) {
                brokenAt = checkLink(record, position, expectedPrev, expectedSeq);
                if (brokenAt != null) {
                    tally.broken();
                    report.detail("Continuity broken at " + record.getRecordId() + " (seq " + record.getSequence()
                            + "): " + brokenAt.reason());
                    log.warn("Continuity break in anchor '{}' at record {} seq {}: {}",
                            anchorId, record.getRecordId(), record.getSequence(), brokenAt.reason());
                }
            }
            expectedPrev = record.getHash();
            expectedSeq = record.getSequence() + 1;

            if (record.isSigned()) {
                checkSignature(record, tally, report);
            }
            readQuality(record).ifPresent(tally::quality);
            position++;
        }

        TrustComponents components = trustScorer.components(tally);
        Double trust = trustScorer.score(components);
        if (tally.records() == 0) {
            report.detail("Empty chain: trust score is undefined");
        }

        return report
                .valid(brokenAt == null)
                .brokenAt(brokenAt)
                .trustScore(trust)
                .components(components)
                .recordCount(tally.records())
                .signedCount(tally.signedCount())
                .verifiedCount(tally.verifiedCount())
                .partial(partial)
                .verifiedAt(clock.instant())
                .build();
    }

    private ContinuityBreak checkLink(LedgerRecord record, long position, String expectedPrev, long expectedSeq) {
        if (record.getSequence() != expectedSeq) {
            return new ContinuityBreak(record.getRecordId(), record.getSequence(), position,
                    ContinuityBreak.Reason.SEQUENCE_GAP, String.valueOf(expectedSeq),
                    String.valueOf(record.getSequence()));
        }
        if (!expectedPrev.equals(record.getPrevHash())) {
            ContinuityBreak.Reason reason = position == 0 && record.getSequence() == 0
                    ? ContinuityBreak.Reason.GENESIS_MISMATCH
                    : ContinuityBreak.Reason.PREV_HASH_MISMATCH;
            return new ContinuityBreak(record.getRecordId(), record.getSequence(), position, reason,
                    expectedPrev, record.getPrevHash());
        }
        String recomputed = hasher.rehash(record, expectedPrev);
        if (!recomputed.equals(record.getHash())) {
            return new ContinuityBreak(record.getRecordId(), record.getSequence(), position,
                    ContinuityBreak.Reason.HASH_MISMATCH, recomputed, record.getHash());
        }
        return null;
    }

    private void checkSignature(LedgerRecord record, TrustScorer.Tally tally,
                                VerificationReport.VerificationReportBuilder report) {
        RecordSignature signature = record.getSignature();
        Optional<SignatureVerifier> verifier = signatureVerifiers.find(signature.algorithm());
        if (verifier.isEmpty()) {
            tally.signed(false);
            report.signatureFinding(finding(record, SignatureFinding.Outcome.NO_VERIFIER,
                    "No verifier registered for " + signature.algorithm()));
            return;
        }
        try {
            byte[] signedBytes = hasher.getEncoder().encodePayload(record.getPayload());
            boolean valid = verifier.get().verify(signedBytes, signature.value(), signature.keyRef());
            tally.signed(valid);
            if (!valid) {
                log.warn("Invalid {} signature on record {} (keyRef {})",
                        signature.algorithm(), record.getRecordId(), signature.keyRef());
                report.signatureFinding(finding(record, SignatureFinding.Outcome.INVALID, "Signature does not verify"));
            }
        } catch (RuntimeException e) {
            tally.signed(false);
            log.warn("Signature verifier {} failed on record {}", signature.algorithm(), record.getRecordId(), e);
            report.signatureFinding(finding(record, SignatureFinding.Outcome.ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private static SignatureFinding finding(LedgerRecord record, SignatureFinding.Outcome outcome, String message) {
        return new SignatureFinding(record.getRecordId(), record.getSequence(),
                record.getSignature().algorithm(), outcome, message);
    }

    /** 첫 번째로 존재하는 quality 필드. [0,1] 범위의 숫자만 사용 */
    private Optional<Double> readQuality(LedgerRecord record) {
        for (String field : qualityFields) {
            Object value = record.getPayload().get(field);
            if (value == null) {
                continue;
            }
            if (value instanceof Number number) {
                double quality = number.doubleValue();
                if (quality >= 0.0 && quality <= 1.0) {
                    return Optional.of(quality);
                }
                log.debug("Ignoring out-of-range {}={} on record {}", field, quality, record.getRecordId());
            } else {
                log.debug("Ignoring non-numeric {} on record {}", field, record.getRecordId());
            }
            return Optional.empty();
        }
        return Optional.empty();
    }
}
