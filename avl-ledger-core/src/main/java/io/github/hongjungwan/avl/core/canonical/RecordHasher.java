package io.github.hongjungwan.avl.core.canonical;

import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.RecordKind;
import io.github.hongjungwan.avl.spi.HashFunction;

import java.time.Instant;
import java.util.Map;

/**
 * Canonical 인코딩 + 해시. 순수 함수이며 I/O 없음.
 */
public class RecordHasher {

    private final CanonicalEncoder encoder;
    private final HashFunction hashFunction;

    public RecordHasher(CanonicalEncoder encoder, HashFunction hashFunction) {
        this.encoder = encoder;
        this.hashFunction = hashFunction;
    }

    public String hash(String anchorId, String slot, RecordKind kind, Instant timestamp,
                       String prevHash, Map<String, Object> normalizedPayload) {
        return hashFunction.hashHex(
                encoder.encodeRecord(anchorId, slot, kind, timestamp, prevHash, normalizedPayload));
    }

    /** 저장된 필드와 주어진 prev_hash로 재계산 */
    public String rehash(LedgerRecord record, String prevHash) {
        return hash(record.getAnchorId(), record.getSlot(), record.getKind(), record.getTimestamp(),
                prevHash, record.getPayload());
    }

    public String genesisHash() {
        return hashFunction.genesisHash();
    }

    public CanonicalEncoder getEncoder() {
        return encoder;
    }

    public HashFunction getHashFunction() {
        return hashFunction;
    }
}
