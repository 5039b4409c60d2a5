package io.github.hongjungwan.avl.api.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * Commit된 불변 ledger 레코드. Anchor별 체인의 한 노드.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString(exclude = "payload")
public class LedgerRecord {

    /** UUIDv7 (시간순 정렬, 전역 유일) */
    private final String recordId;

    private final String anchorId;

    /** Anchor 체인 내 0 기반 위치 */
    private final long sequence;

    private final String slot;

    private final RecordKind kind;

    private final Instant timestamp;

    /** 직전 레코드의 hash (첫 레코드는 genesis sentinel) */
    private final String prevHash;

    /** Canonical 인코딩 해시 (lowercase hex) */
    private final String hash;

    /** 정규화된 불변 payload */
    private final Map<String, Object> payload;

    private final RecordSignature signature;

    private final String producer;

    private final int schemaVersion;

    public boolean isSigned() {
        return signature != null;
    }
}
