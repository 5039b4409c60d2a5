package io.github.hongjungwan.avl.api.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Anchor의 연속된 레코드 구간을 요약하는 불변 Merkle 체크포인트.
 * 같은 anchor의 구간은 겹치지 않고 단조 증가하며 prevRoot로 서로 연결된다.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class Checkpoint {

    private final String checkpointId;

    private final String anchorId;

    private final long rangeStartSeq;

    private final long rangeEndSeq;

    private final String rangeStartRecordId;

    private final String rangeEndRecordId;

    private final String merkleRoot;

    /** 같은 anchor 직전 체크포인트의 root (첫 체크포인트는 null) */
    private final String prevRoot;

    private final String hashAlgorithm;

    private final RecordSignature signature;

    private final Instant createdAt;

    private final long recordCount;

    public boolean covers(long sequence) {
        return sequence >= rangeStartSeq && sequence <= rangeEndSeq;
    }
}
