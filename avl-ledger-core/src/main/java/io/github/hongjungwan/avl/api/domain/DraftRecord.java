package io.github.hongjungwan.avl.api.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * Producer가 제출하는 append 요청. record_id, hash, prev_hash는 ledger가 부여한다.
 */
@Getter
@Builder
public class DraftRecord {

    private final String anchorId;

    /** Producer slot 라벨 */
    private final String slot;

    private final RecordKind kind;

    /** Producer 제공 시각. null이면 ledger clock 사용 */
    private final Instant timestamp;

    @Builder.Default
    private final Map<String, Object> payload = Map.of();

    private final RecordSignature signature;

    @Builder.Default
    private final String producer = "unknown";

    @Builder.Default
    private final int schemaVersion = 1;

    public static DraftRecordBuilder of(String anchorId, String slot, RecordKind kind) {
        return builder().anchorId(anchorId).slot(slot).kind(kind);
    }
}
