package io.github.hongjungwan.avl.api.domain;

import java.util.Map;

/**
 * Volatile fallback에서 durable로 복사한 결과.
 *
 * @param recordsCopied     복사된 레코드 수
 * @param checkpointsCopied 복사된 체크포인트 수
 * @param anchorsCopied     완전히 복사된 anchor 수
 * @param skippedAnchors    복사하지 못한 anchor와 사유 (volatile에 남아 있음)
 * @param mode              backfill 이후 backend 모드
 */
public record BackfillReport(
        long recordsCopied,
        long checkpointsCopied,
        int anchorsCopied,
        Map<String, String> skippedAnchors,
        BackendMode mode
) {

    public boolean isComplete() {
        return skippedAnchors.isEmpty();
    }

    public static BackfillReport nothingToDo(BackendMode mode) {
        return new BackfillReport(0, 0, 0, Map.of(), mode);
    }
}
