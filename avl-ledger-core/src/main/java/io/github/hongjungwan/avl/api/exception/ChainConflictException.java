package io.github.hongjungwan.avl.api.exception;

/**
 * 동일 anchor에 대한 append 경합이 재시도 한도 내에서 해소되지 않음.
 * 호출자는 논리적 작업 전체를 다시 시도해야 한다.
 */
public class ChainConflictException extends LedgerException {

    private final String anchorId;
    private final int attempts;

    public ChainConflictException(String anchorId, int attempts, Throwable cause) {
        super("Append to anchor '" + anchorId + "' lost the tail race " + attempts + " time(s)", cause);
        this.anchorId = anchorId;
        this.attempts = attempts;
    }

    public String getAnchorId() {
        return anchorId;
    }

    public int getAttempts() {
        return attempts;
    }
}
