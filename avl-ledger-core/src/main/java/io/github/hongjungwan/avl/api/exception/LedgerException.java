package io.github.hongjungwan.avl.api.exception;

/**
 * Ledger 예외의 최상위 타입. 모든 하위 예외는 unchecked.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
