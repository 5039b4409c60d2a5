package io.github.hongjungwan.avl.api.exception;

/**
 * Durable backend에 도달할 수 없음 (연결 실패, 타임아웃, 풀 고갈).
 * Failover가 가능한 경로에서는 호출자에게 전달되지 않는다.
 */
public class BackendUnavailableException extends LedgerException {

    private final String backend;

    public BackendUnavailableException(String backend, String message, Throwable cause) {
        super("[" + backend + "] " + message, cause);
        this.backend = backend;
    }

    public BackendUnavailableException(String backend, String message) {
        this(backend, message, null);
    }

    public String getBackend() {
        return backend;
    }
}
