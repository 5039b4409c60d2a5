package io.github.hongjungwan.avl.api.exception;

/**
 * Payload가 canonical 인코딩 규칙을 위반하여 해시/저장 전에 거부됨.
 */
public class EncodingException extends LedgerException {

    /** 위반이 발견된 payload 경로 (예: {@code $.items[2].score}) */
    private final String path;

    public EncodingException(String path, String message) {
        super(path == null ? message : message + " at " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
