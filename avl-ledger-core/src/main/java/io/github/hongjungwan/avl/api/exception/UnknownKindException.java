package io.github.hongjungwan.avl.api.exception;

/**
 * KindRegistry에 등록되지 않았거나 형식이 잘못된 record kind.
 */
public class UnknownKindException extends EncodingException {

    private final String kind;

    public UnknownKindException(String kind, String reason) {
        super(null, "Rejected record kind '" + kind + "': " + reason);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
