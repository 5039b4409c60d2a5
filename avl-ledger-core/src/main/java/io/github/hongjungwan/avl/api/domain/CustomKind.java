package io.github.hongjungwan.avl.api.domain;

import java.util.Objects;

/**
 * Producer가 정의한 확장 kind.
 */
public record CustomKind(String code) implements RecordKind {

    public CustomKind {
        Objects.requireNonNull(code, "code");
    }

    @Override
    public String toString() {
        return code;
    }
}
