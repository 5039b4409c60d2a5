package io.github.hongjungwan.avl.api.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ledger가 기본으로 인식하는 record kind.
 */
public enum CoreKind implements RecordKind {
    CREATE,
    UPDATE,
    ANCHOR_CREATED,
    ATTESTATION,
    KEY_ROTATION,
    THRESHOLD_APPLIED,
    CHECKPOINT;

    @Override
    public String code() {
        return name();
    }

    public static Optional<CoreKind> find(String code) {
        return Arrays.stream(values())
                .filter(kind -> kind.name().equals(code))
                .findFirst();
    }
}
