package io.github.hongjungwan.avl.api.domain;

/**
 * Record 분류. 닫힌 core 집합({@link CoreKind})과 registry로 검증되는 확장 이름({@link CustomKind}).
 */
public sealed interface RecordKind permits CoreKind, CustomKind {

    /** 저장 및 해시에 사용되는 이름 */
    String code();

    /** 이름으로 kind 해석. Core 이름이면 enum, 아니면 custom. 검증은 KindRegistry 담당. */
    static RecordKind of(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
        return CoreKind.find(code)
                .<RecordKind>map(kind -> kind)
                .orElseGet(() -> new CustomKind(code));
    }
}
