package io.github.hongjungwan.avl.core.kind;

import io.github.hongjungwan.avl.api.domain.CoreKind;
import io.github.hongjungwan.avl.api.domain.CustomKind;
import io.github.hongjungwan.avl.api.domain.RecordKind;
import io.github.hongjungwan.avl.api.exception.UnknownKindException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Append 시점에 record kind를 검증하는 카탈로그.
 * Core kind는 항상 허용, custom kind는 UPPER_SNAKE_CASE이고 등록되어 있어야 한다 (strict 모드).
 */
@Slf4j
public class KindRegistry {

    private static final Pattern KIND_NAME = Pattern.compile("[A-Z][A-Z0-9_]{0,63}");

    private final boolean strict;
    private final Set<String> customKinds = ConcurrentHashMap.newKeySet();

    public KindRegistry(boolean strict, Collection<String> initialKinds) {
        this.strict = strict;
        initialKinds.forEach(this::register);
    }

    public static KindRegistry permissive() {
        return new KindRegistry(false, Set.of());
    }

    /** Custom kind 등록 */
    public CustomKind register(String name) {
        requireWellFormed(name);
        if (CoreKind.find(name).isPresent()) {
            throw new UnknownKindException(name, "name is reserved by a core kind");
        }
        if (customKinds.add(name)) {
            log.debug("Registered custom record kind {}", name);
        }
        return new CustomKind(name);
    }

    /**
     * Kind 검증. 허용되지 않으면 UnknownKindException.
     */
    public RecordKind validate(RecordKind kind) {
        if (kind == null) {
            throw new UnknownKindException("null", "kind is required");
        }
        if (kind instanceof CoreKind) {
            return kind;
        }
        String name = kind.code();
        requireWellFormed(name);
        if (CoreKind.find(name).isPresent()) {
            // Custom으로 감싼 core 이름은 core로 정규화
            return CoreKind.find(name).get();
        }
        if (strict && !customKinds.contains(name)) {
            throw new UnknownKindException(name, "not registered");
        }
        return kind;
    }

    public boolean isRegistered(String name) {
        return CoreKind.find(name).isPresent() || customKinds.contains(name);
    }

    public Set<String> customKinds() {
        return Set.copyOf(customKinds);
    }

    private static void requireWellFormed(String name) {
        if (name == null || !KIND_NAME.matcher(name).matches()) {
            throw new UnknownKindException(String.valueOf(name), "expected UPPER_SNAKE_CASE name");
        }
    }
}
