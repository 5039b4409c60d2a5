package io.github.hongjungwan.avl.core.kind;

import io.github.hongjungwan.avl.api.domain.CoreKind;
import io.github.hongjungwan.avl.api.domain.CustomKind;
import io.github.hongjungwan.avl.api.domain.RecordKind;
import io.github.hongjungwan.avl.api.exception.EncodingException;
import io.github.hongjungwan.avl.api.exception.UnknownKindException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("KindRegistry 테스트")
class KindRegistryTest {

    private final KindRegistry registry = new KindRegistry(true, Set.of("REGIME_SHIFT"));

    @Test
    @DisplayName("core kind는 항상 허용된다")
    void shouldAcceptCoreKinds() {
        assertThat(registry.validate(CoreKind.ATTESTATION)).isEqualTo(CoreKind.ATTESTATION);
    }

    @Test
    @DisplayName("core 이름을 custom으로 감싸면 core kind로 정규화된다")
    void shouldNormalizeWrappedCoreName() {
        assertThat(registry.validate(new CustomKind("UPDATE"))).isEqualTo(CoreKind.UPDATE);
        assertThat(RecordKind.of("CREATE")).isEqualTo(CoreKind.CREATE);
    }

    @Test
    @DisplayName("strict 모드에서 미등록 custom kind는 거부된다")
    void shouldRejectUnregisteredInStrictMode() {
        assertThat(registry.validate(new CustomKind("REGIME_SHIFT"))).isEqualTo(new CustomKind("REGIME_SHIFT"));

        assertThatThrownBy(() -> registry.validate(new CustomKind("SOMETHING_ELSE")))
                .isInstanceOf(UnknownKindException.class)
                .isInstanceOf(EncodingException.class);
    }

    @Test
    @DisplayName("등록 후에는 허용된다")
    void shouldAcceptAfterRegistration() {
        registry.register("POLICY_VOTE");

        assertThat(registry.isRegistered("POLICY_VOTE")).isTrue();
        assertThat(registry.validate(new CustomKind("POLICY_VOTE")).code()).isEqualTo("POLICY_VOTE");
    }

    @Test
    @DisplayName("형식이 잘못된 이름과 core 이름은 등록할 수 없다")
    void shouldRejectMalformedOrReservedNames() {
        assertThatThrownBy(() -> registry.register("lower-case")).isInstanceOf(UnknownKindException.class);
        assertThatThrownBy(() -> registry.register("CHECKPOINT")).isInstanceOf(UnknownKindException.class);
    }

    @Test
    @DisplayName("permissive 모드는 형식만 맞으면 허용한다")
    void shouldAcceptWellFormedInPermissiveMode() {
        KindRegistry permissive = KindRegistry.permissive();

        assertThat(permissive.validate(new CustomKind("ANYTHING_GOES")).code()).isEqualTo("ANYTHING_GOES");
        assertThatThrownBy(() -> permissive.validate(new CustomKind("nope")))
                .isInstanceOf(UnknownKindException.class);
    }

    @Test
    @DisplayName("kind가 없으면 거부된다")
    void shouldRejectNullKind() {
        assertThatThrownBy(() -> registry.validate(null)).isInstanceOf(UnknownKindException.class);
    }
}
