package io.github.hongjungwan.avl.api;

import io.github.hongjungwan.avl.api.config.AvlConfig;
import io.github.hongjungwan.avl.core.internal.DefaultVerificationLedger;
import io.github.hongjungwan.avl.spi.CheckpointSigner;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import io.github.hongjungwan.avl.spi.SignatureVerifier;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * VerificationLedger 인스턴스 생성. 호출마다 독립된 ledger를 만든다.
 */
public final class VerificationLedgerFactory {

    private VerificationLedgerFactory() {}

    /** 설정 기반 ledger 생성 */
    public static VerificationLedger create(AvlConfig config) {
        return builder(config).build();
    }

    /** Verifier, signer 등 플러그인을 지정하는 빌더 */
    public static Builder builder(AvlConfig config) {
        return new Builder(config);
    }

    public static final class Builder {
        private final AvlConfig config;
        private final List<SignatureVerifier> verifiers = new ArrayList<>();
        private CheckpointSigner signer;
        private LedgerBackend backend;
        private Clock clock = Clock.systemUTC();

        private Builder(AvlConfig config) {
            this.config = config;
        }

        public Builder verifier(SignatureVerifier verifier) {
            this.verifiers.add(verifier);
            return this;
        }

        public Builder verifiers(Collection<? extends SignatureVerifier> verifiers) {
            this.verifiers.addAll(verifiers);
            return this;
        }

        /** 체크포인트 서명. 미지정 시 체크포인트는 서명되지 않음 */
        public Builder checkpointSigner(CheckpointSigner signer) {
            this.signer = signer;
            return this;
        }

        /** 설정의 backend 대신 사용할 저장소 (테스트, 커스텀 저장소) */
        public Builder backend(LedgerBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public VerificationLedger build() {
            return new DefaultVerificationLedger(config, backend, verifiers, signer, clock);
        }
    }
}
