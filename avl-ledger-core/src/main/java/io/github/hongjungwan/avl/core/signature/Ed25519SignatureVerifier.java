package io.github.hongjungwan.avl.core.signature;

import io.github.hongjungwan.avl.spi.SignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Ed25519 서명 검증 (Bouncy Castle). keyRef로 32바이트 공개키를 조회한다.
 */
@Slf4j
public class Ed25519SignatureVerifier implements SignatureVerifier {

    public static final String ALGORITHM = "Ed25519";

    private final Function<String, Optional<byte[]>> publicKeys;

    public Ed25519SignatureVerifier(Function<String, Optional<byte[]>> publicKeys) {
        this.publicKeys = publicKeys;
    }

    /** 고정 keyRef -> 공개키 맵 */
    public static Ed25519SignatureVerifier withKeys(Map<String, byte[]> keys) {
        Map<String, byte[]> copy = new ConcurrentHashMap<>(keys);
        return new Ed25519SignatureVerifier(ref -> ref == null ? Optional.empty() : Optional.ofNullable(copy.get(ref)));
    }

    @Override
    public String getAlgorithm() {
        return ALGORITHM;
    }

    @Override
    public boolean verify(byte[] payload, byte[] signature, String keyRef) {
        Optional<byte[]> key = publicKeys.apply(keyRef);
        if (key.isEmpty()) {
            log.debug("No Ed25519 public key for keyRef {}", keyRef);
            return false;
        }
        if (key.get().length != Ed25519PublicKeyParameters.KEY_SIZE) {
            log.debug("Ed25519 public key for keyRef {} has wrong length", keyRef);
            return false;
        }
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, new Ed25519PublicKeyParameters(key.get(), 0));
        verifier.update(payload, 0, payload.length);
        return verifier.verifySignature(signature);
    }
}
