package io.github.hongjungwan.avl.core.signature;

import io.github.hongjungwan.avl.api.domain.RecordSignature;
import io.github.hongjungwan.avl.spi.CheckpointSigner;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

/**
 * Ed25519 체크포인트 서명자 (Bouncy Castle).
 */
public class Ed25519CheckpointSigner implements CheckpointSigner {

    private final Ed25519PrivateKeyParameters privateKey;
    private final String keyRef;

    public Ed25519CheckpointSigner(byte[] privateKey, String keyRef) {
        this.privateKey = new Ed25519PrivateKeyParameters(privateKey, 0);
        this.keyRef = keyRef;
    }

    public byte[] publicKey() {
        return privateKey.generatePublicKey().getEncoded();
    }

    @Override
    public RecordSignature sign(byte[] header) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(header, 0, header.length);
        return new RecordSignature(Ed25519SignatureVerifier.ALGORITHM, keyRef, signer.generateSignature());
    }
}
