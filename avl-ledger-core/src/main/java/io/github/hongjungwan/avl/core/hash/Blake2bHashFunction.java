package io.github.hongjungwan.avl.core.hash;

import io.github.hongjungwan.avl.spi.HashFunction;
import org.bouncycastle.crypto.digests.Blake2bDigest;

/**
 * BLAKE2b-256 (Bouncy Castle lightweight API).
 */
public final class Blake2bHashFunction implements HashFunction {

    public static final String NAME = "BLAKE2B-256";

    private static final int DIGEST_BITS = 256;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int digestLength() {
        return DIGEST_BITS / 8;
    }

    @Override
    public byte[] digest(byte[] data) {
        Blake2bDigest digest = new Blake2bDigest(DIGEST_BITS);
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
