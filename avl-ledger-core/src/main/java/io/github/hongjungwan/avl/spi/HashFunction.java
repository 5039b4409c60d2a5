package io.github.hongjungwan.avl.spi;

import java.util.HexFormat;

/**
 * SPI for the digest used by record chaining and Merkle checkpoints.
 *
 * <p>Implementations must be stateless and thread-safe: the ledger calls
 * {@link #digest(byte[])} concurrently from appending and verifying threads.</p>
 *
 * <h2>Built-in Implementations:</h2>
 * <ul>
 *   <li>{@code SHA-256} and {@code SHA3-256} via the JDK {@link java.security.MessageDigest}</li>
 *   <li>{@code BLAKE2B-256} via Bouncy Castle</li>
 * </ul>
 */
public interface HashFunction {

    /**
     * Algorithm name as stored alongside checkpoints (e.g. {@code SHA-256}).
     */
    String getName();

    /**
     * Digest length in bytes.
     */
    int digestLength();

    /**
     * Compute the digest of the given bytes.
     */
    byte[] digest(byte[] data);

    /**
     * Lowercase hex digest.
     */
    default String hashHex(byte[] data) {
        return HexFormat.of().formatHex(digest(data));
    }

    /**
     * Merkle parent: {@code H(left || right)}.
     */
    default byte[] combine(byte[] left, byte[] right) {
        byte[] joined = new byte[left.length + right.length];
        System.arraycopy(left, 0, joined, 0, left.length);
        System.arraycopy(right, 0, joined, left.length, right.length);
        return digest(joined);
    }

    /**
     * Genesis sentinel used as {@code prev_hash} of the first record of every anchor.
     */
    default String genesisHash() {
        return "0".repeat(digestLength() * 2);
    }
}
