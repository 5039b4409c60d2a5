package io.github.hongjungwan.avl.spi;

import io.github.hongjungwan.avl.api.domain.RecordSignature;

/**
 * SPI for signing checkpoint headers.
 *
 * <p>The header is the canonical JSON of the checkpoint's anchor, range, record count,
 * Merkle root, previous root, hash algorithm and creation time.</p>
 */
public interface CheckpointSigner {

    /**
     * Sign the canonical checkpoint header.
     */
    RecordSignature sign(byte[] header);
}
