/**
 * Service Provider Interfaces (SPI) for the verification ledger.
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.avl.spi.HashFunction} - digest used for chaining and Merkle roots</li>
 *   <li>{@link io.github.hongjungwan.avl.spi.SignatureVerifier} - pluggable signature checks</li>
 *   <li>{@link io.github.hongjungwan.avl.spi.CheckpointSigner} - checkpoint header signing</li>
 *   <li>{@link io.github.hongjungwan.avl.spi.LedgerBackend} - record and checkpoint storage</li>
 * </ul>
 *
 * <h2>Registration:</h2>
 * <p>Pass implementations to {@code VerificationLedgerFactory.builder(config)}, or declare
 * them as beans when using the Spring Boot starter.</p>
 */
package io.github.hongjungwan.avl.spi;
