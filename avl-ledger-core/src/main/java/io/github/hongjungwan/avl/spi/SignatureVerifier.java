package io.github.hongjungwan.avl.spi;

/**
 * SPI for verifying record and checkpoint signatures.
 *
 * <p>The ledger never implements a signature algorithm itself; it only hands the
 * canonical payload bytes, the signature and the key reference to the verifier
 * registered for the signature's algorithm tag.</p>
 *
 * <h2>Implementation Example:</h2>
 * <pre>{@code
 * public class DilithiumVerifier implements SignatureVerifier {
 *     public String getAlgorithm() { return "Dilithium3"; }
 *
 *     public boolean verify(byte[] payload, byte[] signature, String keyRef) {
 *         return pqcProvider.verify(keyStore.publicKey(keyRef), payload, signature);
 *     }
 * }
 * }</pre>
 */
public interface SignatureVerifier {

    /**
     * Algorithm tag this verifier handles (matched case-insensitively).
     */
    String getAlgorithm();

    /**
     * @param payload   canonical bytes that were signed
     * @param signature raw signature bytes
     * @param keyRef    key reference carried by the signature, may be null
     * @return true if the signature is valid
     */
    boolean verify(byte[] payload, byte[] signature, String keyRef);
}
