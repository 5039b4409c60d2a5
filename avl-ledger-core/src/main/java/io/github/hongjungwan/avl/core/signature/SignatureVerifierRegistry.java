package io.github.hongjungwan.avl.core.signature;

import io.github.hongjungwan.avl.spi.SignatureVerifier;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 알고리즘 태그별 SignatureVerifier 조회 (대소문자 무시).
 */
@Slf4j
public class SignatureVerifierRegistry {

    private final Map<String, SignatureVerifier> verifiers = new ConcurrentHashMap<>();

    public SignatureVerifierRegistry(Collection<? extends SignatureVerifier> initial) {
        initial.forEach(this::register);
    }

    public static SignatureVerifierRegistry empty() {
        return new SignatureVerifierRegistry(Set.of());
    }

    public void register(SignatureVerifier verifier) {
        SignatureVerifier previous = verifiers.put(key(verifier.getAlgorithm()), verifier);
        if (previous != null && previous != verifier) {
            log.warn("Signature verifier for {} replaced by {}", verifier.getAlgorithm(), verifier.getClass().getName());
        }
    }

    public Optional<SignatureVerifier> find(String algorithm) {
        return algorithm == null ? Optional.empty() : Optional.ofNullable(verifiers.get(key(algorithm)));
    }

    public Set<String> algorithms() {
        return new TreeSet<>(verifiers.keySet());
    }

    private static String key(String algorithm) {
        return algorithm.toUpperCase(Locale.ROOT);
    }
}
