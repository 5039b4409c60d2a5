package io.github.hongjungwan.avl.api.domain;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Record 또는 checkpoint에 첨부되는 서명. 알고리즘 자체는 외부 SignatureVerifier가 처리.
 *
 * @param algorithm 알고리즘 태그 (예: {@code Ed25519}, {@code Dilithium3})
 * @param keyRef    검증 키 참조 (key id, 공개키 fingerprint 등)
 * @param value     서명 바이트
 */
public record RecordSignature(String algorithm, String keyRef, byte[] value) {

    public RecordSignature {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(value, "value");
        value = value.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    public String valueBase64() {
        return Base64.getEncoder().encodeToString(value);
    }

    public static RecordSignature ofBase64(String algorithm, String keyRef, String base64) {
        return new RecordSignature(algorithm, keyRef, Base64.getDecoder().decode(base64));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordSignature other)) return false;
        return algorithm.equals(other.algorithm)
                && Objects.equals(keyRef, other.keyRef)
                && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, keyRef, Arrays.hashCode(value));
    }

    @Override
    public String toString() {
        return "RecordSignature[" + algorithm + ", keyRef=" + keyRef + ", " + value.length + " bytes]";
    }
}
