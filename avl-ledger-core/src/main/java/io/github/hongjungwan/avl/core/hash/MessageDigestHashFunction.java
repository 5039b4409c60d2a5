package io.github.hongjungwan.avl.core.hash;

import io.github.hongjungwan.avl.spi.HashFunction;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * JDK MessageDigest 기반 해시 (SHA-256, SHA3-256).
 * MessageDigest는 thread-safe하지 않으므로 호출마다 새 인스턴스 사용.
 */
public final class MessageDigestHashFunction implements HashFunction {

    private final String name;
    private final int digestLength;

    public MessageDigestHashFunction(String name) {
        this.name = name;
        this.digestLength = newDigest(name).getDigestLength();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int digestLength() {
        return digestLength;
    }

    @Override
    public byte[] digest(byte[] data) {
        return newDigest(name).digest(data);
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Hash algorithm not available: " + algorithm, e);
        }
    }
}
