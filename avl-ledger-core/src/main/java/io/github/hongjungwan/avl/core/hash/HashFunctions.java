package io.github.hongjungwan.avl.core.hash;

import io.github.hongjungwan.avl.spi.HashFunction;

import java.util.Locale;

/**
 * 설정 이름으로 HashFunction 생성.
 */
public final class HashFunctions {

    public static final String SHA_256 = "SHA-256";
    public static final String SHA3_256 = "SHA3-256";

    private HashFunctions() {}

    public static HashFunction forName(String name) {
        String normalized = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case SHA_256 -> new MessageDigestHashFunction(SHA_256);
            case SHA3_256 -> new MessageDigestHashFunction(SHA3_256);
            case Blake2bHashFunction.NAME -> new Blake2bHashFunction();
            default -> throw new IllegalArgumentException("Unsupported hash algorithm: " + name);
        };
    }

    public static HashFunction sha256() {
        return forName(SHA_256);
    }
}
