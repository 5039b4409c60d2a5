package io.github.hongjungwan.avl.api.domain;

/**
 * Anchor 체인의 마지막 레코드 위치.
 */
public record ChainTail(long sequence, String hash, String recordId) {

    public long nextSequence() {
        return sequence + 1;
    }
}
