package io.github.hongjungwan.avl.core.checkpoint;

import io.github.hongjungwan.avl.api.domain.MerkleProof;
import io.github.hongjungwan.avl.spi.HashFunction;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * 레코드 hash 위의 이진 Merkle 트리.
 *
 * <p>Leaf는 레코드 hash 바이트(레코드 순서), 부모는 {@code H(left || right)},
 * 노드 수가 홀수인 레벨은 마지막 노드를 복제하여 짝을 만든다. Leaf가 하나면 그 자체가 root.</p>
 */
public final class MerkleTree {

    private MerkleTree() {}

    public static byte[] root(List<byte[]> leaves, HashFunction hashFunction) {
        if (leaves.isEmpty()) {
            throw new IllegalArgumentException("Merkle tree needs at least one leaf");
        }
        List<byte[]> level = leaves;
        while (level.size() > 1) {
            level = nextLevel(level, hashFunction);
        }
        return level.get(0);
    }

    public static String rootHex(List<String> leafHashes, HashFunction hashFunction) {
        return HexFormat.of().formatHex(root(decode(leafHashes), hashFunction));
    }

    /**
     * Leaf 하나의 포함 증명 경로.
     */
    public static List<MerkleProof.Step> path(List<byte[]> leaves, int index, HashFunction hashFunction) {
        if (index < 0 || index >= leaves.size()) {
            throw new IndexOutOfBoundsException("Leaf index " + index + " outside [0, " + leaves.size() + ")");
        }
        HexFormat hex = HexFormat.of();
        List<MerkleProof.Step> path = new ArrayList<>();
        List<byte[]> level = leaves;
        int position = index;
        while (level.size() > 1) {
            boolean isRight = position % 2 == 1;
            int siblingIndex = isRight ? position - 1 : position + 1;
            // 홀수 레벨의 마지막 노드는 자기 자신과 짝
            byte[] sibling = siblingIndex < level.size() ? level.get(siblingIndex) : level.get(position);
            path.add(new MerkleProof.Step(hex.formatHex(sibling), isRight));
            level = nextLevel(level, hashFunction);
            position /= 2;
        }
        return path;
    }

    public static List<byte[]> decode(List<String> leafHashes) {
        HexFormat hex = HexFormat.of();
        List<byte[]> leaves = new ArrayList<>(leafHashes.size());
        for (String hash : leafHashes) {
            leaves.add(hex.parseHex(hash));
        }
        return leaves;
    }

    private static List<byte[]> nextLevel(List<byte[]> level, HashFunction hashFunction) {
        List<byte[]> next = new ArrayList<>((level.size() + 1) / 2);
        for (int i = 0; i < level.size(); i += 2) {
            byte[] left = level.get(i);
            byte[] right = i + 1 < level.size() ? level.get(i + 1) : left;
            next.add(hashFunction.combine(left, right));
        }
        return next;
    }
}
