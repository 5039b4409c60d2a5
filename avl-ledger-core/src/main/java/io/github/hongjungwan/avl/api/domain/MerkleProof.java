package io.github.hongjungwan.avl.api.domain;

import io.github.hongjungwan.avl.spi.HashFunction;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

/**
 * 체크포인트 root에 대한 레코드 포함 증명. O(log n) 크기.
 *
 * @param checkpointId 증명 대상 체크포인트
 * @param recordId     증명 대상 레코드
 * @param leafHash     레코드 hash (leaf)
 * @param leafIndex    구간 내 leaf 위치
 * @param leafCount    구간 leaf 수
 * @param path         leaf에서 root까지의 sibling 목록
 */
public record MerkleProof(
        String checkpointId,
        String recordId,
        String leafHash,
        int leafIndex,
        int leafCount,
        List<Step> path
) {

    public MerkleProof {
        path = List.copyOf(path);
    }

    /**
     * @param siblingHash   형제 노드 hash
     * @param siblingOnLeft 형제가 왼쪽이면 true ({@code H(sibling || current)})
     */
    public record Step(String siblingHash, boolean siblingOnLeft) {
    }

    /**
     * Leaf에서 path를 따라 root를 재계산하여 비교.
     *
     * <p>좌우 위치는 leafIndex의 비트로 정해지며 path 길이는 leafCount의 트리 높이와 같아야 한다.
     * 내부 노드를 leaf로 내세운 증명은 높이가 맞지 않아 거부된다.</p>
     */
    public boolean verify(String expectedRoot, HashFunction hashFunction) {
        if (leafCount < 1 || leafIndex < 0 || leafIndex >= leafCount || path.size() != height(leafCount)) {
            return false;
        }
        HexFormat hex = HexFormat.of();
        byte[] current = hex.parseHex(leafHash);
        if (current.length != hashFunction.digestLength()) {
            return false;
        }
        int position = leafIndex;
        int levelSize = leafCount;
        for (Step step : path) {
            boolean isRight = position % 2 == 1;
            if (step.siblingOnLeft() != isRight) {
                return false;
            }
            byte[] sibling = hex.parseHex(step.siblingHash());
            // 홀수 레벨의 마지막 노드는 자기 자신과 짝
            if (!isRight && position == levelSize - 1 && !Arrays.equals(sibling, current)) {
                return false;
            }
            current = isRight
                    ? hashFunction.combine(sibling, current)
                    : hashFunction.combine(current, sibling);
            position /= 2;
            levelSize = (levelSize + 1) / 2;
        }
        return hex.formatHex(current).equalsIgnoreCase(expectedRoot);
    }

    /** leaf 수에 대한 트리 높이. leaf가 하나면 0 */
    public static int height(int leafCount) {
        int height = 0;
        for (int size = leafCount; size > 1; size = (size + 1) / 2) {
            height++;
        }
        return height;
    }
}
