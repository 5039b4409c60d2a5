package io.github.hongjungwan.avl.api.domain;

/**
 * Backend 집계 수치.
 */
public record BackendStats(long totalRecords, long totalAnchors, long totalCheckpoints) {

    public BackendStats plus(BackendStats other) {
        return new BackendStats(
                totalRecords + other.totalRecords,
                totalAnchors + other.totalAnchors,
                totalCheckpoints + other.totalCheckpoints);
    }
}
