package io.reviewmind.core.memory;

/**
 * One nearest-neighbour result: the entry and its squared Euclidean distance to the query.
 */
public record SearchHit(MemoryEntry entry, double distance) {

    /**
     * Bounded similarity in (0, 1], decreasing with distance.
     */
    public double similarity() {
        return toSimilarity(distance);
    }

    public static double toSimilarity(double distance) {
        return 1.0 / (1.0 + Math.max(0.0, distance));
    }
}
