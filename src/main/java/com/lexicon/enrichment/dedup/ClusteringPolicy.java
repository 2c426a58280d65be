package com.lexicon.enrichment.dedup;

/**
 * Thresholds for duplicate detection.
 *
 * @param keyThreshold         minimum key similarity for the fuzzy rule
 * @param explanationThreshold minimum explanation similarity for the fuzzy rule
 * @param maxChunkSize         largest input accepted in one clustering call; the algorithm is quadratic
 */
public record ClusteringPolicy(double keyThreshold, double explanationThreshold, int maxChunkSize) {

    public ClusteringPolicy {
        if (keyThreshold <= 0.0 || keyThreshold > 1.0) {
            throw new IllegalArgumentException("keyThreshold must be in (0, 1]");
        }
        if (explanationThreshold < 0.0 || explanationThreshold > 1.0) {
            throw new IllegalArgumentException("explanationThreshold must be in [0, 1]");
        }
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be > 0");
        }
    }

    /**
     * Key similarity 0.8, explanation similarity 0.7, chunks of up to 500 records.
     */
    public static ClusteringPolicy defaults() {
        return new ClusteringPolicy(0.8, 0.7, 500);
    }
}
