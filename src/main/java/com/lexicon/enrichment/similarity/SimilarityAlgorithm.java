package com.lexicon.enrichment.similarity;

/**
 * Symmetric string similarity in the range 0.0 (unrelated) to 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();

    /**
     * Whether {@code compute(s1, s2) >= threshold}. Implementations may answer without the full computation.
     */
    default boolean atLeast(String s1, String s2, double threshold) {
        return compute(s1, s2) >= threshold;
    }
}
