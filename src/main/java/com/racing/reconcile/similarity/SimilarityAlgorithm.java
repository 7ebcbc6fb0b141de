package com.racing.reconcile.similarity;

/**
 * Character- or token-level string similarity used by driver matching.
 * Implementations return a score between 0.0 (nothing in common) and 1.0 (identical),
 * so the matching rules stay the same whichever algorithm is plugged in.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
