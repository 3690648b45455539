package com.entity.linking.similarity;

/**
 * Scores one query signal against one candidate value of the same kind.
 * All implementations return a score between 0.0 (no match) and 1.0 (exact match)
 * and never throw; a null or empty input scores 0.0.
 */
public interface SignalSimilarity {

    /**
     * Computes the similarity between a query value and a candidate value.
     *
     * @param query     the value supplied by the caller
     * @param candidate the value stored on the contact
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String query, String candidate);

    /**
     * Returns the name of this primitive.
     */
    String getName();
}
