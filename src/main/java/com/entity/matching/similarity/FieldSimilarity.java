package com.entity.matching.similarity;

/**
 * Compares two non-null field values.
 * All implementations return a score between 0.0 (nothing in common) and 1.0 (identical)
 * and have no side effects. Null handling is left to the caller.
 */
@FunctionalInterface
public interface FieldSimilarity {

    /**
     * Computes the similarity between two field values.
     *
     * @param a left value, never null
     * @param b right value, never null
     * @return similarity score between 0.0 and 1.0
     */
    double similarity(Object a, Object b);

    /**
     * Returns the name of this similarity, used in logs.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
