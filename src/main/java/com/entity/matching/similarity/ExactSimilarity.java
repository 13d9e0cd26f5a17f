package com.entity.matching.similarity;

/**
 * 1.0 when both values are equal, 0.0 otherwise.
 */
public class ExactSimilarity implements FieldSimilarity {

    @Override
    public double similarity(Object a, Object b) {
        return a.equals(b) ? 1.0 : 0.0;
    }

    @Override
    public String getName() {
        return "Exact";
    }
}
