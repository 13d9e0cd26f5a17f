package com.entity.matching.similarity;

/**
 * Linear similarity between numbers: {@code 1 - |a - b| / tolerance}, floored at 0.
 * Numbers further apart than the tolerance score 0.
 */
public class NumericSimilarity implements FieldSimilarity {

    private final double tolerance;

    public NumericSimilarity(double tolerance) {
        if (tolerance <= 0) {
            throw new IllegalArgumentException("tolerance must be positive");
        }
        this.tolerance = tolerance;
    }

    @Override
    public double similarity(Object a, Object b) {
        double diff = Math.abs(toDouble(a) - toDouble(b));
        return Math.max(0.0, 1.0 - diff / tolerance);
    }

    @Override
    public String getName() {
        return "Numeric";
    }

    private static double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + value, e);
        }
    }
}
