package com.entity.matching.core.model;

/**
 * A closed score interval {@code [lower, upper]}.
 */
public record ScoreInterval(double lower, double upper) {

    public static final double DEFAULT_LOWER = 0.7;
    public static final double DEFAULT_UPPER = 1.0;

    public ScoreInterval {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new IllegalArgumentException("Interval bounds must be numbers");
        }
        if (lower > upper) {
            throw new IllegalArgumentException(
                    "lower bound " + lower + " must be <= upper bound " + upper);
        }
    }

    public static ScoreInterval of(double lower, double upper) {
        return new ScoreInterval(lower, upper);
    }

    public static ScoreInterval defaults() {
        return new ScoreInterval(DEFAULT_LOWER, DEFAULT_UPPER);
    }

    public boolean contains(double score) {
        return score >= lower && score <= upper;
    }
}
