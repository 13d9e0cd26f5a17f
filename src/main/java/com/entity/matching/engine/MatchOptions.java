package com.entity.matching.engine;

import com.entity.matching.core.model.ScoreInterval;

/**
 * Default query parameters of a {@link MatchEngine}.
 * Every query method also has an overload taking explicit values.
 */
public class MatchOptions {

    private static final int DEFAULT_SAMPLE_COUNT = 5;
    private static final double DEFAULT_STEP = 0.05;
    private static final int DEFAULT_PROGRESS_INTERVAL = 1_000;

    private final ScoreInterval interval;
    private final int sampleCount;
    private final double step;
    private final boolean includeExactMatches;
    private final int progressInterval;

    private MatchOptions(Builder builder) {
        this.interval = ScoreInterval.of(builder.lowerBound, builder.upperBound);
        this.sampleCount = builder.sampleCount;
        this.step = builder.step;
        this.includeExactMatches = builder.includeExactMatches;
        this.progressInterval = builder.progressInterval;
    }

    public ScoreInterval getInterval() {
        return interval;
    }

    public double getLowerBound() {
        return interval.lower();
    }

    public double getUpperBound() {
        return interval.upper();
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public double getStep() {
        return step;
    }

    public boolean isIncludeExactMatches() {
        return includeExactMatches;
    }

    /**
     * Number of scored pairs between two progress callbacks.
     */
    public int getProgressInterval() {
        return progressInterval;
    }

    /**
     * Lower bound 0.7, upper bound 1.0, 5 samples per 0.05 step, exact matches included.
     */
    public static MatchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double lowerBound = ScoreInterval.DEFAULT_LOWER;
        private double upperBound = ScoreInterval.DEFAULT_UPPER;
        private int sampleCount = DEFAULT_SAMPLE_COUNT;
        private double step = DEFAULT_STEP;
        private boolean includeExactMatches = true;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        public Builder lowerBound(double lowerBound) {
            validateScore(lowerBound, "lowerBound");
            this.lowerBound = lowerBound;
            return this;
        }

        public Builder upperBound(double upperBound) {
            validateScore(upperBound, "upperBound");
            this.upperBound = upperBound;
            return this;
        }

        public Builder sampleCount(int sampleCount) {
            if (sampleCount <= 0) {
                throw new IllegalArgumentException("sampleCount must be positive");
            }
            this.sampleCount = sampleCount;
            return this;
        }

        public Builder step(double step) {
            if (!(step > 0.0) || step > 1.0) {
                throw new IllegalArgumentException("step must be in (0, 1]");
            }
            this.step = step;
            return this;
        }

        public Builder includeExactMatches(boolean includeExactMatches) {
            this.includeExactMatches = includeExactMatches;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval <= 0) {
                throw new IllegalArgumentException("progressInterval must be positive");
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public MatchOptions build() {
            if (lowerBound > upperBound) {
                throw new IllegalArgumentException("lowerBound must be <= upperBound");
            }
            return new MatchOptions(this);
        }

        private void validateScore(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "MatchOptions{" +
                "interval=" + interval +
                ", sampleCount=" + sampleCount +
                ", step=" + step +
                ", includeExactMatches=" + includeExactMatches +
                ", progressInterval=" + progressInterval +
                '}';
    }
}
