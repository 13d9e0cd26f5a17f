package com.entity.matching.core.model;

/**
 * How many pairs a single match threshold accepts.
 *
 * @param matchThreshold the score at or above which a pair counts as a match
 * @param matchedPairs   number of pairs scoring at least the threshold
 * @param rowsA          number of rows in the left table
 * @param rowsB          number of rows in the right table
 */
public record DecisionSummary(double matchThreshold, int matchedPairs, int rowsA, int rowsB) {

    /**
     * Matched pairs as a percentage of the left table's rows.
     */
    public double percentOfA() {
        return rowsA == 0 ? 0.0 : matchedPairs * 100.0 / rowsA;
    }

    /**
     * Matched pairs as a percentage of the right table's rows.
     */
    public double percentOfB() {
        return rowsB == 0 ? 0.0 : matchedPairs * 100.0 / rowsB;
    }

    @Override
    public String toString() {
        return String.format("for threshold %.3f: %d matched pairs (%d%% of A, %d%% of B)",
                matchThreshold, matchedPairs, (int) percentOfA(), (int) percentOfB());
    }
}
