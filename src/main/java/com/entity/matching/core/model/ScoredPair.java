package com.entity.matching.core.model;

import java.util.Objects;

/**
 * A candidate pair with its similarity score. {@code keyA} always comes from the
 * left table and {@code keyB} from the right one.
 */
public record ScoredPair<K extends Comparable<K>>(double score, K keyA, K keyB) {

    public ScoredPair {
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
        Objects.requireNonNull(keyA, "keyA is required");
        Objects.requireNonNull(keyB, "keyB is required");
    }

    public boolean isExactMatch() {
        return score == 1.0;
    }
}
