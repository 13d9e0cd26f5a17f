package com.entity.matching.scoring;

import com.entity.matching.core.model.Row;
import com.entity.matching.similarity.FieldSimilarity;

import java.util.Map;

/**
 * Turns two rows into a single similarity score between 0.0 and 1.0.
 *
 * @param <K> the row key type
 */
@FunctionalInterface
public interface RecordScorer<K extends Comparable<K>> {

    /**
     * Scores a pair of rows.
     *
     * @param a the left row
     * @param b the right row
     * @return the score, or a refusal when this scorer cannot judge the pair
     */
    ScoreResult score(Row<K> a, Row<K> b);

    /**
     * Shorthand for a {@link WeightedSumScorer} over the given field similarities.
     */
    static <K extends Comparable<K>> RecordScorer<K> fields(Map<String, ? extends FieldSimilarity> fields) {
        return new WeightedSumScorer<>(fields);
    }
}
