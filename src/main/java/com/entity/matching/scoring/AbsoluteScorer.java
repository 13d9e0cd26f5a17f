package com.entity.matching.scoring;

import com.entity.matching.core.model.MissingFieldException;
import com.entity.matching.core.model.Row;

/**
 * Returns a fixed score when both rows hold the same value for one field, and refuses
 * otherwise (values differ, or either value is null).
 *
 * <p>Because it refuses most pairs, this scorer must always sit inside a
 * {@link MaxScorer} or {@link MinScorer} next to a scorer that can judge any pair.</p>
 */
public class AbsoluteScorer<K extends Comparable<K>> implements RecordScorer<K> {

    private final String field;
    private final double score;
    private final boolean ignoreMissingField;

    public AbsoluteScorer(String field, double score) {
        this(field, score, false);
    }

    /**
     * @param field              the field to compare
     * @param score              the score returned on equality
     * @param ignoreMissingField refuse instead of throwing {@link MissingFieldException}
     *                           when a row lacks the field
     */
    public AbsoluteScorer(String field, double score, boolean ignoreMissingField) {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0");
        }
        this.field = field;
        this.score = score;
        this.ignoreMissingField = ignoreMissingField;
    }

    @Override
    public ScoreResult score(Row<K> a, Row<K> b) {
        if (!a.has(field) || !b.has(field)) {
            if (ignoreMissingField) {
                return ScoreResult.refuse("field " + field + " does not exist in one of the rows");
            }
            throw new MissingFieldException(field);
        }
        Object valueA = a.get(field);
        Object valueB = b.get(field);
        if (valueA == null || valueB == null) {
            return ScoreResult.refuse("one of the values is null");
        }
        if (valueA.equals(valueB)) {
            return ScoreResult.of(score);
        }
        return ScoreResult.refuse("values are not equal");
    }
}
