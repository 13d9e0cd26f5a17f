package com.entity.matching.scoring;

import com.entity.matching.core.model.Row;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Scores pairs by calling a caller-supplied function.
 */
public class CallbackScorer<K extends Comparable<K>> implements RecordScorer<K> {

    private final BiFunction<Row<K>, Row<K>, Double> callback;

    public CallbackScorer(BiFunction<Row<K>, Row<K>, Double> callback) {
        this.callback = Objects.requireNonNull(callback, "callback is required");
    }

    @Override
    public ScoreResult score(Row<K> a, Row<K> b) {
        Double score = callback.apply(a, b);
        if (score == null) {
            return ScoreResult.refuse("callback returned no score");
        }
        return ScoreResult.of(score);
    }
}
