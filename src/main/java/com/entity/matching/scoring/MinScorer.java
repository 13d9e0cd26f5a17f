package com.entity.matching.scoring;

import com.entity.matching.core.model.Row;

import java.util.Arrays;
import java.util.List;

/**
 * Returns the lowest score among the child scorers that agree to score the pair.
 * Refuses only when every child refuses.
 */
public class MinScorer<K extends Comparable<K>> implements RecordScorer<K> {

    private final List<RecordScorer<K>> scorers;

    public MinScorer(List<RecordScorer<K>> scorers) {
        if (scorers == null || scorers.isEmpty()) {
            throw new IllegalArgumentException("At least one child scorer is required");
        }
        this.scorers = List.copyOf(scorers);
    }

    @SafeVarargs
    public static <K extends Comparable<K>> MinScorer<K> of(RecordScorer<K>... scorers) {
        return new MinScorer<>(Arrays.asList(scorers));
    }

    @Override
    public ScoreResult score(Row<K> a, Row<K> b) {
        Double lowest = null;
        for (RecordScorer<K> scorer : scorers) {
            ScoreResult result = scorer.score(a, b);
            if (result.isRefused()) {
                continue;
            }
            if (lowest == null || result.score() < lowest) {
                lowest = result.score();
            }
        }
        return lowest == null ? ScoreResult.refuse("all children refuse to score") : ScoreResult.of(lowest);
    }
}
