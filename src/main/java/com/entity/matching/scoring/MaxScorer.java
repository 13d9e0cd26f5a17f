package com.entity.matching.scoring;

import com.entity.matching.core.model.Row;

import java.util.Arrays;
import java.util.List;

/**
 * Returns the highest score among the child scorers that agree to score the pair.
 * Refuses only when every child refuses.
 */
public class MaxScorer<K extends Comparable<K>> implements RecordScorer<K> {

    private final List<RecordScorer<K>> scorers;

    public MaxScorer(List<RecordScorer<K>> scorers) {
        if (scorers == null || scorers.isEmpty()) {
            throw new IllegalArgumentException("At least one child scorer is required");
        }
        this.scorers = List.copyOf(scorers);
    }

    @SafeVarargs
    public static <K extends Comparable<K>> MaxScorer<K> of(RecordScorer<K>... scorers) {
        return new MaxScorer<>(Arrays.asList(scorers));
    }

    @Override
    public ScoreResult score(Row<K> a, Row<K> b) {
        Double best = null;
        for (RecordScorer<K> scorer : scorers) {
            ScoreResult result = scorer.score(a, b);
            if (result.isRefused()) {
                continue;
            }
            if (best == null || result.score() > best) {
                best = result.score();
            }
        }
        return best == null ? ScoreResult.refuse("all children refuse to score") : ScoreResult.of(best);
    }
}
