package com.entity.matching.scoring;

import com.entity.matching.core.model.Row;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Adjusts the wrapped score for rows known to share an external grouping value,
 * e.g. two records already linked to the same case number.
 *
 * <p>When both row keys have a recorded group value and the values are equal, the wrapped
 * score is passed through {@code alter}; the altered score is clamped to [0, 1].
 * Refusals from the wrapped scorer pass through untouched.</p>
 */
public class OverrideScorer<K extends Comparable<K>> implements RecordScorer<K> {

    private final RecordScorer<K> scorer;
    private final Map<K, ?> groups;
    private final DoubleUnaryOperator alter;

    public OverrideScorer(RecordScorer<K> scorer, Map<K, ?> groups, DoubleUnaryOperator alter) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.groups = new HashMap<>(Objects.requireNonNull(groups, "groups is required"));
        this.alter = Objects.requireNonNull(alter, "alter is required");
    }

    @Override
    public ScoreResult score(Row<K> a, Row<K> b) {
        ScoreResult result = scorer.score(a, b);
        if (result.isRefused()) {
            return result;
        }
        Object groupA = groups.get(a.getKey());
        Object groupB = groups.get(b.getKey());
        if (groupA != null && groupA.equals(groupB)) {
            double altered = alter.applyAsDouble(result.score());
            return ScoreResult.of(Math.max(0.0, Math.min(1.0, altered)));
        }
        return result;
    }
}
