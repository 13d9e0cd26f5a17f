package com.entity.matching.scoring;

import com.entity.matching.core.model.Row;
import com.entity.matching.similarity.FieldSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combines per-field similarities into their root mean square:
 * {@code sqrt((s1² + s2² + ... + sn²) / n)}.
 *
 * <p>Squaring favours pairs that are strong on most fields while one very dissimilar
 * field still pulls the score down. A null value on either side scores 0 for that field.
 * The result stays within [0, 1] as long as every similarity does.</p>
 */
public class WeightedSumScorer<K extends Comparable<K>> implements RecordScorer<K> {
    private static final Logger log = LoggerFactory.getLogger(WeightedSumScorer.class);

    private final Map<String, FieldSimilarity> fields;

    public WeightedSumScorer(Map<String, ? extends FieldSimilarity> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("At least one field similarity is required");
        }
        this.fields = new LinkedHashMap<>(fields);
    }

    @Override
    public ScoreResult score(Row<K> a, Row<K> b) {
        double sumOfSquares = 0.0;
        for (Map.Entry<String, FieldSimilarity> entry : fields.entrySet()) {
            String field = entry.getKey();
            Object valueA = a.get(field);
            Object valueB = b.get(field);
            if (valueA == null || valueB == null) {
                continue;
            }
            double sim = entry.getValue().similarity(valueA, valueB);
            sumOfSquares += sim * sim;
        }
        double score = Math.min(1.0, Math.sqrt(sumOfSquares / fields.size()));
        if (log.isTraceEnabled()) {
            log.trace("score.weighted a={} b={} score={}", a.getKey(), b.getKey(), score);
        }
        return ScoreResult.of(score);
    }

    public Map<String, FieldSimilarity> getFields() {
        return Map.copyOf(fields);
    }
}
