package com.entity.matching.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One line of a tabular match report. Every pair contributes two lines, left row first,
 * sharing group, pair index and score.
 *
 * @param group     cluster index for cluster reports, score range label (e.g. {@code "1.00-0.95"})
 *                  for sample reports, null for flat pair reports
 * @param pairIndex position of the pair within its group
 * @param score     the pair's similarity score
 * @param rowKey    key of the row this line describes
 * @param fields    the row's field values, in table order
 */
public record ReportRow<K extends Comparable<K>>(String group, int pairIndex, double score,
                                                 K rowKey, Map<String, Object> fields) {

    public ReportRow {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
