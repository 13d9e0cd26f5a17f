package com.entity.matching.pair;

import com.entity.matching.core.model.Row;

/**
 * A candidate pair of rows, left row first.
 */
public record RecordPair<K extends Comparable<K>>(Row<K> left, Row<K> right) {
}
