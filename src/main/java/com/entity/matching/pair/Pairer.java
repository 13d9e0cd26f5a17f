package com.entity.matching.pair;

import com.entity.matching.core.model.Table;

import java.util.List;

/**
 * Produces the pairs of rows that should be compared.
 *
 * <p>{@link #frameA()} is the left table, {@link #frameB()} the right one; every pair
 * holds one row of each. When deduplicating a single table both return that table.</p>
 */
public interface Pairer<K extends Comparable<K>> {

    Table<K> frameA();

    Table<K> frameB();

    /**
     * Returns the candidate pairs. A pair reachable through several buckets is returned once.
     */
    List<RecordPair<K>> pairs();
}
