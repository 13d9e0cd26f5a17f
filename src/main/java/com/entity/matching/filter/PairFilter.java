package com.entity.matching.filter;

import com.entity.matching.core.model.Row;

/**
 * Discards candidate pairs before scoring. Where an index decides which rows may be
 * compared, a filter vetoes individual pairs.
 */
@FunctionalInterface
public interface PairFilter {

    /**
     * Returns true if the pair should be kept and scored.
     *
     * @param a the left row
     * @param b the right row
     */
    boolean valid(Row<?> a, Row<?> b);
}
