package com.entity.matching.core.model;

/**
 * How a matching run pairs its records.
 */
public enum MatchMode {
    /**
     * Two tables; pairs always hold one row from each table.
     * Results are reduced to at most one pair per row.
     */
    MATCH,

    /**
     * One table compared against itself.
     * A row may group with several others.
     */
    DEDUPLICATE
}
