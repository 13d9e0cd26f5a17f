package com.entity.matching.filter;

import com.entity.matching.core.model.MissingFieldException;
import com.entity.matching.core.model.Row;

/**
 * Drops pairs whose rows hold the same value for a field, e.g. two records from the
 * same source agency that cannot describe the same person. A null on either side keeps the pair.
 */
public class DissimilarFilter implements PairFilter {

    private final String field;
    private final boolean ignoreMissingField;

    public DissimilarFilter(String field) {
        this(field, false);
    }

    /**
     * @param ignoreMissingField keep every pair instead of throwing {@link MissingFieldException}
     *                           when the field does not exist
     */
    public DissimilarFilter(String field, boolean ignoreMissingField) {
        this.field = field;
        this.ignoreMissingField = ignoreMissingField;
    }

    @Override
    public boolean valid(Row<?> a, Row<?> b) {
        if (!a.has(field) || !b.has(field)) {
            if (ignoreMissingField) {
                return true;
            }
            throw new MissingFieldException(field);
        }
        Object valueA = a.get(field);
        Object valueB = b.get(field);
        if (valueA == null || valueB == null) {
            return true;
        }
        return !valueA.equals(valueB);
    }
}
