package com.entity.matching.filter;

import com.entity.matching.core.model.Row;

/**
 * Drops pairs whose {@code [start, end]} ranges overlap. Typically used on employment
 * or residence periods: one person cannot hold two overlapping records.
 * Both fields must hold mutually comparable values. A pair with a missing bound on
 * either side cannot be shown to be disjoint and is dropped.
 */
public class NonOverlappingFilter implements PairFilter {

    private final String startField;
    private final String endField;

    public NonOverlappingFilter(String startField, String endField) {
        this.startField = startField;
        this.endField = endField;
    }

    @Override
    public boolean valid(Row<?> a, Row<?> b) {
        if (a.isNull(startField) || a.isNull(endField) || b.isNull(startField) || b.isNull(endField)) {
            return false;
        }
        return compare(a.get(endField), b.get(startField)) < 0
                || compare(a.get(startField), b.get(endField)) > 0;
    }

    @SuppressWarnings("unchecked")
    private static int compare(Object x, Object y) {
        if (x instanceof Number nx && y instanceof Number ny) {
            return Double.compare(nx.doubleValue(), ny.doubleValue());
        }
        if (!(x instanceof Comparable<?>)) {
            throw new IllegalArgumentException("Range bound is not comparable: " + x);
        }
        return ((Comparable<Object>) x).compareTo(y);
    }
}
