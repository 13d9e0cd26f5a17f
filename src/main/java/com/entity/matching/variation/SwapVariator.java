package com.entity.matching.variation;

import com.entity.matching.core.model.Row;

import java.util.List;
import java.util.Objects;

/**
 * Yields the row as is, then a copy with the values of two fields exchanged.
 * The copy is skipped when both values are null or equal.
 */
public class SwapVariator implements Variator {

    private final String fieldA;
    private final String fieldB;

    public SwapVariator(String fieldA, String fieldB) {
        this.fieldA = Objects.requireNonNull(fieldA);
        this.fieldB = Objects.requireNonNull(fieldB);
    }

    @Override
    public <K extends Comparable<K>> List<Row<K>> variations(Row<K> row) {
        Object valueA = row.get(fieldA);
        Object valueB = row.get(fieldB);
        if (Objects.equals(valueA, valueB)) {
            return List.of(row);
        }
        return List.of(row, row.with(fieldA, valueB).with(fieldB, valueA));
    }
}
