package com.entity.matching.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable, ordered collection of rows sharing the same field list.
 *
 * <p>Tables accept duplicated keys so that they can be reported as a structural
 * error by the component that needs unique keys, with a descriptive message.
 * Key lookups resolve to the first row carrying the key.</p>
 *
 * @param <K> the row key type
 */
public final class Table<K extends Comparable<K>> {

    private final List<String> fields;
    private final List<Row<K>> rows;
    private final Map<K, Row<K>> rowsByKey;

    private Table(List<String> fields, List<Row<K>> rows) {
        this.fields = List.copyOf(fields);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        Map<K, Row<K>> byKey = new HashMap<>();
        for (Row<K> row : this.rows) {
            byKey.putIfAbsent(row.getKey(), row);
        }
        this.rowsByKey = byKey;
    }

    /**
     * Creates a table from a field list and rows. Every row must carry exactly these fields.
     */
    public static <K extends Comparable<K>> Table<K> of(List<String> fields, List<Row<K>> rows) {
        Set<String> expected = new HashSet<>(fields);
        if (expected.size() != fields.size()) {
            throw new StructuralException("Table fields contain duplicates: " + fields);
        }
        for (Row<K> row : rows) {
            if (!row.getValues().keySet().equals(expected)) {
                throw new StructuralException("Row " + row.getKey() + " has fields "
                        + row.getValues().keySet() + " but table expects " + fields);
            }
        }
        return new Table<>(fields, rows);
    }

    /**
     * Creates a table keyed by row position (0, 1, 2, ...).
     */
    public static Table<Integer> numbered(List<String> fields, Object[]... rows) {
        Builder<Integer> builder = new Builder<>(fields);
        for (int i = 0; i < rows.length; i++) {
            builder.row(i, rows[i]);
        }
        return builder.build();
    }

    public static <K extends Comparable<K>> Builder<K> builder(String... fields) {
        return new Builder<>(Arrays.asList(fields));
    }

    public static <K extends Comparable<K>> Builder<K> builder(List<String> fields) {
        return new Builder<>(fields);
    }

    public List<String> fields() {
        return fields;
    }

    public List<Row<K>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<K> keys() {
        List<K> keys = new ArrayList<>(rows.size());
        for (Row<K> row : rows) {
            keys.add(row.getKey());
        }
        return keys;
    }

    public Optional<Row<K>> row(K key) {
        return Optional.ofNullable(rowsByKey.get(key));
    }

    public boolean hasUniqueKeys() {
        return rowsByKey.size() == rows.size();
    }

    public boolean hasField(String field) {
        return fields.contains(field);
    }

    /**
     * Returns the rows with the given keys, in the order the keys are given.
     *
     * @throws StructuralException if a key is not in this table
     */
    public Table<K> subset(Collection<K> keys) {
        List<Row<K>> selected = new ArrayList<>(keys.size());
        for (K key : keys) {
            Row<K> row = rowsByKey.get(key);
            if (row == null) {
                throw new StructuralException("Key " + key + " does not exist in table");
            }
            selected.add(row);
        }
        return new Table<>(fields, selected);
    }

    @Override
    public String toString() {
        return "Table{fields=" + fields + ", rows=" + rows.size() + '}';
    }

    /**
     * Fluent builder adding rows one at a time, values given in field order.
     */
    public static class Builder<K extends Comparable<K>> {
        private final List<String> fields;
        private final List<Row<K>> rows = new ArrayList<>();

        private Builder(List<String> fields) {
            this.fields = List.copyOf(fields);
        }

        public Builder<K> row(K key, Object... values) {
            if (values.length != fields.size()) {
                throw new StructuralException("Row " + key + " has " + values.length
                        + " values but table has " + fields.size() + " fields");
            }
            Map<String, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                map.put(fields.get(i), values[i]);
            }
            rows.add(new Row<>(key, map));
            return this;
        }

        public Builder<K> row(Row<K> row) {
            rows.add(row);
            return this;
        }

        public Table<K> build() {
            return Table.of(fields, rows);
        }
    }
}
