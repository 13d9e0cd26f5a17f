package com.entity.matching.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single record: a stable key plus an ordered mapping of field names to values.
 * Values may be {@code null}; absent fields are not the same as null fields.
 *
 * @param <K> the row key type
 */
public final class Row<K extends Comparable<K>> {

    private final K key;
    private final Map<String, Object> values;

    public Row(K key, Map<String, ?> values) {
        this.key = Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(values, "values is required");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public K getKey() {
        return key;
    }

    /**
     * Returns the value of a field, which may be null.
     *
     * @throws MissingFieldException if the row has no such field
     */
    public Object get(String field) {
        if (!values.containsKey(field)) {
            throw new MissingFieldException(field);
        }
        return values.get(field);
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public boolean isNull(String field) {
        return get(field) == null;
    }

    /**
     * Returns a copy of this row with one field replaced.
     */
    public Row<K> with(String field, Object value) {
        if (!values.containsKey(field)) {
            throw new MissingFieldException(field);
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(field, value);
        return new Row<>(key, copy);
    }

    /**
     * Returns the field values in field order. The map is unmodifiable.
     */
    public Map<String, Object> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row<?> other)) return false;
        return key.equals(other.key) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, values);
    }

    @Override
    public String toString() {
        return "Row{key=" + key + ", values=" + values + '}';
    }
}
