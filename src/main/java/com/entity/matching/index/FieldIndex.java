package com.entity.matching.index;

import com.entity.matching.core.model.MissingFieldException;
import com.entity.matching.core.model.Row;
import com.entity.matching.core.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Buckets rows by the values of one or more fields. Two rows share a bucket when
 * the tuple of their values for these fields is equal.
 *
 * <ul>
 *   <li><b>indexElements</b>: a field holding a collection or array places the row
 *   in one bucket per element. With several fields the bucket keys are the cartesian
 *   product of the elements.</li>
 *   <li><b>ignoreMissingFields</b>: a table without one of the fields produces no
 *   buckets instead of failing with {@link MissingFieldException}.</li>
 * </ul>
 *
 * <p>Row keys inside each bucket are sorted ascending.</p>
 */
public class FieldIndex implements BlockingIndex {
    private static final Logger log = LoggerFactory.getLogger(FieldIndex.class);

    private final List<String> fields;
    private final boolean indexElements;
    private final boolean ignoreMissingFields;

    private FieldIndex(Builder builder) {
        this.fields = List.copyOf(builder.fields);
        this.indexElements = builder.indexElements;
        this.ignoreMissingFields = builder.ignoreMissingFields;
    }

    /**
     * Creates an index on the given fields with default options.
     */
    public static FieldIndex of(String... fields) {
        return builder(fields).build();
    }

    public static Builder builder(String... fields) {
        return new Builder(Arrays.asList(fields));
    }

    public List<String> getFields() {
        return fields;
    }

    @Override
    public <K extends Comparable<K>> Map<BucketKey, List<K>> bucketMap(Table<K> table) {
        for (String field : fields) {
            if (!table.hasField(field)) {
                if (ignoreMissingFields) {
                    log.debug("index.field.missing field={} buckets=0", field);
                    return Map.of();
                }
                throw new MissingFieldException(field);
            }
        }

        Map<BucketKey, Set<K>> grouped = new LinkedHashMap<>();
        for (Row<K> row : table.rows()) {
            for (BucketKey key : keysFor(row)) {
                grouped.computeIfAbsent(key, k -> new TreeSet<>()).add(row.getKey());
            }
        }

        Map<BucketKey, List<K>> result = new LinkedHashMap<>();
        grouped.forEach((key, rows) -> result.put(key, new ArrayList<>(rows)));
        log.debug("index.fields fields={} rows={} buckets={}", fields, table.size(), result.size());
        return result;
    }

    private Set<BucketKey> keysFor(Row<?> row) {
        if (!indexElements) {
            Object[] parts = new Object[fields.size()];
            for (int i = 0; i < parts.length; i++) {
                parts[i] = row.get(fields.get(i));
            }
            return Set.of(BucketKey.of(parts));
        }

        List<List<Object>> combinations = new ArrayList<>();
        combinations.add(new ArrayList<>());
        for (String field : fields) {
            List<Object> elements = elementsOf(row.get(field));
            List<List<Object>> next = new ArrayList<>();
            for (List<Object> prefix : combinations) {
                for (Object element : elements) {
                    List<Object> combination = new ArrayList<>(prefix);
                    combination.add(element);
                    next.add(combination);
                }
            }
            combinations = next;
        }

        Set<BucketKey> keys = new LinkedHashSet<>();
        for (List<Object> combination : combinations) {
            keys.add(new BucketKey(combination));
        }
        return keys;
    }

    private static List<Object> elementsOf(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return elements;
        }
        return List.of(value);
    }

    @Override
    public String toString() {
        return "FieldIndex{fields=" + fields +
                ", indexElements=" + indexElements +
                ", ignoreMissingFields=" + ignoreMissingFields + '}';
    }

    public static class Builder {
        private final List<String> fields;
        private boolean indexElements = false;
        private boolean ignoreMissingFields = false;

        private Builder(List<String> fields) {
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("At least one field is required");
            }
            this.fields = fields;
        }

        public Builder indexElements(boolean indexElements) {
            this.indexElements = indexElements;
            return this;
        }

        public Builder ignoreMissingFields(boolean ignoreMissingFields) {
            this.ignoreMissingFields = ignoreMissingFields;
            return this;
        }

        public FieldIndex build() {
            return new FieldIndex(this);
        }
    }
}
