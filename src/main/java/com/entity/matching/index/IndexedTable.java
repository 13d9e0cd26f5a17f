package com.entity.matching.index;

import com.entity.matching.core.model.StructuralException;
import com.entity.matching.core.model.Table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A table together with the buckets a {@link BlockingIndex} computed for it.
 */
public final class IndexedTable<K extends Comparable<K>> {

    private final Table<K> table;
    private final Map<BucketKey, List<K>> buckets;

    IndexedTable(Table<K> table, Map<BucketKey, List<K>> buckets) {
        this.table = table;
        Map<BucketKey, List<K>> copy = new LinkedHashMap<>();
        buckets.forEach((key, rows) -> copy.put(key, List.copyOf(rows)));
        this.buckets = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the distinct bucket keys found in the table.
     */
    public Set<BucketKey> keys() {
        return buckets.keySet();
    }

    /**
     * Returns the row keys of a bucket.
     *
     * @throws StructuralException if the bucket key was not produced for this table
     */
    public List<K> bucketKeys(BucketKey key) {
        List<K> rows = buckets.get(key);
        if (rows == null) {
            throw new StructuralException("Bucket " + key + " does not exist for this table");
        }
        return rows;
    }

    /**
     * Returns the rows of a bucket as a table.
     *
     * @throws StructuralException if the bucket key was not produced for this table
     */
    public Table<K> bucket(BucketKey key) {
        return table.subset(bucketKeys(key));
    }

    public int bucketCount() {
        return buckets.size();
    }
}
