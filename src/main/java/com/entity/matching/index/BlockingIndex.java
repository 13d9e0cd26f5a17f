package com.entity.matching.index;

import com.entity.matching.core.model.Table;

import java.util.List;
import java.util.Map;

/**
 * Divides a table into buckets. Only rows that share a bucket are ever compared,
 * which keeps the number of candidate pairs far below the full cross product.
 *
 * <p>Implementations only compute the bucket mapping. Callers obtain buckets through
 * the {@link IndexedTable} handle returned by {@link #index(Table)}, so a bucket can
 * never be requested for a table that was not indexed.</p>
 */
public interface BlockingIndex {

    /**
     * Computes the mapping between bucket keys and the keys of the rows in each bucket.
     *
     * @param table the table to index
     * @return bucket key to row keys; every list is non-empty and free of duplicates
     */
    <K extends Comparable<K>> Map<BucketKey, List<K>> bucketMap(Table<K> table);

    /**
     * Indexes a table and returns the handle used to retrieve its buckets.
     */
    default <K extends Comparable<K>> IndexedTable<K> index(Table<K> table) {
        return new IndexedTable<>(table, bucketMap(table));
    }
}
