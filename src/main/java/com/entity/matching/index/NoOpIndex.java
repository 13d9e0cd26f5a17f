package com.entity.matching.index;

import com.entity.matching.core.model.Table;

import java.util.List;
import java.util.Map;

/**
 * Puts the whole table into a single bucket, which is the same as not blocking at all.
 * Fine for small tables where every pair can be compared.
 */
public class NoOpIndex implements BlockingIndex {

    static final BucketKey ALL = BucketKey.of(0);

    @Override
    public <K extends Comparable<K>> Map<BucketKey, List<K>> bucketMap(Table<K> table) {
        if (table.isEmpty()) {
            return Map.of();
        }
        return Map.of(ALL, table.keys());
    }
}
