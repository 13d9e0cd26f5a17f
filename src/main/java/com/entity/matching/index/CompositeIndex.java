package com.entity.matching.index;

import com.entity.matching.core.model.Table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Combines the buckets of two or more indices.
 *
 * <ul>
 *   <li>{@link Mode#UNION}: bucket keys of all sub-indices are pooled; a bucket key
 *   produced by several sub-indices holds the union of their rows ("OR").</li>
 *   <li>{@link Mode#INTERSECTION}: bucket keys are the cartesian product of the
 *   sub-indices' keys and hold the rows common to all of them; empty combinations
 *   are dropped ("AND").</li>
 * </ul>
 */
public class CompositeIndex implements BlockingIndex {

    public enum Mode { UNION, INTERSECTION }

    private final List<BlockingIndex> indices;
    private final Mode mode;

    public CompositeIndex(List<BlockingIndex> indices, Mode mode) {
        if (indices == null || indices.isEmpty()) {
            throw new IllegalArgumentException("At least one index is required");
        }
        this.indices = List.copyOf(indices);
        this.mode = mode;
    }

    public static CompositeIndex union(BlockingIndex... indices) {
        return new CompositeIndex(Arrays.asList(indices), Mode.UNION);
    }

    public static CompositeIndex intersection(BlockingIndex... indices) {
        return new CompositeIndex(Arrays.asList(indices), Mode.INTERSECTION);
    }

    public Mode getMode() {
        return mode;
    }

    @Override
    public <K extends Comparable<K>> Map<BucketKey, List<K>> bucketMap(Table<K> table) {
        List<Map<BucketKey, List<K>>> maps = new ArrayList<>(indices.size());
        for (BlockingIndex index : indices) {
            maps.add(index.bucketMap(table));
        }
        return mode == Mode.UNION ? union(maps) : intersection(maps);
    }

    private static <K extends Comparable<K>> Map<BucketKey, List<K>> union(List<Map<BucketKey, List<K>>> maps) {
        Map<BucketKey, Set<K>> merged = new LinkedHashMap<>();
        for (Map<BucketKey, List<K>> map : maps) {
            map.forEach((key, rows) -> merged.computeIfAbsent(key, k -> new TreeSet<>()).addAll(rows));
        }
        Map<BucketKey, List<K>> result = new LinkedHashMap<>();
        merged.forEach((key, rows) -> result.put(key, new ArrayList<>(rows)));
        return result;
    }

    private static <K extends Comparable<K>> Map<BucketKey, List<K>> intersection(List<Map<BucketKey, List<K>>> maps) {
        Map<BucketKey, List<K>> result = new LinkedHashMap<>();
        collect(maps, 0, new ArrayList<>(), null, result);
        return result;
    }

    /**
     * Walks the cartesian product depth first, pruning as soon as the running intersection is empty.
     */
    private static <K extends Comparable<K>> void collect(List<Map<BucketKey, List<K>>> maps, int depth,
                                                        List<Object> keyParts, Set<K> rows,
                                                        Map<BucketKey, List<K>> result) {
        if (depth == maps.size()) {
            result.put(new BucketKey(keyParts), new ArrayList<>(rows));
            return;
        }
        for (Map.Entry<BucketKey, List<K>> entry : maps.get(depth).entrySet()) {
            Set<K> common = new TreeSet<>(entry.getValue());
            if (rows != null) {
                common.retainAll(rows);
            }
            if (common.isEmpty()) {
                continue;
            }
            keyParts.add(entry.getKey());
            collect(maps, depth + 1, keyParts, common, result);
            keyParts.remove(keyParts.size() - 1);
        }
    }

    @Override
    public String toString() {
        return "CompositeIndex{mode=" + mode + ", indices=" + indices + '}';
    }
}
