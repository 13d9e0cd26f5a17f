package com.entity.matching.cache;

import com.entity.matching.core.model.Cluster;
import com.entity.matching.core.model.ScoreInterval;

import java.util.List;
import java.util.Optional;

/**
 * Memoises cluster queries of one engine, keyed by the exact score interval.
 * Results for different intervals are computed independently.
 */
public interface ClusterCache<K extends Comparable<K>> {

    Optional<List<Cluster<K>>> get(ScoreInterval interval);

    void put(ScoreInterval interval, List<Cluster<K>> clusters);

    void invalidateAll();

    /**
     * Returns the approximate number of cached intervals.
     */
    long size();
}
