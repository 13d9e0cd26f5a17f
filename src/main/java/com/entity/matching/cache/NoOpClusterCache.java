package com.entity.matching.cache;

import com.entity.matching.core.model.Cluster;
import com.entity.matching.core.model.ScoreInterval;

import java.util.List;
import java.util.Optional;

/**
 * Cache that never stores anything; every cluster query is recomputed.
 */
public class NoOpClusterCache<K extends Comparable<K>> implements ClusterCache<K> {

    @Override
    public Optional<List<Cluster<K>>> get(ScoreInterval interval) {
        return Optional.empty();
    }

    @Override
    public void put(ScoreInterval interval, List<Cluster<K>> clusters) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public long size() {
        return 0;
    }
}
