package com.entity.matching.cache;

import com.entity.matching.core.model.Cluster;
import com.entity.matching.core.model.ScoreInterval;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed cluster cache, bounded by number of intervals.
 */
public class CaffeineClusterCache<K extends Comparable<K>> implements ClusterCache<K> {
    private static final Logger log = LoggerFactory.getLogger(CaffeineClusterCache.class);

    private final Cache<ScoreInterval, List<Cluster<K>>> cache;

    public CaffeineClusterCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxIntervals())
                .expireAfterAccess(config.expireAfterAccess())
                .build();
        log.debug("CaffeineClusterCache initialized: maxIntervals={}, expireAfterAccess={}",
                config.maxIntervals(), config.expireAfterAccess());
    }

    @Override
    public Optional<List<Cluster<K>>> get(ScoreInterval interval) {
        return Optional.ofNullable(cache.getIfPresent(interval));
    }

    @Override
    public void put(ScoreInterval interval, List<Cluster<K>> clusters) {
        cache.put(interval, List.copyOf(clusters));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
