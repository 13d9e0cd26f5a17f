package com.entity.matching.cache;

import java.time.Duration;

/**
 * Configuration for the cluster cache.
 *
 * @param maxIntervals      maximum number of distinct score intervals kept
 * @param expireAfterAccess how long an unused entry is kept
 */
public record CacheConfig(int maxIntervals, Duration expireAfterAccess) {

    public CacheConfig {
        if (maxIntervals <= 0) {
            throw new IllegalArgumentException("maxIntervals must be > 0");
        }
        if (expireAfterAccess == null || expireAfterAccess.isNegative() || expireAfterAccess.isZero()) {
            throw new IllegalArgumentException("expireAfterAccess must be positive");
        }
    }

    /**
     * 32 intervals, kept for 10 minutes after last use.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(32, Duration.ofMinutes(10));
    }
}
