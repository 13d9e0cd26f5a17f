package com.entity.matching.metrics;

import com.entity.matching.core.model.MatchMode;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordBuildDuration(MatchMode mode, Duration duration) {
    }

    @Override
    public void recordPairCounts(MatchMode mode, long candidates, long filtered, long kept) {
    }

    @Override
    public void recordPairScore(double score) {
    }

    @Override
    public void recordClusterCount(int clusters) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
