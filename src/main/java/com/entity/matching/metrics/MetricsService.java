package com.entity.matching.metrics;

import com.entity.matching.core.model.MatchMode;

import java.time.Duration;

/**
 * Interface for recording matching metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics backend configured.
 */
public interface MetricsService {

    void recordBuildDuration(MatchMode mode, Duration duration);

    /**
     * Records the pair counts of one engine build.
     *
     * @param candidates pairs produced by the pairer
     * @param filtered   pairs dropped by filters
     * @param kept       pairs left after the one-to-one reduction (match mode) or all scored pairs
     */
    void recordPairCounts(MatchMode mode, long candidates, long filtered, long kept);

    void recordPairScore(double score);

    void recordClusterCount(int clusters);

    void recordCacheHit();

    void recordCacheMiss();
}
