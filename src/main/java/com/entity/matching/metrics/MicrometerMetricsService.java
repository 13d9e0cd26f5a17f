package com.entity.matching.metrics;

import com.entity.matching.core.model.MatchMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code matching.build.duration} (Timer, tag: mode)</li>
 *   <li>{@code matching.pairs.candidate} (Counter, tag: mode)</li>
 *   <li>{@code matching.pairs.filtered} (Counter, tag: mode)</li>
 *   <li>{@code matching.pairs.kept} (Counter, tag: mode)</li>
 *   <li>{@code matching.pair.score} (DistributionSummary)</li>
 *   <li>{@code matching.clusters} (DistributionSummary)</li>
 *   <li>{@code matching.cluster.cache.hit} / {@code matching.cluster.cache.miss} (Counter)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Map<MatchMode, Timer> buildTimers = new EnumMap<>(MatchMode.class);
    private final Map<MatchMode, Counter> candidateCounters = new EnumMap<>(MatchMode.class);
    private final Map<MatchMode, Counter> filteredCounters = new EnumMap<>(MatchMode.class);
    private final Map<MatchMode, Counter> keptCounters = new EnumMap<>(MatchMode.class);
    private final DistributionSummary pairScoreSummary;
    private final DistributionSummary clusterCountSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        for (MatchMode mode : MatchMode.values()) {
            String tag = mode.name();
            buildTimers.put(mode, Timer.builder("matching.build.duration")
                    .description("Duration of pair generation, scoring and sorting")
                    .tag("mode", tag)
                    .register(registry));
            candidateCounters.put(mode, Counter.builder("matching.pairs.candidate")
                    .description("Candidate pairs produced by blocking")
                    .tag("mode", tag)
                    .register(registry));
            filteredCounters.put(mode, Counter.builder("matching.pairs.filtered")
                    .description("Candidate pairs dropped by filters")
                    .tag("mode", tag)
                    .register(registry));
            keptCounters.put(mode, Counter.builder("matching.pairs.kept")
                    .description("Scored pairs kept in the result")
                    .tag("mode", tag)
                    .register(registry));
        }
        this.pairScoreSummary = DistributionSummary.builder("matching.pair.score")
                .description("Distribution of pair similarity scores")
                .register(registry);
        this.clusterCountSummary = DistributionSummary.builder("matching.clusters")
                .description("Number of clusters returned per cluster query")
                .register(registry);
        this.cacheHitCounter = Counter.builder("matching.cluster.cache.hit")
                .description("Cluster queries answered from cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("matching.cluster.cache.miss")
                .description("Cluster queries computed from scratch")
                .register(registry);
    }

    @Override
    public void recordBuildDuration(MatchMode mode, Duration duration) {
        buildTimers.get(mode).record(duration);
    }

    @Override
    public void recordPairCounts(MatchMode mode, long candidates, long filtered, long kept) {
        candidateCounters.get(mode).increment(candidates);
        filteredCounters.get(mode).increment(filtered);
        keptCounters.get(mode).increment(kept);
    }

    @Override
    public void recordPairScore(double score) {
        pairScoreSummary.record(score);
    }

    @Override
    public void recordClusterCount(int clusters) {
        clusterCountSummary.record(clusters);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
