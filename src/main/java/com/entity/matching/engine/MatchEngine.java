package com.entity.matching.engine;

import com.entity.matching.bulk.ProgressCallback;
import com.entity.matching.cache.CacheConfig;
import com.entity.matching.cache.CaffeineClusterCache;
import com.entity.matching.cache.ClusterCache;
import com.entity.matching.cache.NoOpClusterCache;
import com.entity.matching.core.model.Cluster;
import com.entity.matching.core.model.DecisionSummary;
import com.entity.matching.core.model.MatchMode;
import com.entity.matching.core.model.PairCollection;
import com.entity.matching.core.model.Row;
import com.entity.matching.core.model.ScoreInterval;
import com.entity.matching.core.model.ScoredPair;
import com.entity.matching.core.model.Table;
import com.entity.matching.filter.PairFilter;
import com.entity.matching.index.BlockingIndex;
import com.entity.matching.index.NoOpIndex;
import com.entity.matching.logging.LogContext;
import com.entity.matching.metrics.MetricsService;
import com.entity.matching.metrics.NoOpMetricsService;
import com.entity.matching.pair.DeduplicatePairer;
import com.entity.matching.pair.MatchPairer;
import com.entity.matching.pair.Pairer;
import com.entity.matching.pair.RecordPair;
import com.entity.matching.report.ExportResult;
import com.entity.matching.report.MatchReports;
import com.entity.matching.report.ReportExporter;
import com.entity.matching.report.ReportRow;
import com.entity.matching.scoring.RecordScorer;
import com.entity.matching.scoring.ScoreResult;
import com.entity.matching.similarity.FieldSimilarity;
import com.entity.matching.variation.Variator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Writer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Main entry point for matching two tables or deduplicating one.
 * All candidate pairs are generated and scored when the engine is built; every query
 * afterwards reads the same immutable, score-sorted pairs.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>The {@link BlockingIndex} decides which rows are compared.</li>
 *   <li>{@link PairFilter}s discard individual pairs.</li>
 *   <li>The {@link RecordScorer} scores every combination of row variations produced by
 *   the {@link Variator}; the best score is kept.</li>
 *   <li>In match mode, a greedy one-to-one reduction keeps at most one pair per row.</li>
 * </ol>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * MatchEngine&lt;Integer&gt; engine = MatchEngine.deduplicate(people)
 *     .index(FieldIndex.of("zip"))
 *     .fields(Map.of("last", new JaroWinklerSimilarity(), "first", new JaroWinklerSimilarity()))
 *     .build();
 *
 * List&lt;SortedSet&lt;Integer&gt;&gt; groups = engine.clustersWithin(0.8, 1.0);
 * DecisionSummary decision = engine.decision(0.9);
 * </pre>
 */
public class MatchEngine<K extends Comparable<K>> {
    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final MatchMode mode;
    private final Table<K> tableA;
    private final Table<K> tableB;
    private final MatchOptions options;
    private final MetricsService metricsService;
    private final ClusterCache<K> clusterCache;
    private final String runId;
    private final PairCollection<K> pairs;
    private final MatchReports<K> reports;

    private MatchEngine(Builder<K> builder) {
        this.mode = builder.tableB != null ? MatchMode.MATCH : MatchMode.DEDUPLICATE;
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.clusterCache = builder.clusterCache != null
                ? builder.clusterCache : new NoOpClusterCache<>();
        this.runId = LogContext.generateRunId();

        try (LogContext ctx = LogContext.forBuild(runId, mode)) {
            long start = System.nanoTime();
            Pairer<K> pairer = mode == MatchMode.MATCH
                    ? new MatchPairer<>(builder.tableA, builder.tableB, builder.index)
                    : new DeduplicatePairer<>(builder.tableA, builder.index);
            this.tableA = pairer.frameA();
            this.tableB = pairer.frameB();

            List<RecordPair<K>> candidates = pairer.pairs();
            log.debug("match.candidates count={}", candidates.size());

            List<RecordPair<K>> accepted = applyFilters(candidates, builder.filters);
            long filtered = candidates.size() - accepted.size();
            if (filtered > 0) {
                log.debug("match.filtered dropped={} kept={}", filtered, accepted.size());
            }

            List<ScoredPair<K>> scored = score(accepted, builder.scorer, builder.variator, builder.progressCallback);
            PairCollection<K> sorted = PairCollection.sorted(scored);
            this.pairs = mode == MatchMode.MATCH ? sorted.reduceOneToOne() : sorted;

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordBuildDuration(mode, elapsed);
            metricsService.recordPairCounts(mode, candidates.size(), filtered, pairs.size());

            log.info("match.built mode={} rowsA={} rowsB={} candidates={} filtered={} pairs={} durationMs={}",
                    mode, tableA.size(), tableB.size(), candidates.size(), filtered, pairs.size(),
                    elapsed.toMillis());
        }
        this.reports = new MatchReports<>(tableA, tableB);
    }

    private List<RecordPair<K>> applyFilters(List<RecordPair<K>> candidates, List<PairFilter> filters) {
        if (filters.isEmpty()) {
            return candidates;
        }
        List<RecordPair<K>> accepted = new ArrayList<>(candidates.size());
        for (RecordPair<K> pair : candidates) {
            boolean valid = true;
            for (PairFilter filter : filters) {
                if (!filter.valid(pair.left(), pair.right())) {
                    valid = false;
                    break;
                }
            }
            if (valid) {
                accepted.add(pair);
            }
        }
        return accepted;
    }

    private List<ScoredPair<K>> score(List<RecordPair<K>> candidates, RecordScorer<K> scorer,
                                      Variator variator, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ScoredPair<K>> scored = new ArrayList<>(candidates.size());
        int interval = options.getProgressInterval();

        for (RecordPair<K> pair : candidates) {
            double best = bestScore(pair, scorer, variator);
            scored.add(new ScoredPair<>(best, pair.left().getKey(), pair.right().getKey()));
            metricsService.recordPairScore(best);

            if (scored.size() % interval == 0) {
                cb.onProgress(scored.size(), candidates.size(), "Scored " + scored.size() + " pairs");
            }
        }
        cb.onProgress(scored.size(), candidates.size(), "Scoring completed");
        return scored;
    }

    /**
     * Scores every combination of variations of both rows and returns the highest score.
     */
    private double bestScore(RecordPair<K> pair, RecordScorer<K> scorer, Variator variator) {
        List<Row<K>> leftVariations = variator.variations(pair.left());
        List<Row<K>> rightVariations = variator.variations(pair.right());
        double best = 0.0;
        for (Row<K> left : leftVariations) {
            for (Row<K> right : rightVariations) {
                ScoreResult result = scorer.score(left, right);
                if (result.isRefused()) {
                    throw new UnrefusedScoringException(left.getKey(), right.getKey(), result.refusalReason());
                }
                best = Math.max(best, result.score());
            }
        }
        return best;
    }

    // ========== Pair queries ==========

    /**
     * Returns every kept pair, ascending by score.
     */
    public List<ScoredPair<K>> pairs() {
        return pairs.pairs();
    }

    /**
     * Returns the pairs within the default interval, ascending.
     */
    public List<ScoredPair<K>> indexPairsWithin() {
        return pairs.within(options.getInterval());
    }

    /**
     * Returns the pairs with {@code lower <= score <= upper}, ascending.
     */
    public List<ScoredPair<K>> indexPairsWithin(double lower, double upper) {
        return pairs.within(ScoreInterval.of(lower, upper));
    }

    // ========== Cluster queries ==========

    /**
     * Returns the member keys of the clusters within the default interval.
     */
    public List<SortedSet<K>> clustersWithin() {
        return clustersWithin(options.getLowerBound(), options.getUpperBound());
    }

    /**
     * Returns the member keys of the clusters formed by pairs with {@code lower <= score <= upper}.
     * In every cluster each member is paired with every other member.
     */
    public List<SortedSet<K>> clustersWithin(double lower, double upper) {
        List<Cluster<K>> clusters = clusterDetailsWithin(lower, upper);
        List<SortedSet<K>> members = new ArrayList<>(clusters.size());
        for (Cluster<K> cluster : clusters) {
            members.add(cluster.members());
        }
        return members;
    }

    public List<Cluster<K>> clusterDetailsWithin() {
        return clusterDetailsWithin(options.getLowerBound(), options.getUpperBound());
    }

    /**
     * Returns the clusters formed by pairs with {@code lower <= score <= upper}, together with
     * their pairs. Clusters are ordered by descending best score.
     */
    public List<Cluster<K>> clusterDetailsWithin(double lower, double upper) {
        ScoreInterval interval = ScoreInterval.of(lower, upper);
        Optional<List<Cluster<K>>> cached = clusterCache.get(interval);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            log.debug("cluster.cache.hit interval={}", interval);
            return cached.get();
        }
        metricsService.recordCacheMiss();

        try (LogContext ctx = LogContext.forClustering(runId, lower, upper)) {
            List<ScoredPair<K>> selected = pairs.within(interval);
            List<Cluster<K>> clusters = Collections.unmodifiableList(
                    new ClusterBuilder<K>(mode == MatchMode.MATCH).build(selected));
            metricsService.recordClusterCount(clusters.size());
            log.info("cluster.built pairs={} clusters={}", selected.size(), clusters.size());
            clusterCache.put(interval, clusters);
            return clusters;
        }
    }

    // ========== Reports ==========

    /**
     * Cluster report over the default interval, honouring the default exact-match setting.
     */
    public List<ReportRow<K>> clusterReport() {
        return clusterReport(options.getLowerBound(), options.getUpperBound(), options.isIncludeExactMatches());
    }

    /**
     * Two rows per clustered pair, clusters ranked by their best pair. With
     * {@code includeExactMatches} false, clusters made only of perfect-score pairs are left out.
     */
    public List<ReportRow<K>> clusterReport(double lower, double upper, boolean includeExactMatches) {
        return reports.clusterRows(clusterDetailsWithin(lower, upper), includeExactMatches);
    }

    public List<ReportRow<K>> samplePairs() {
        return samplePairs(options.getSampleCount(), options.getLowerBound(), options.getUpperBound(),
                options.getStep(), options.isIncludeExactMatches());
    }

    /**
     * Samples up to {@code sampleCount} pairs from each score range of width {@code step}
     * between {@code upper} and {@code lower}. A score lying on a range boundary belongs to
     * the range it is the upper bound of.
     */
    public List<ReportRow<K>> samplePairs(int sampleCount, double lower, double upper, double step,
                                          boolean includeExactMatches) {
        return reports.sampleRows(pairs, sampleCount, lower, upper, step, includeExactMatches);
    }

    public List<ReportRow<K>> allPairs() {
        return allPairs(options.getLowerBound(), options.getUpperBound(), options.isIncludeExactMatches());
    }

    /**
     * Two rows per pair with {@code lower <= score <= upper}, highest score first.
     */
    public List<ReportRow<K>> allPairs(double lower, double upper, boolean includeExactMatches) {
        ScoreInterval interval = ScoreInterval.of(lower, upper);
        return reports.pairRows(pairs, interval.lower(), interval.upper(), includeExactMatches);
    }

    /**
     * Summarises how many pairs a single match threshold would accept.
     */
    public DecisionSummary decision(double matchThreshold) {
        if (matchThreshold < 0.0 || matchThreshold > 1.0) {
            throw new IllegalArgumentException("matchThreshold must be between 0.0 and 1.0");
        }
        DecisionSummary summary = new DecisionSummary(matchThreshold, pairs.countAtLeast(matchThreshold),
                tableA.size(), tableB.size());
        log.debug("match.decision {}", summary);
        return summary;
    }

    /**
     * Writes the default samples, every pair within the default interval and the decision
     * summary for {@code matchThreshold}, as sections {@code samples} and {@code pairs}.
     */
    public ExportResult exportPairs(ReportExporter exporter, Writer writer, double matchThreshold) {
        Map<String, List<ReportRow<K>>> sections = new LinkedHashMap<>();
        sections.put("samples", samplePairs());
        sections.put("pairs", allPairs());
        return exporter.export(sections, decision(matchThreshold), writer);
    }

    /**
     * Writes the default cluster report and the decision summary for {@code matchThreshold},
     * as section {@code clusters}.
     */
    public ExportResult exportClusters(ReportExporter exporter, Writer writer, double matchThreshold) {
        Map<String, List<ReportRow<K>>> sections = new LinkedHashMap<>();
        sections.put("clusters", clusterReport());
        return exporter.export(sections, decision(matchThreshold), writer);
    }

    // ========== Accessors ==========

    public MatchMode getMode() {
        return mode;
    }

    /**
     * Returns the left table.
     */
    public Table<K> frameA() {
        return tableA;
    }

    /**
     * Returns the right table; the deduplicated table itself in deduplication mode.
     */
    public Table<K> frameB() {
        return tableB;
    }

    public MatchOptions getOptions() {
        return options;
    }

    /**
     * Returns the identifier placed in the logging context of this engine's build and queries.
     */
    public String getRunId() {
        return runId;
    }

    // ========== Builder ==========

    /**
     * Starts building an engine over {@code tableA}. Without {@link Builder#tableB(Table)}
     * the table is deduplicated.
     */
    public static <K extends Comparable<K>> Builder<K> builder(Table<K> tableA) {
        return new Builder<>(tableA);
    }

    /**
     * Starts building an engine matching {@code tableA} against {@code tableB}.
     */
    public static <K extends Comparable<K>> Builder<K> match(Table<K> tableA, Table<K> tableB) {
        return new Builder<>(tableA).tableB(tableB);
    }

    /**
     * Starts building an engine that deduplicates {@code table}.
     */
    public static <K extends Comparable<K>> Builder<K> deduplicate(Table<K> table) {
        return new Builder<>(table);
    }

    public static class Builder<K extends Comparable<K>> {
        private final Table<K> tableA;
        private Table<K> tableB;
        private BlockingIndex index = new NoOpIndex();
        private RecordScorer<K> scorer;
        private Variator variator = Variator.identity();
        private final List<PairFilter> filters = new ArrayList<>();
        private MatchOptions options = MatchOptions.defaults();
        private MetricsService metricsService;
        private ClusterCache<K> clusterCache;
        private ProgressCallback progressCallback;

        private Builder(Table<K> tableA) {
            this.tableA = Objects.requireNonNull(tableA, "tableA is required");
        }

        /**
         * Sets the right table and switches the engine to match mode.
         */
        public Builder<K> tableB(Table<K> tableB) {
            this.tableB = Objects.requireNonNull(tableB, "tableB is required");
            return this;
        }

        /**
         * Sets the blocking index. Defaults to comparing every pair.
         */
        public Builder<K> index(BlockingIndex index) {
            this.index = Objects.requireNonNull(index, "index is required");
            return this;
        }

        public Builder<K> scorer(RecordScorer<K> scorer) {
            this.scorer = Objects.requireNonNull(scorer, "scorer is required");
            return this;
        }

        /**
         * Scores with a weighted sum over the given field similarities.
         */
        public Builder<K> fields(Map<String, ? extends FieldSimilarity> fields) {
            this.scorer = RecordScorer.fields(fields);
            return this;
        }

        public Builder<K> variator(Variator variator) {
            this.variator = Objects.requireNonNull(variator, "variator is required");
            return this;
        }

        public Builder<K> filters(PairFilter... filters) {
            this.filters.addAll(Arrays.asList(filters));
            return this;
        }

        public Builder<K> filters(List<? extends PairFilter> filters) {
            this.filters.addAll(filters);
            return this;
        }

        /**
         * Sets the default query parameters.
         */
        public Builder<K> options(MatchOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder<K> metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a cache for cluster queries. No caching by default.
         */
        public Builder<K> clusterCache(ClusterCache<K> clusterCache) {
            this.clusterCache = clusterCache;
            return this;
        }

        /**
         * Caches cluster queries in a Caffeine cache with the given configuration.
         */
        public Builder<K> clusterCache(CacheConfig config) {
            this.clusterCache = new CaffeineClusterCache<>(config);
            return this;
        }

        public Builder<K> progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        /**
         * Generates and scores all candidate pairs.
         *
         * @throws com.entity.matching.core.model.StructuralException if a table has duplicated keys,
         *         the tables' fields differ, or a field the index or scorer needs is missing
         * @throws UnrefusedScoringException if the scorer refuses a pair
         */
        public MatchEngine<K> build() {
            if (scorer == null) {
                throw new IllegalStateException("A scorer or field similarities must be configured");
            }
            return new MatchEngine<>(this);
        }
    }
}
