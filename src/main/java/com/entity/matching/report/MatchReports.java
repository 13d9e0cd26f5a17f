package com.entity.matching.report;

import com.entity.matching.core.model.Cluster;
import com.entity.matching.core.model.PairCollection;
import com.entity.matching.core.model.Row;
import com.entity.matching.core.model.ScoredPair;
import com.entity.matching.core.model.StructuralException;
import com.entity.matching.core.model.Table;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Turns pairs and clusters into ranked report rows carrying the full field values
 * of both tables' rows.
 */
public class MatchReports<K extends Comparable<K>> {

    private final Table<K> tableA;
    private final Table<K> tableB;

    public MatchReports(Table<K> tableA, Table<K> tableB) {
        this.tableA = tableA;
        this.tableB = tableB;
    }

    /**
     * Clusters ranked by their best pair, pairs within a cluster by descending score.
     * Cluster indices are assigned before exact-match clusters are dropped, so
     * they stay stable whatever {@code includeExactMatches} is.
     */
    public List<ReportRow<K>> clusterRows(List<Cluster<K>> clusters, boolean includeExactMatches) {
        List<Cluster<K>> ranked = new ArrayList<>(clusters);
        ranked.sort((c1, c2) -> Double.compare(c2.maxScore(), c1.maxScore()));

        List<ReportRow<K>> rows = new ArrayList<>();
        for (int clusterIndex = 0; clusterIndex < ranked.size(); clusterIndex++) {
            Cluster<K> cluster = ranked.get(clusterIndex);
            if (!includeExactMatches && cluster.isExactMatch()) {
                continue;
            }
            List<ScoredPair<K>> pairs = cluster.pairs();
            for (int pairIndex = 0; pairIndex < pairs.size(); pairIndex++) {
                addPair(rows, String.valueOf(clusterIndex), pairIndex, pairs.get(pairIndex));
            }
        }
        return rows;
    }

    /**
     * Samples up to {@code sampleCount} pairs per score range of width {@code step}, walking
     * from {@code upper} down to {@code lower}. Each range excludes its lower bound and
     * includes its upper bound. The lowest-scoring pairs of a range are sampled and listed
     * highest first.
     */
    public List<ReportRow<K>> sampleRows(PairCollection<K> pairs, int sampleCount, double lower,
                                         double upper, double step, boolean includeExactMatches) {
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("sampleCount must be positive");
        }
        if (!(step > 0.0)) {
            throw new IllegalArgumentException("step must be positive");
        }
        if (lower > upper) {
            throw new IllegalArgumentException("lower bound must be <= upper bound");
        }

        List<Double> bounds = rangeBounds(lower, upper, step);
        List<ReportRow<K>> rows = new ArrayList<>();
        for (int i = 0; i < bounds.size() - 1; i++) {
            double hi = bounds.get(i);
            double lo = bounds.get(i + 1);
            String label = String.format(Locale.ROOT, "%.2f-%.2f", hi, lo);

            List<ScoredPair<K>> inRange = pairs.withinExcludingLower(lo, hi);
            List<ScoredPair<K>> sample = new ArrayList<>(inRange.subList(0, Math.min(sampleCount, inRange.size())));
            Collections.reverse(sample);
            for (int pairIndex = 0; pairIndex < sample.size(); pairIndex++) {
                ScoredPair<K> pair = sample.get(pairIndex);
                if (!includeExactMatches && pair.isExactMatch()) {
                    continue;
                }
                addPair(rows, label, pairIndex, pair);
            }
        }
        return rows;
    }

    /**
     * All pairs within {@code [lower, upper]}, highest score first.
     */
    public List<ReportRow<K>> pairRows(PairCollection<K> pairs, double lower, double upper,
                                       boolean includeExactMatches) {
        List<ScoredPair<K>> selected = new ArrayList<>(pairs.within(lower, upper));
        Collections.reverse(selected);
        List<ReportRow<K>> rows = new ArrayList<>();
        for (int pairIndex = 0; pairIndex < selected.size(); pairIndex++) {
            ScoredPair<K> pair = selected.get(pairIndex);
            if (!includeExactMatches && pair.isExactMatch()) {
                continue;
            }
            addPair(rows, null, pairIndex, pair);
        }
        return rows;
    }

    /**
     * Range bounds from {@code upper} down to {@code lower}: upper, upper - step, ..., lower.
     * Bounds are computed in decimal so that they land exactly on the step grid.
     */
    static List<Double> rangeBounds(double lower, double upper, double step) {
        BigDecimal top = BigDecimal.valueOf(upper);
        BigDecimal width = BigDecimal.valueOf(step);
        int count = top.subtract(BigDecimal.valueOf(lower)).divide(width, 0, RoundingMode.CEILING).intValue();
        List<Double> bounds = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            bounds.add(top.subtract(width.multiply(BigDecimal.valueOf(i))).doubleValue());
        }
        bounds.add(lower);
        return bounds;
    }

    private void addPair(List<ReportRow<K>> rows, String group, int pairIndex, ScoredPair<K> pair) {
        rows.add(new ReportRow<>(group, pairIndex, pair.score(), pair.keyA(), lookup(tableA, pair.keyA()).getValues()));
        rows.add(new ReportRow<>(group, pairIndex, pair.score(), pair.keyB(), lookup(tableB, pair.keyB()).getValues()));
    }

    private static <K extends Comparable<K>> Row<K> lookup(Table<K> table, K key) {
        return table.row(key).orElseThrow(() -> new StructuralException("Key " + key + " does not exist in table"));
    }
}
