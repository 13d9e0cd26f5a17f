package com.entity.matching.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scored pairs sorted by ascending score, with a parallel array of the scores so that
 * score ranges can be located by binary search. Immutable once built.
 */
public final class PairCollection<K extends Comparable<K>> {

    private final List<ScoredPair<K>> pairs;
    private final double[] scores;

    private PairCollection(List<ScoredPair<K>> sortedPairs) {
        this.pairs = Collections.unmodifiableList(new ArrayList<>(sortedPairs));
        this.scores = new double[pairs.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = pairs.get(i).score();
        }
    }

    /**
     * Sorts the pairs by ascending score. Pairs with equal scores keep their relative order.
     */
    public static <K extends Comparable<K>> PairCollection<K> sorted(List<ScoredPair<K>> pairs) {
        List<ScoredPair<K>> sorted = new ArrayList<>(pairs);
        sorted.sort(Comparator.comparingDouble(ScoredPair::score));
        return new PairCollection<>(sorted);
    }

    /**
     * Greedy one-to-one reduction: walks pairs from the highest score down and keeps a pair
     * only if neither of its keys was claimed by a better pair. Every left key and every
     * right key then appears in at most one pair. This approximates, but does not guarantee,
     * a maximum-weight matching.
     */
    public PairCollection<K> reduceOneToOne() {
        Set<K> claimedA = new HashSet<>();
        Set<K> claimedB = new HashSet<>();
        List<ScoredPair<K>> kept = new ArrayList<>();
        for (int i = pairs.size() - 1; i >= 0; i--) {
            ScoredPair<K> pair = pairs.get(i);
            if (claimedA.contains(pair.keyA()) || claimedB.contains(pair.keyB())) {
                continue;
            }
            claimedA.add(pair.keyA());
            claimedB.add(pair.keyB());
            kept.add(pair);
        }
        Collections.reverse(kept);
        return new PairCollection<>(kept);
    }

    /**
     * Returns the pairs with {@code lower <= score <= upper}, ascending.
     */
    public List<ScoredPair<K>> within(double lower, double upper) {
        return slice(bisectLeft(lower), bisectRight(upper));
    }

    public List<ScoredPair<K>> within(ScoreInterval interval) {
        return within(interval.lower(), interval.upper());
    }

    /**
     * Returns the pairs with {@code lower < score <= upper}, ascending.
     */
    public List<ScoredPair<K>> withinExcludingLower(double lower, double upper) {
        return slice(bisectRight(lower), bisectRight(upper));
    }

    /**
     * Returns the number of pairs scoring at least {@code threshold}.
     */
    public int countAtLeast(double threshold) {
        return scores.length - bisectLeft(threshold);
    }

    /**
     * Returns all pairs, ascending by score.
     */
    public List<ScoredPair<K>> pairs() {
        return pairs;
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    private List<ScoredPair<K>> slice(int from, int to) {
        if (from >= to) {
            return List.of();
        }
        return pairs.subList(from, to);
    }

    /**
     * Index of the first score {@code >= value}.
     */
    int bisectLeft(double value) {
        int lo = 0;
        int hi = scores.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (scores[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * Index of the first score {@code > value}.
     */
    int bisectRight(double value) {
        int lo = 0;
        int hi = scores.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (scores[mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
