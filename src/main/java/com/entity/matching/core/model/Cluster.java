package com.entity.matching.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A group of rows in which every pair of members was scored within the queried
 * interval. Pairs are ordered by descending score.
 *
 * <p>{@code members} always holds at least two row keys. In match mode the members are
 * the left and right keys of the cluster's pairs taken together.</p>
 */
public record Cluster<K extends Comparable<K>>(SortedSet<K> members, List<ScoredPair<K>> pairs) {

    public Cluster {
        if (members.size() < 2 || pairs.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least two members and one pair");
        }
        members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
        List<ScoredPair<K>> sorted = new ArrayList<>(pairs);
        sorted.sort(Comparator.comparingDouble((ScoredPair<K> p) -> p.score()).reversed());
        pairs = Collections.unmodifiableList(sorted);
    }

    /**
     * Returns the score of the best pair in this cluster.
     */
    public double maxScore() {
        return pairs.isEmpty() ? 0.0 : pairs.get(0).score();
    }

    /**
     * Returns true if every pair in the cluster scored exactly 1.0.
     */
    public boolean isExactMatch() {
        double sum = 0.0;
        for (ScoredPair<K> pair : pairs) {
            sum += pair.score();
        }
        return sum == pairs.size();
    }

    public int size() {
        return members.size();
    }
}
