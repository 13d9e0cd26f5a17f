package com.entity.matching.core.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PairCollection Tests")
class PairCollectionTest {

    private PairCollection<Integer> collection;

    @BeforeEach
    void setUp() {
        collection = PairCollection.sorted(List.of(
                new ScoredPair<>(0.9, 0, 1),
                new ScoredPair<>(0.5, 0, 2),
                new ScoredPair<>(0.7, 1, 2),
                new ScoredPair<>(1.0, 3, 4),
                new ScoredPair<>(0.7, 2, 3),
                new ScoredPair<>(0.8, 1, 4)));
    }

    @Test
    @DisplayName("Pairs are sorted ascending and ties keep insertion order")
    void sortedAscendingStable() {
        List<ScoredPair<Integer>> pairs = collection.pairs();
        for (int i = 1; i < pairs.size(); i++) {
            assertTrue(pairs.get(i - 1).score() <= pairs.get(i).score());
        }
        assertEquals(new ScoredPair<>(0.7, 1, 2), pairs.get(1));
        assertEquals(new ScoredPair<>(0.7, 2, 3), pairs.get(2));
    }

    @ParameterizedTest
    @DisplayName("within() returns exactly the pairs inside the closed interval")
    @CsvSource({
            "0.0, 1.0",
            "0.7, 0.7",
            "0.7, 0.9",
            "0.71, 0.79",
            "0.95, 1.0",
            "0.5, 0.5"
    })
    void withinMatchesLinearScan(double lower, double upper) {
        List<ScoredPair<Integer>> expected = new ArrayList<>();
        for (ScoredPair<Integer> pair : collection.pairs()) {
            if (pair.score() >= lower && pair.score() <= upper) {
                expected.add(pair);
            }
        }
        assertEquals(expected, collection.within(lower, upper));
    }

    @Test
    @DisplayName("withinExcludingLower() drops pairs on the lower bound")
    void withinExcludingLower() {
        List<ScoredPair<Integer>> pairs = collection.withinExcludingLower(0.7, 0.9);
        assertEquals(2, pairs.size());
        assertEquals(0.8, pairs.get(0).score());
        assertEquals(0.9, pairs.get(1).score());
    }

    @Test
    @DisplayName("countAtLeast() counts scores at or above the threshold")
    void countAtLeast() {
        assertEquals(3, collection.countAtLeast(0.8));
        assertEquals(5, collection.countAtLeast(0.7));
        assertEquals(1, collection.countAtLeast(1.0));
        assertEquals(6, collection.countAtLeast(0.0));
    }

    @Test
    @DisplayName("One-to-one reduction never keeps two pairs sharing a key on the same side")
    void oneToOneReduction() {
        PairCollection<Integer> reduced = collection.reduceOneToOne();

        Set<Integer> left = new HashSet<>();
        Set<Integer> right = new HashSet<>();
        for (ScoredPair<Integer> pair : reduced.pairs()) {
            assertTrue(left.add(pair.keyA()), "left key reused: " + pair.keyA());
            assertTrue(right.add(pair.keyB()), "right key reused: " + pair.keyB());
        }
        // (1, 4) loses right key 4 to (3, 4); (0, 2) loses left key 0 to (0, 1)
        assertEquals(List.of(
                new ScoredPair<>(0.7, 1, 2),
                new ScoredPair<>(0.7, 2, 3),
                new ScoredPair<>(0.9, 0, 1),
                new ScoredPair<>(1.0, 3, 4)), reduced.pairs());
    }

    @Test
    @DisplayName("Empty collection answers every query with nothing")
    void emptyCollection() {
        PairCollection<Integer> empty = PairCollection.sorted(List.of());
        assertTrue(empty.isEmpty());
        assertEquals(List.of(), empty.within(0.0, 1.0));
        assertEquals(0, empty.countAtLeast(0.5));
        assertTrue(empty.reduceOneToOne().isEmpty());
    }
}
