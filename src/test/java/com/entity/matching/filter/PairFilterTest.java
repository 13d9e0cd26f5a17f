package com.entity.matching.filter;

import com.entity.matching.core.model.MissingFieldException;
import com.entity.matching.core.model.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pair Filter Tests")
class PairFilterTest {

    @Nested
    @DisplayName("DissimilarFilter")
    class DissimilarTests {

        private final DissimilarFilter filter = new DissimilarFilter("household");

        @Test
        @DisplayName("Drops pairs with equal values")
        void dropsEqual() {
            assertFalse(filter.valid(new Row<>(0, Map.of("household", "h1")), new Row<>(1, Map.of("household", "h1"))));
            assertTrue(filter.valid(new Row<>(0, Map.of("household", "h1")), new Row<>(1, Map.of("household", "h2"))));
        }

        @Test
        @DisplayName("Keeps pairs with a null value")
        void keepsNull() {
            Map<String, Object> withNull = new HashMap<>();
            withNull.put("household", null);
            assertTrue(filter.valid(new Row<>(0, withNull), new Row<>(1, withNull)));
        }

        @Test
        @DisplayName("Missing field fails unless ignored")
        void missingField() {
            Row<Integer> a = new Row<>(0, Map.of("name", "x"));
            assertThrows(MissingFieldException.class, () -> filter.valid(a, a));
            assertTrue(new DissimilarFilter("household", true).valid(a, a));
        }
    }

    @Nested
    @DisplayName("NonOverlappingFilter")
    class NonOverlappingTests {

        private final NonOverlappingFilter filter = new NonOverlappingFilter("start", "end");

        private Row<Integer> range(int key, Object start, Object end) {
            Map<String, Object> values = new HashMap<>();
            values.put("start", start);
            values.put("end", end);
            return new Row<>(key, values);
        }

        @ParameterizedTest
        @DisplayName("Keeps only pairs whose ranges are disjoint")
        @CsvSource({
                "1, 5, 6, 9, true",
                "6, 9, 1, 5, true",
                "1, 5, 5, 9, false",
                "1, 9, 3, 4, false",
                "3, 4, 1, 9, false"
        })
        void disjointRanges(int startA, int endA, int startB, int endB, boolean expected) {
            assertEquals(expected, filter.valid(range(0, startA, endA), range(1, startB, endB)));
        }

        @Test
        @DisplayName("Works with any comparable bounds")
        void comparableBounds() {
            Row<Integer> a = range(0, LocalDate.of(2020, 1, 1), LocalDate.of(2020, 1, 31));
            Row<Integer> b = range(1, LocalDate.of(2020, 2, 1), LocalDate.of(2020, 2, 28));
            assertTrue(filter.valid(a, b));
        }

        @Test
        @DisplayName("Drops pairs with a missing bound instead of failing")
        void nullBounds() {
            assertFalse(filter.valid(range(0, 1, 5), range(1, null, 9)));
            assertFalse(filter.valid(range(0, 1, null), range(1, 6, 9)));
            assertFalse(filter.valid(range(0, null, null), range(1, null, null)));
        }
    }
}
