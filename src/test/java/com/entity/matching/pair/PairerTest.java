package com.entity.matching.pair;

import com.entity.matching.core.model.StructuralException;
import com.entity.matching.core.model.Table;
import com.entity.matching.index.CompositeIndex;
import com.entity.matching.index.FieldIndex;
import com.entity.matching.index.NoOpIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pairer Tests")
class PairerTest {

    private static List<List<Integer>> keys(List<RecordPair<Integer>> pairs) {
        List<List<Integer>> keys = new ArrayList<>();
        for (RecordPair<Integer> pair : pairs) {
            keys.add(List.of(pair.left().getKey(), pair.right().getKey()));
        }
        return keys;
    }

    @Nested
    @DisplayName("MatchPairer")
    class MatchTests {

        @Test
        @DisplayName("No-op index pairs every left row with every right row")
        void crossProduct() {
            Table<Integer> a = Table.numbered(List.of("name"), new Object[]{"ab"});
            Table<Integer> b = Table.numbered(List.of("name"), new Object[]{"ab"}, new Object[]{"ae"}, new Object[]{"rt"});

            MatchPairer<Integer> pairer = new MatchPairer<>(a, b, new NoOpIndex());

            assertEquals(List.of(List.of(0, 0), List.of(0, 1), List.of(0, 2)), keys(pairer.pairs()));
            assertSame(a, pairer.frameA());
            assertSame(b, pairer.frameB());
        }

        @Test
        @DisplayName("Only rows sharing a bucket are paired")
        void sharedBucketsOnly() {
            Table<Integer> a = Table.numbered(List.of("name", "city"),
                    new Object[]{"beech", "paris"}, new Object[]{"dupas", "lyon"});
            Table<Integer> b = Table.numbered(List.of("name", "city"),
                    new Object[]{"beach", "lyon"}, new Object[]{"bech", "paris"}, new Object[]{"x", "nice"});

            List<RecordPair<Integer>> pairs = new MatchPairer<>(a, b, FieldIndex.of("city")).pairs();

            assertEquals(List.of(List.of(0, 1), List.of(1, 0)), keys(pairs));
        }

        @Test
        @DisplayName("A pair reachable through several buckets is generated once")
        void deduplicatesAcrossBuckets() {
            Table<Integer> a = Table.numbered(List.of("first", "last"), new Object[]{"ann", "lee"});
            Table<Integer> b = Table.numbered(List.of("first", "last"), new Object[]{"ann", "lee"});

            List<RecordPair<Integer>> pairs = new MatchPairer<>(a, b,
                    CompositeIndex.union(FieldIndex.of("first"), FieldIndex.of("last"))).pairs();

            assertEquals(1, pairs.size());
        }

        @Test
        @DisplayName("Duplicated keys are rejected")
        void duplicatedKeys() {
            Table<String> a = Table.<String>builder("name").row("k", "x").row("k", "y").build();
            Table<String> b = Table.<String>builder("name").row("k", "x").build();

            StructuralException e = assertThrows(StructuralException.class,
                    () -> new MatchPairer<>(a, b, new NoOpIndex()));
            assertTrue(e.getMessage().contains("duplicates"));
        }

        @Test
        @DisplayName("Tables with different fields are rejected")
        void differentFields() {
            Table<Integer> a = Table.numbered(List.of("name"), new Object[]{"x"});
            Table<Integer> b = Table.numbered(List.of("title"), new Object[]{"x"});

            assertThrows(StructuralException.class, () -> new MatchPairer<>(a, b, new NoOpIndex()));
        }

        @Test
        @DisplayName("Field order does not matter")
        void fieldOrderIgnored() {
            Table<Integer> a = Table.numbered(List.of("first", "last"), new Object[]{"ann", "lee"});
            Table<Integer> b = Table.numbered(List.of("last", "first"), new Object[]{"lee", "ann"});

            assertDoesNotThrow(() -> new MatchPairer<>(a, b, new NoOpIndex()));
        }
    }

    @Nested
    @DisplayName("DeduplicatePairer")
    class DeduplicateTests {

        @Test
        @DisplayName("Pairs each 2-combination of a bucket once, without self pairs")
        void combinations() {
            Table<Integer> table = Table.numbered(List.of("name"),
                    new Object[]{"a"}, new Object[]{"b"}, new Object[]{"c"});

            DeduplicatePairer<Integer> pairer = new DeduplicatePairer<>(table, new NoOpIndex());

            assertEquals(List.of(List.of(0, 1), List.of(0, 2), List.of(1, 2)), keys(pairer.pairs()));
            assertSame(pairer.frameA(), pairer.frameB());
        }

        @Test
        @DisplayName("Overlapping buckets do not repeat pairs")
        void overlappingBuckets() {
            Table<Integer> table = Table.numbered(List.of("first", "last"),
                    new Object[]{"ann", "lee"},
                    new Object[]{"ann", "lee"},
                    new Object[]{"bob", "lee"});

            List<RecordPair<Integer>> pairs = new DeduplicatePairer<>(table,
                    CompositeIndex.union(FieldIndex.of("first"), FieldIndex.of("last"))).pairs();

            assertEquals(3, pairs.size());
        }

        @Test
        @DisplayName("Singleton buckets produce no pairs")
        void singletonBuckets() {
            Table<Integer> table = Table.numbered(List.of("name"), new Object[]{"a"}, new Object[]{"b"});
            assertTrue(new DeduplicatePairer<>(table, FieldIndex.of("name")).pairs().isEmpty());
        }

        @Test
        @DisplayName("Duplicated keys are rejected")
        void duplicatedKeys() {
            Table<String> table = Table.<String>builder("name").row("k", "x").row("k", "y").build();
            assertThrows(StructuralException.class, () -> new DeduplicatePairer<>(table, new NoOpIndex()));
        }
    }
}
