package com.entity.matching.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Table and Row Tests")
class TableTest {

    @Nested
    @DisplayName("Row")
    class RowTests {

        @Test
        @DisplayName("Null values are distinct from missing fields")
        void nullValueVersusMissingField() {
            Map<String, Object> values = new HashMap<>();
            values.put("name", null);
            Row<Integer> row = new Row<>(1, values);

            assertTrue(row.has("name"));
            assertTrue(row.isNull("name"));
            assertNull(row.get("name"));
            assertFalse(row.has("city"));
            MissingFieldException e = assertThrows(MissingFieldException.class, () -> row.get("city"));
            assertEquals("city", e.getField());
        }

        @Test
        @DisplayName("with() returns a modified copy")
        void withReturnsCopy() {
            Row<Integer> row = new Row<>(1, Map.of("name", "beech"));
            Row<Integer> copy = row.with("name", "dupas");

            assertEquals("beech", row.get("name"));
            assertEquals("dupas", copy.get("name"));
            assertEquals(1, copy.getKey());
        }

        @Test
        @DisplayName("Values are unmodifiable")
        void valuesUnmodifiable() {
            Row<Integer> row = new Row<>(1, Map.of("name", "beech"));
            assertThrows(UnsupportedOperationException.class, () -> row.getValues().put("x", 1));
        }
    }

    @Nested
    @DisplayName("Table")
    class TableTests {

        @Test
        @DisplayName("numbered() keys rows by position")
        void numberedKeys() {
            Table<Integer> table = Table.numbered(List.of("first", "last"),
                    new Object[]{"freddie", "beech"},
                    new Object[]{"demia", "dupas"});

            assertEquals(List.of(0, 1), table.keys());
            assertEquals("dupas", table.row(1).orElseThrow().get("last"));
            assertTrue(table.row(5).isEmpty());
        }

        @Test
        @DisplayName("Builder rejects rows with the wrong number of values")
        void builderRejectsWrongArity() {
            Table.Builder<String> builder = Table.<String>builder("first", "last");
            assertThrows(StructuralException.class, () -> builder.row("a", "only-one"));
        }

        @Test
        @DisplayName("of() rejects rows whose fields differ from the table's")
        void ofRejectsMismatchedRows() {
            Row<Integer> row = new Row<>(0, Map.of("first", "freddie"));
            assertThrows(StructuralException.class, () -> Table.of(List.of("first", "last"), List.of(row)));
        }

        @Test
        @DisplayName("Duplicated keys are accepted but reported")
        void duplicatedKeys() {
            Table<String> table = Table.<String>builder("name")
                    .row("a", "beech")
                    .row("a", "dupas")
                    .build();

            assertEquals(2, table.size());
            assertFalse(table.hasUniqueKeys());
            assertEquals("beech", table.row("a").orElseThrow().get("name"));
        }

        @Test
        @DisplayName("subset() keeps the requested order and fails on unknown keys")
        void subset() {
            Table<Integer> table = Table.numbered(List.of("name"),
                    new Object[]{"a"}, new Object[]{"b"}, new Object[]{"c"});

            Table<Integer> subset = table.subset(List.of(2, 0));
            assertEquals(List.of(2, 0), subset.keys());
            assertEquals(List.of("name"), subset.fields());
            assertThrows(StructuralException.class, () -> table.subset(List.of(7)));
        }
    }
}
