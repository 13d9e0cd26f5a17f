package com.entity.matching.bulk;

import com.entity.matching.core.model.Row;
import com.entity.matching.core.model.StructuralException;
import com.entity.matching.core.model.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("Table Loader Tests")
class TableLoaderTest {

    @Nested
    @DisplayName("CSV")
    @ExtendWith(MockitoExtension.class)
    class CsvTests {

        private final CsvTableLoader loader = new CsvTableLoader();

        @Mock
        private ProgressCallback callback;

        @Test
        @DisplayName("Should key rows by the key column and drop it from the fields")
        void keyedLoad() {
            String csv = """
                    id,name,city
                    a1,"Beech, Ltd",Paris
                    a2,Dupas,
                    """;

            Table<String> table = loader.load(new StringReader(csv), "id");

            assertEquals(List.of("name", "city"), table.fields());
            assertEquals(List.of("a1", "a2"), table.keys());
            Row<String> first = table.row("a1").orElseThrow();
            assertEquals("Beech, Ltd", first.get("name"));
            assertEquals("Paris", first.get("city"));
            assertTrue(table.row("a2").orElseThrow().isNull("city"));
        }

        @Test
        @DisplayName("Should number rows from zero when no key is given")
        void numberedLoad() {
            String csv = """
                    name,city

                    Beech,Paris
                    Dupas,Lyon
                    """;

            Table<Integer> table = loader.loadNumbered(new StringReader(csv));

            assertEquals(List.of(0, 1), table.keys());
            assertEquals(List.of("name", "city"), table.fields());
            assertEquals("Lyon", table.row(1).orElseThrow().get("city"));
        }

        @Test
        @DisplayName("Should unescape doubled quotes and keep quoted whitespace")
        void quotedValues() {
            List<String> cells = CsvTableLoader.parseLine("\"say \"\"hi\"\"\", plain ,\"  padded \",", 1);

            assertEquals(4, cells.size());
            assertEquals("say \"hi\"", cells.get(0));
            assertEquals("plain", cells.get(1));
            assertEquals("  padded ", cells.get(2));
            assertNull(cells.get(3));
        }

        @Test
        @DisplayName("Should reject malformed input")
        void malformedInput() {
            assertThrows(StructuralException.class,
                    () -> loader.load(new StringReader(""), "id"));
            assertThrows(StructuralException.class,
                    () -> loader.load(new StringReader("name\nBeech\n"), "id"));
            assertThrows(StructuralException.class,
                    () -> loader.load(new StringReader("id,name\na1,Beech,extra\n"), "id"));
            assertThrows(StructuralException.class,
                    () -> loader.load(new StringReader("id,name\n,Beech\n"), "id"));
            assertThrows(StructuralException.class,
                    () -> loader.load(new StringReader("id,name\na1,\"Beech\n"), "id"));
            assertThrows(IllegalArgumentException.class,
                    () -> loader.load(new StringReader("id\n"), null));
        }

        @Test
        @DisplayName("Should report completion to the progress callback")
        void progress() {
            StringBuilder csv = new StringBuilder("name\n");
            for (int i = 0; i < 250; i++) {
                csv.append("row").append(i).append('\n');
            }

            Table<Integer> table = loader.loadNumbered(new StringReader(csv.toString()), callback);

            assertEquals(250, table.size());
            verify(callback).onProgress(eq(100L), eq(-1L), anyString());
            verify(callback).onProgress(eq(200L), eq(-1L), anyString());
            verify(callback).onProgress(250L, 250L, "Load completed");
        }

        @Test
        @DisplayName("Format should be csv")
        void format() {
            assertEquals("csv", loader.getFormat());
        }
    }

    @Nested
    @DisplayName("JSON")
    class JsonTests {

        private final JsonTableLoader loader = new JsonTableLoader();

        @Test
        @DisplayName("Should load a top-level array with typed values")
        void arrayInput() {
            String json = """
                    [
                      {"id": "a1", "name": "Beech Ltd", "employees": 12, "listed": true,
                       "revenue": 1.5, "aliases": ["Beech", "BL"]},
                      {"id": "a2", "name": "Dupas", "employees": 5000000000, "listed": false,
                       "revenue": null, "aliases": null}
                    ]
                    """;

            Table<String> table = loader.load(new StringReader(json), "id");

            assertEquals(List.of("name", "employees", "listed", "revenue", "aliases"), table.fields());
            Row<String> a1 = table.row("a1").orElseThrow();
            assertEquals(12, a1.get("employees"));
            assertEquals(Boolean.TRUE, a1.get("listed"));
            assertEquals(1.5, a1.get("revenue"));
            assertEquals(List.of("Beech", "BL"), a1.get("aliases"));
            Row<String> a2 = table.row("a2").orElseThrow();
            assertEquals(5_000_000_000L, a2.get("employees"));
            assertTrue(a2.isNull("revenue"));
        }

        @Test
        @DisplayName("Should load JSON Lines and convert numeric keys to strings")
        void jsonLines() {
            String jsonl = """
                    {"id": 1, "name": "Beech"}
                    {"id": 2, "name": "Dupas"}
                    """;

            Table<String> table = loader.load(new StringReader(jsonl), "id");

            assertEquals(List.of("1", "2"), table.keys());
            assertEquals(List.of("name"), table.fields());
        }

        @Test
        @DisplayName("Should number rows when no key is given")
        void numbered() {
            Table<Integer> table = loader.loadNumbered(new StringReader("[{\"name\":\"x\"},{\"name\":\"y\"}]"));

            assertEquals(List.of(0, 1), table.keys());
            assertEquals("y", table.row(1).orElseThrow().get("name"));
        }

        @Test
        @DisplayName("Should reject malformed input")
        void malformedInput() {
            assertThrows(StructuralException.class,
                    () -> loader.load(new StringReader("[{\"id\": \"a1\""), "id"));
            assertThrows(StructuralException.class,
                    () -> loader.load(new StringReader("[{\"name\": \"Beech\"}]"), "id"));
            assertThrows(StructuralException.class,
                    () -> loader.load(new StringReader("[{\"id\": null}]"), "id"));
            assertThrows(StructuralException.class,
                    () -> loader.load(new StringReader("[1, 2]"), "id"));
        }
    }
}
