package com.entity.matching.scoring;

import com.entity.matching.core.model.MissingFieldException;
import com.entity.matching.core.model.Row;
import com.entity.matching.similarity.ExactSimilarity;
import com.entity.matching.similarity.FieldSimilarity;
import com.entity.matching.similarity.JaroWinklerSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("Record Scorer Tests")
class RecordScorerTest {

    private static Row<Integer> row(int key, Object... fieldValuePairs) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < fieldValuePairs.length; i += 2) {
            values.put((String) fieldValuePairs[i], fieldValuePairs[i + 1]);
        }
        return new Row<>(key, values);
    }

    @Nested
    @DisplayName("ScoreResult")
    class ScoreResultTests {

        @Test
        @DisplayName("A refusal carries a reason and no score")
        void refusal() {
            ScoreResult refused = ScoreResult.refuse("no data");
            assertTrue(refused.isRefused());
            assertEquals("no data", refused.refusalReason());
            assertThrows(IllegalStateException.class, refused::score);
        }

        @Test
        @DisplayName("Scores must lie in [0, 1]")
        void bounds() {
            assertThrows(IllegalArgumentException.class, () -> ScoreResult.of(1.01));
            assertThrows(IllegalArgumentException.class, () -> ScoreResult.of(-0.1));
            assertFalse(ScoreResult.of(0.0).isRefused());
        }
    }

    @Nested
    @DisplayName("WeightedSumScorer")
    @ExtendWith(MockitoExtension.class)
    class WeightedSumTests {

        @Mock
        private FieldSimilarity similarity;

        @Test
        @DisplayName("Combines field similarities as a root mean square")
        void rootMeanSquare() {
            Map<String, FieldSimilarity> fields = new LinkedHashMap<>();
            fields.put("first", (a, b) -> 0.6);
            fields.put("last", (a, b) -> 0.8);
            WeightedSumScorer<Integer> scorer = new WeightedSumScorer<>(fields);

            ScoreResult result = scorer.score(row(0, "first", "x", "last", "y"), row(1, "first", "x", "last", "y"));

            assertEquals(Math.sqrt((0.36 + 0.64) / 2), result.score(), 1e-9);
        }

        @Test
        @DisplayName("Identical rows score 1.0 with exact similarity")
        void identicalRows() {
            RecordScorer<Integer> scorer = RecordScorer.fields(Map.of("a", new ExactSimilarity()));
            assertEquals(1.0, scorer.score(row(0, "a", "ab"), row(1, "a", "ab")).score());
            assertEquals(0.0, scorer.score(row(0, "a", "ab"), row(1, "a", "ae")).score());
        }

        @Test
        @DisplayName("A null on either side contributes 0 without calling the similarity")
        void nullContributesZero() {
            when(similarity.similarity(any(), any())).thenReturn(1.0);
            Map<String, FieldSimilarity> fields = new LinkedHashMap<>();
            fields.put("first", similarity);
            fields.put("last", similarity);
            WeightedSumScorer<Integer> scorer = new WeightedSumScorer<>(fields);

            ScoreResult result = scorer.score(row(0, "first", "ann", "last", null), row(1, "first", "ann", "last", "lee"));

            assertEquals(Math.sqrt(0.5), result.score(), 1e-9);
            verify(similarity, times(1)).similarity(any(), any());
        }

        @Test
        @DisplayName("A missing field is a structural error")
        void missingField() {
            RecordScorer<Integer> scorer = RecordScorer.fields(Map.of("zip", new ExactSimilarity()));
            assertThrows(MissingFieldException.class, () -> scorer.score(row(0, "a", "x"), row(1, "a", "x")));
        }

        @Test
        @DisplayName("At least one field is required")
        void requiresFields() {
            assertThrows(IllegalArgumentException.class, () -> new WeightedSumScorer<Integer>(new HashMap<>()));
        }
    }

    @Nested
    @DisplayName("AbsoluteScorer")
    class AbsoluteTests {

        private final AbsoluteScorer<Integer> scorer = new AbsoluteScorer<>("id", 1.0);

        @Test
        @DisplayName("Equal values score the fixed score")
        void equalValues() {
            assertEquals(1.0, scorer.score(row(0, "id", 7), row(1, "id", 7)).score());
        }

        @Test
        @DisplayName("Different or null values refuse")
        void refuses() {
            assertTrue(scorer.score(row(0, "id", 7), row(1, "id", 8)).isRefused());
            assertTrue(scorer.score(row(0, "id", null), row(1, "id", 8)).isRefused());
        }

        @Test
        @DisplayName("Missing field fails unless ignored")
        void missingField() {
            assertThrows(MissingFieldException.class, () -> scorer.score(row(0, "x", 1), row(1, "x", 1)));
            AbsoluteScorer<Integer> tolerant = new AbsoluteScorer<>("id", 1.0, true);
            assertTrue(tolerant.score(row(0, "x", 1), row(1, "x", 1)).isRefused());
        }
    }

    @Nested
    @DisplayName("MaxScorer and MinScorer")
    class CombinatorTests {

        private final RecordScorer<Integer> low = (a, b) -> ScoreResult.of(0.2);
        private final RecordScorer<Integer> high = (a, b) -> ScoreResult.of(0.9);
        private final RecordScorer<Integer> refusing = (a, b) -> ScoreResult.refuse("no");

        @Test
        @DisplayName("Max and min ignore refusing children")
        void ignoreRefusals() {
            Row<Integer> a = row(0, "x", 1);
            Row<Integer> b = row(1, "x", 1);

            assertEquals(0.9, MaxScorer.of(low, refusing, high).score(a, b).score());
            assertEquals(0.2, MinScorer.of(low, refusing, high).score(a, b).score());
        }

        @Test
        @DisplayName("If every child refuses, the combinator refuses")
        void allRefuse() {
            Row<Integer> a = row(0, "x", 1);
            assertTrue(MaxScorer.of(refusing, refusing).score(a, a).isRefused());
            assertTrue(MinScorer.of(refusing).score(a, a).isRefused());
        }

        @Test
        @DisplayName("A matching identifier wins over a weak name similarity")
        void identifierVeto() {
            RecordScorer<Integer> scorer = MaxScorer.<Integer>of(
                    new AbsoluteScorer<>("attract_id", 1.0),
                    RecordScorer.fields(Map.of("first_name", new JaroWinklerSimilarity())));

            Row<Integer> a = row(0, "attract_id", 42, "first_name", "alexander");
            Row<Integer> b = row(1, "attract_id", 42, "first_name", "zoe");
            Row<Integer> c = row(2, "attract_id", 7, "first_name", "zoe");

            assertEquals(1.0, scorer.score(a, b).score());
            assertTrue(scorer.score(a, c).score() < 0.7);
        }

        @Test
        @DisplayName("Combinators need at least one child")
        void requiresChildren() {
            assertThrows(IllegalArgumentException.class, () -> new MaxScorer<Integer>(List.of()));
            assertThrows(IllegalArgumentException.class, () -> new MinScorer<Integer>(List.of()));
        }
    }

    @Nested
    @DisplayName("OverrideScorer")
    class OverrideTests {

        private final RecordScorer<Integer> base = (a, b) -> ScoreResult.of(0.6);

        @Test
        @DisplayName("Alters scores of pairs in the same group only")
        void altersSameGroup() {
            OverrideScorer<Integer> scorer = new OverrideScorer<>(base, Map.of(0, "g1", 1, "g1", 2, "g2"), s -> s + 0.3);

            assertEquals(0.9, scorer.score(row(0, "x", 1), row(1, "x", 1)).score(), 1e-9);
            assertEquals(0.6, scorer.score(row(0, "x", 1), row(2, "x", 1)).score(), 1e-9);
            assertEquals(0.6, scorer.score(row(0, "x", 1), row(3, "x", 1)).score(), 1e-9);
        }

        @Test
        @DisplayName("Altered scores are clamped to [0, 1]")
        void clamps() {
            OverrideScorer<Integer> scorer = new OverrideScorer<>(base, Map.of(0, "g", 1, "g"), s -> s * 3);
            assertEquals(1.0, scorer.score(row(0, "x", 1), row(1, "x", 1)).score());
        }

        @Test
        @DisplayName("Refusals pass through unchanged")
        void refusalPassesThrough() {
            OverrideScorer<Integer> scorer = new OverrideScorer<>((a, b) -> ScoreResult.refuse("no"),
                    Map.of(0, "g", 1, "g"), s -> 1.0);
            assertTrue(scorer.score(row(0, "x", 1), row(1, "x", 1)).isRefused());
        }
    }

    @Nested
    @DisplayName("CallbackScorer")
    class CallbackTests {

        @Test
        @DisplayName("Returns the callback's score, or refuses on null")
        void callback() {
            CallbackScorer<Integer> scorer = new CallbackScorer<>((a, b) ->
                    a.get("x").equals(b.get("x")) ? 0.75 : null);

            assertEquals(0.75, scorer.score(row(0, "x", 1), row(1, "x", 1)).score());
            assertTrue(scorer.score(row(0, "x", 1), row(1, "x", 2)).isRefused());
        }
    }
}
