package com.puzzletracker.parser;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoreNormalizerTest {

    @Test
    void testEmptySubPuzzlesPruned() {
        ParsedResult result = new ParsedResult("Test");
        result.putScore("classic", "attempts", 3);
        result.putScore("quote", "attempts", null);

        ScoreNormalizer.normalize(result, "2024-01-01");

        assertEquals(1, result.getScores().size());
        assertTrue(result.getScores().containsKey("classic"));
    }

    @Test
    void testAllEmptyScoresBecomeNull() {
        ParsedResult result = new ParsedResult("Test");
        result.putScore("time", null);

        ScoreNormalizer.normalize(result, "2024-01-01");

        assertNull(result.getScores());
    }

    @Test
    void testNonNumericValueWarnsOnce() {
        ParsedResult result = new ParsedResult("Test");
        result.putScore("points", "many");
        result.putScore("grade", "B");

        ScoreNormalizer.normalize(result, "2024-01-01");
        ScoreNormalizer.normalize(result, "2024-01-01");

        assertEquals(1, result.getParseWarnings().size(), "Grade is allowed, and warnings are de-duplicated");
        assertEquals("Parsed non-numeric score value for 'points' in 'puzzle1': \"many\"",
                result.getParseWarnings().get(0));
        assertEquals("many", result.getScores().get("puzzle1").get("points"), "Value is kept, only flagged");
    }

    @Test
    void testPuzzleNumberFallback() {
        ParsedResult missing = new ParsedResult("Test");
        assertEquals("2024-01-01", ScoreNormalizer.normalize(missing, "2024-01-01").getPuzzleNumber());

        ParsedResult present = new ParsedResult("Test");
        present.setPuzzleNumber("1,643");
        assertEquals("1,643", ScoreNormalizer.normalize(present, "2024-01-01").getPuzzleNumber());
    }

    @Test
    void testEmptyScoreMapBecomesNull() {
        ParsedResult result = new ParsedResult("Test");
        Map<String, Map<String, Object>> scores = new LinkedHashMap<>();
        result.setScores(scores);
        ScoreNormalizer.normalize(result, "x");
        assertNull(result.getScores());

        ParsedResult none = ScoreNormalizer.normalize(new ParsedResult("Test"), "x");
        assertNull(none.getScores());
        assertFalse(none.hasWarnings());
    }

    @Test
    void testPruneEmptyCopiesNonEmptySubPuzzles() {
        Map<String, Map<String, Object>> scores = new LinkedHashMap<>();
        scores.put("classic", Map.of("attempts", 4));
        scores.put("quote", Map.of());
        scores.put("emoji", null);

        Map<String, Map<String, Object>> pruned = ScoreNormalizer.pruneEmpty(scores);

        assertEquals(Map.of("classic", Map.of("attempts", 4)), pruned);
        assertEquals(3, scores.size(), "Input is left untouched");
        assertNull(ScoreNormalizer.pruneEmpty(Map.of("quote", Map.of())));
        assertNull(ScoreNormalizer.pruneEmpty(null));
    }
}
