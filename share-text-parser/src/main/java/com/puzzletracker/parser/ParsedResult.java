package com.puzzletracker.parser;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured result of parsing one share text.
 * <p>
 * {@code scores} maps a sub-puzzle key (e.g. {@code puzzle1}, {@code classic}) to its
 * score fields. Values are numbers, except the {@code grade} field which holds a letter.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedResult {

    public static final String DEFAULT_PUZZLE = "puzzle1";

    private String gameName;
    private Map<String, Map<String, Object>> scores;
    private boolean failed;
    private boolean completed;
    private String puzzleNumber;
    private String grid; // display only, never re-parsed
    private Integer maxAttempts;
    private Integer percentage;
    private Integer guessCount;
    private Long elapsedMillis;
    private Integer uniqueness;
    private Integer maxUniqueness;
    private Integer maxGuessNumber; // highest keycap guess (Quordle)
    private String grade;
    private List<String> parseWarnings;

    public ParsedResult(String gameName) {
        this.gameName = gameName;
    }

    /**
     * Record a score field. The sub-puzzle map is created even when {@code value} is null,
     * so a grammar that found nothing leaves an empty map for normalization to prune.
     */
    public ParsedResult putScore(String puzzleKey, String field, Object value) {
        if (scores == null) {
            scores = new LinkedHashMap<>();
        }
        Map<String, Object> fields = scores.computeIfAbsent(puzzleKey, k -> new LinkedHashMap<>());
        if (value != null) {
            fields.put(field, value);
        }
        return this;
    }

    public ParsedResult putScore(String field, Object value) {
        return putScore(DEFAULT_PUZZLE, field, value);
    }

    /**
     * Read a numeric score field, or null if absent or not numeric.
     */
    public Integer intScore(String puzzleKey, String field) {
        if (scores == null || !scores.containsKey(puzzleKey)) {
            return null;
        }
        Object value = scores.get(puzzleKey).get(field);
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    public Integer intScore(String field) {
        return intScore(DEFAULT_PUZZLE, field);
    }

    public void addWarning(String warning) {
        if (parseWarnings == null) {
            parseWarnings = new ArrayList<>();
        }
        if (!parseWarnings.contains(warning)) {
            parseWarnings.add(warning);
        }
    }

    public boolean hasWarnings() {
        return parseWarnings != null && !parseWarnings.isEmpty();
    }
}
