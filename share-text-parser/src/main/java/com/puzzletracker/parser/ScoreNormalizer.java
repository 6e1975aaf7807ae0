package com.puzzletracker.parser;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Uniform post-processing applied to every grammar's result.
 * <ul>
 *   <li>empty sub-puzzle score maps are removed, and {@code scores} becomes null when none remain;</li>
 *   <li>a non-numeric value in a field that must be numeric adds a parse warning;</li>
 *   <li>a missing puzzle number is replaced by the fallback identifier.</li>
 * </ul>
 */
public final class ScoreNormalizer {

    private static final Set<String> STRING_FIELDS = Set.of("grade");

    private ScoreNormalizer() {
    }

    public static ParsedResult normalize(ParsedResult result, String fallbackPuzzleNumber) {
        Map<String, Map<String, Object>> scores = result.getScores();
        if (scores != null) {
            Iterator<Map.Entry<String, Map<String, Object>>> it = scores.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Map<String, Object>> entry = it.next();
                Map<String, Object> fields = entry.getValue();
                if (fields == null || fields.isEmpty()) {
                    it.remove();
                    continue;
                }
                fields.forEach((field, value) -> {
                    if (!(value instanceof Number) && !STRING_FIELDS.contains(field)) {
                        result.addWarning(String.format("Parsed non-numeric score value for '%s' in '%s': \"%s\"",
                                field, entry.getKey(), value));
                    }
                });
            }
            if (scores.isEmpty()) {
                result.setScores(null);
            }
        }

        if (result.getPuzzleNumber() == null || result.getPuzzleNumber().isBlank()) {
            result.setPuzzleNumber(fallbackPuzzleNumber);
        }
        return result;
    }

    /**
     * Copy of the scores without empty sub-puzzle maps; null when nothing is left.
     */
    public static Map<String, Map<String, Object>> pruneEmpty(Map<String, Map<String, Object>> scores) {
        if (scores == null) {
            return null;
        }
        Map<String, Map<String, Object>> pruned = new LinkedHashMap<>();
        scores.forEach((key, fields) -> {
            if (fields != null && !fields.isEmpty()) {
                pruned.put(key, fields);
            }
        });
        return pruned.isEmpty() ? null : pruned;
    }
}
