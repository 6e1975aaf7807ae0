package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Pattern;

/**
 * Genshindle: the newest guess is printed first; a solved game's first row is the
 * all-correct pattern, and the row count is the number of guesses.
 */
public class GenshindleGrammar extends AbstractShareTextGrammar {

    private static final Pattern HEADER = Pattern.compile("I (found|couldn't find) today's #Genshindle", Pattern.CASE_INSENSITIVE);
    private static final String SOLVED_ROW = "🟪🟩🟩🟩🟩🟩🟩";

    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of("🟪", "🟩", "🟥");

    private static final int MAX_ATTEMPTS = 5;

    public GenshindleGrammar() {
        super("Genshindle", HEADER, "I found today's #Genshindle in 3 tries!");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        requireMatch(text, HEADER);
        String grid = ALPHABET.grid(text.lines());
        if (grid == null) {
            throw mismatch("No emoji grid found.");
        }
        String[] rows = grid.split("\n");

        ParsedResult result = newResult();
        result.setMaxAttempts(MAX_ATTEMPTS);
        result.setCompleted(true);
        if (SOLVED_ROW.equals(GlyphAlphabet.normalize(rows[0]).trim())) {
            result.setFailed(false);
            result.putScore(ATTEMPTS, rows.length);
        } else {
            result.setFailed(true);
            result.putScore(ATTEMPTS, FAILED_ATTEMPTS);
        }
        result.setGrid(grid);
        return result;
    }
}
