package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Colorfle: attempts plus the colour accuracy percentage of the final guess.
 */
public class ColorfleGrammar extends AttemptsGrammar {

    private static final Pattern SIGNATURE = Pattern.compile("Colorfle\\s+[\\d,]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER = Pattern.compile("Colorfle\\s+([\\d,]+)\\s+(X|\\d+)/(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ACCURACY_PATTERN = Pattern.compile("accuracy of\\s*([\\d.]+)%", Pattern.CASE_INSENSITIVE);

    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of(
            "⬛", "⬜", "🟨", "🟩", "🟦", "🟧", "🟥", "🟪", "🟫");

    private static final int MAX_ATTEMPTS = 6;

    public ColorfleGrammar() {
        super("Colorfle", SIGNATURE, HEADER, "Colorfle 1,024 3/6", ALPHABET);
    }

    @Override
    protected void extractMetrics(ShareText text, ParsedResult result) {
        result.setMaxAttempts(MAX_ATTEMPTS);
        Matcher accuracy = ACCURACY_PATTERN.matcher(text.text());
        result.putScore(ACCURACY, accuracy.find() ? readDecimal(accuracy.group(1)) : 0.0);
    }
}
