package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Spellcheck: fifteen words, one glyph each. Red squares and crosses are misses, every
 * other marker is a correct word.
 */
public class SpellcheckGrammar extends AbstractShareTextGrammar {

    private static final Pattern HEADER = Pattern.compile("Spellcheck\\s+#([\\d,]+)", Pattern.CASE_INSENSITIVE);

    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of(
            "🟥", "🟩", "🟦", "🟨", "🟧", "🟪", "🟫", "⭐", "✅", "❌");
    private static final GlyphAlphabet CORRECT = GlyphAlphabet.of(
            "🟩", "🟦", "🟨", "🟧", "🟪", "🟫", "⭐", "✅");

    private static final int WORDS = 15;

    public SpellcheckGrammar() {
        super("Spellcheck", HEADER, "Spellcheck #210");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher matcher = requireMatch(text, HEADER);
        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(1));

        String grid = ALPHABET.grid(text.lines());
        int correct = 0;
        if (grid != null) {
            for (String line : grid.split("\n")) {
                correct += (int) GlyphAlphabet.tokenize(line).stream().filter(CORRECT::contains).count();
            }
        }

        result.setMaxAttempts(WORDS);
        result.setCompleted(true);
        result.setFailed(false);
        result.putScore(SOLVED, correct);
        result.setGrid(grid);
        return result;
    }
}
