package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fallback for share texts no signature claims. Looks for a "Label n x/max" or bare
 * "x/max" score and collects any lines of common marker glyphs as the grid. Without a
 * score line the outcome is read off the last grid row.
 */
public class GenericGrammar extends AbstractShareTextGrammar {

    private static final Pattern NEVER = Pattern.compile("(?!)");
    private static final Pattern LABELLED_SCORE = Pattern.compile("([\\w\\s]+?)\\s+([\\d,]+)\\s+(X|\\d+)/(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_SCORE = Pattern.compile("(X|\\d+)/(\\d+)", Pattern.CASE_INSENSITIVE);

    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of(
            "⬛", "⬜", "🟨", "🟩", "🟦", "🟧", "🟥",
            "🟪", "🟫", "⭐", "✅", "❌",
            "🔴", "🔵", "🟢", "🟡", "⚪");
    private static final GlyphAlphabet SUCCESS = GlyphAlphabet.of("🟩", "✅", "🟢");
    private static final GlyphAlphabet MISS = GlyphAlphabet.of("⬛", "🟨");

    public GenericGrammar() {
        super("Generic", NEVER, "Game 123 4/6");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        ParsedResult result = new ParsedResult();
        boolean scoreFound = false;

        for (String line : text.lines()) {
            Matcher labelled = LABELLED_SCORE.matcher(line);
            if (labelled.find()) {
                result.setGameName(labelled.group(1).trim());
                result.setPuzzleNumber(labelled.group(2));
                result.setMaxAttempts(readInt(labelled.group(4)));
                applyAttempts(result, labelled.group(3));
                scoreFound = true;
                break;
            }
            Matcher bare = BARE_SCORE.matcher(line);
            if (bare.find()) {
                result.setMaxAttempts(readInt(bare.group(2)));
                applyAttempts(result, bare.group(1));
                scoreFound = true;
                break;
            }
        }

        List<String> gridLines = text.lines().stream()
                .filter(line -> !isLink(line) && !line.trim().isEmpty())
                .filter(ALPHABET::anyIn)
                .collect(Collectors.toList());
        if (gridLines.isEmpty()) {
            return result;
        }
        result.setGrid(GlyphAlphabet.joinLines(gridLines));

        if (!scoreFound) {
            String lastRow = gridLines.get(gridLines.size() - 1);
            boolean solved = SUCCESS.anyIn(lastRow) && !MISS.anyIn(lastRow);
            result.setMaxAttempts(gridLines.size());
            result.setCompleted(true);
            result.setFailed(!solved);
            result.putScore(ATTEMPTS, solved ? gridLines.size() : FAILED_ATTEMPTS);
        }
        return result;
    }

    private static boolean isLink(String line) {
        return line.contains("http://") || line.contains("https://") || line.contains(".com");
    }
}
