package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Quordle: four words per puzzle. Each solved word shows a keycap with the guess it was
 * found on, each unsolved word a red square.
 */
public class QuordleGrammar extends AbstractShareTextGrammar {

    private static final Pattern SIGNATURE = Pattern.compile("(?:🙂\\s*)?Daily Quordle\\s+[\\d,]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER = Pattern.compile("(?:🙂\\s*)?Daily Quordle\\s+([\\d,]+)", Pattern.CASE_INSENSITIVE);

    private static final List<String> KEYCAPS = List.of(
            "1️⃣", "2️⃣", "3️⃣", "4️⃣", "5️⃣", "6️⃣", "7️⃣", "8️⃣", "9️⃣");
    private static final String MISSED = "🟥";
    private static final GlyphAlphabet SCORE_GLYPHS = GlyphAlphabet.of(
            "1️⃣", "2️⃣", "3️⃣", "4️⃣", "5️⃣", "6️⃣", "7️⃣", "8️⃣", "9️⃣", MISSED);
    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of(
            "1️⃣", "2️⃣", "3️⃣", "4️⃣", "5️⃣", "6️⃣", "7️⃣", "8️⃣", "9️⃣", "🟥", "⬛", "⬜", "🟨", "🟩");

    private static final int WORDS = 4;

    public QuordleGrammar() {
        super("Quordle", SIGNATURE, "Daily Quordle 1,024");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher matcher = requireMatch(text, HEADER);
        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(1));

        int solved = 0;
        int totalWords = 0;
        int maxGuess = 0;
        for (String line : text.lines()) {
            if (!SCORE_GLYPHS.anyIn(line)) {
                continue;
            }
            for (int i = 0; i < KEYCAPS.size(); i++) {
                int count = SCORE_GLYPHS.count(line, KEYCAPS.get(i));
                if (count > 0) {
                    solved += count;
                    totalWords += count;
                    maxGuess = Math.max(maxGuess, i + 1);
                }
            }
            totalWords += SCORE_GLYPHS.count(line, MISSED);
        }

        result.setMaxAttempts(totalWords);
        result.setMaxGuessNumber(maxGuess);
        result.setCompleted(true);
        result.setFailed(solved < WORDS);
        result.putScore(SOLVED, solved);
        result.putScore(ATTEMPTS, solved == WORDS ? maxGuess : FAILED_ATTEMPTS);

        result.setGrid(ALPHABET.grid(text.lines(), line -> HEADER.matcher(line).find()));
        return result;
    }
}
