package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Worldle: guesses plus a proximity percentage. Only a 100% final guess counts as solved.
 */
public class WorldleGrammar extends AbstractShareTextGrammar {

    private static final Pattern SIGNATURE = Pattern.compile("#Worldle\\s+#[\\d,]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER = Pattern.compile(
            "#Worldle\\s+#([\\d,]+)(?:\\s+\\([^)]+\\))?\\s+(X|\\d+)/(\\d+)(?:\\s+\\((\\d+)%\\))?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER_LINE = Pattern.compile("^#Worldle\\s+#[\\d,]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern STREAK_LINE = Pattern.compile("streak", Pattern.CASE_INSENSITIVE);
    private static final Pattern BONUS_LINE = Pattern.compile("Worldle has a new bonus round", Pattern.CASE_INSENSITIVE);

    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of(
            "⬆️", "⬇️", "⬅️", "➡️", "↗️", "↘️", "↙️", "↖️", "🟩", "🟨", "🟥", "⬜", "🎉");

    private static final int SOLVED_PERCENT = 100;

    public WorldleGrammar() {
        super("Worldle", SIGNATURE, "#Worldle #1,024 4/6 (100%)");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher matcher = requireMatch(text, HEADER);
        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(1));
        result.setMaxAttempts(readInt(matcher.group(3)));
        if (matcher.group(4) != null) {
            result.setPercentage(readInt(matcher.group(4)));
        }
        String scoreToken = matcher.group(2);
        if (!"X".equalsIgnoreCase(scoreToken)) {
            result.setGuessCount(readInt(scoreToken));
        }

        result.setCompleted(true);
        result.setFailed(result.getPercentage() == null || result.getPercentage() != SOLVED_PERCENT);

        int attempts = result.isFailed() || result.getGuessCount() == null
                ? FAILED_ATTEMPTS : result.getGuessCount();
        result.putScore(ACCURACY, result.getPercentage() == null ? 0 : result.getPercentage());
        result.putScore(ATTEMPTS, attempts);

        result.setGrid(GlyphAlphabet.joinLines(text.lines().stream()
                .filter(line -> !HEADER_LINE.matcher(line).find())
                .filter(line -> !STREAK_LINE.matcher(line).find() && !line.trim().startsWith("🔥"))
                .filter(line -> !BONUS_LINE.matcher(line).find())
                .filter(ALPHABET::composes)
                .collect(Collectors.toList())));
        return result;
    }
}
