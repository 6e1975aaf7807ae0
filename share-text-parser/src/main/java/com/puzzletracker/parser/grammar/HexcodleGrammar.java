package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Hexcodle: guess a hex colour in five tries. Solved texts say "in N!", failed ones only
 * report the closeness score.
 */
public class HexcodleGrammar extends AbstractShareTextGrammar {

    private static final Pattern SIGNATURE = Pattern.compile("Hexcodle\\s+#[\\d,]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SOLVED_HEADER = Pattern.compile(
            "Hexcodle\\s+#([\\d,]+)\\s+in\\s+(\\d+)!.*?Score:\\s*(\\d+)%", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern FAILED_HEADER = Pattern.compile(
            "(?:I\\s+didn't\\s+get\\s+)?Hexcodle\\s+#([\\d,]+).*?Score:\\s*(\\d+)%", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern HEADER_LINE = Pattern.compile("^Hexcodle\\s+#[\\d,]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern INTRO_LINE = Pattern.compile("^I\\s+(didn't\\s+get|got)\\s+Hexcodle", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCORE_LINE = Pattern.compile("Score:", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL_LINE = Pattern.compile("hexcodle\\.com", Pattern.CASE_INSENSITIVE);

    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of("⏫", "⏬", "🔼", "🔽", "✅");
    private static final GlyphAlphabet CHECKS = GlyphAlphabet.of("✅");

    private static final int MAX_ROWS = 5;

    public HexcodleGrammar() {
        super("Hexcodle", SIGNATURE, "I got Hexcodle #869 in 3! Score: 92%");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        ParsedResult result = newResult();
        Integer attempts = null;
        int percent;

        Matcher solved = SOLVED_HEADER.matcher(text.text());
        if (solved.find()) {
            result.setPuzzleNumber(solved.group(1));
            attempts = readInt(solved.group(2));
            percent = readInt(solved.group(3));
        } else {
            Matcher failed = requireMatch(text, FAILED_HEADER);
            result.setPuzzleNumber(failed.group(1));
            percent = readInt(failed.group(2));
        }

        List<String> rows = text.lines().stream()
                .filter(line -> !HEADER_LINE.matcher(line).find())
                .filter(line -> !INTRO_LINE.matcher(line).find())
                .filter(line -> !SCORE_LINE.matcher(line).find())
                .filter(line -> !URL_LINE.matcher(line).find())
                .filter(ALPHABET::anyIn)
                .collect(Collectors.toList());
        boolean lastRowSolved = !rows.isEmpty() && CHECKS.composes(rows.get(rows.size() - 1));

        result.setPercentage(percent);
        result.setCompleted(true);
        result.setFailed((rows.size() == MAX_ROWS && !lastRowSolved) || attempts == null);
        result.setGuessCount(result.isFailed() ? null : rows.size());
        result.setMaxAttempts(MAX_ROWS);
        result.putScore(ACCURACY, percent);
        result.putScore(ATTEMPTS, attempts);
        result.setGrid(GlyphAlphabet.joinLines(rows));
        return result;
    }
}
