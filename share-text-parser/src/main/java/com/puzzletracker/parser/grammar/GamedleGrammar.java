package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Gamedle has five modes. A share text is either one mode on one line
 * ({@code 🕹️ Gamedle (Cover art): #1337 🟥🟥🟩}) or a "Gamedle" summary listing several
 * modes, each stored as its own sub-puzzle.
 * <p>
 * A single-mode line stores the red squares before the first green one. Summary lines
 * count the solving guess as well, so their attempts are one higher.
 */
public class GamedleGrammar extends AbstractShareTextGrammar {

    private static final String MODES = "Cover art|Artwork|Character|Keywords|Guess";
    private static final String SQUARES = "[🟥🟩⬜]+";

    private static final Pattern SIGNATURE = Pattern.compile(
            "Gamedle\\s+\\((?:" + MODES + ")\\):|^Gamedle\\s*$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern SINGLE = Pattern.compile(
            "Gamedle\\s+\\((" + MODES + ")\\):\\s+#([\\d,]+)\\s+(" + SQUARES + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUMMARY_HEADER = Pattern.compile("^Gamedle\\s*$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final String GREEN = "🟩";
    private static final String RED = "🟥";
    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of(RED, GREEN, "⬜");

    private enum Mode {
        COVER_ART("Cover art", "coverArt", 6),
        ARTWORK("Artwork", "artwork", 6),
        CHARACTER("Character", "character", 4),
        KEYWORDS("Keywords", "keywords", 6),
        GUESS("Guess", "guess", 10);

        private final String label;
        private final String key;
        private final int maxAttempts;
        private final Pattern summaryLine;

        Mode(String label, String key, int maxAttempts) {
            this.label = label;
            this.key = key;
            this.maxAttempts = maxAttempts;
            this.summaryLine = Pattern.compile(
                    "\\(" + label + "\\)\\s+#([\\d,]+):\\s*(" + SQUARES + ")", Pattern.CASE_INSENSITIVE);
        }

        static Mode fromLabel(String label) {
            String normalized = label.toLowerCase(Locale.ROOT);
            for (Mode mode : values()) {
                if (mode.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                    return mode;
                }
            }
            throw new IllegalArgumentException("Unknown Gamedle mode: " + label);
        }
    }

    public GamedleGrammar() {
        super("Gamedle", SIGNATURE, "🕹️ Gamedle (Cover art): #1337 🟥🟥🟥🟥🟥🟩");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher single = SINGLE.matcher(text.text());
        if (single.find()) {
            return parseSingle(single);
        }
        if (text.contains(SUMMARY_HEADER)) {
            return parseSummary(text);
        }
        throw mismatch();
    }

    private ParsedResult parseSingle(Matcher matcher) {
        Mode mode = Mode.fromLabel(matcher.group(1));
        String squares = matcher.group(3);
        int attempts = missesBeforeSolve(squares);

        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(2));
        result.setMaxAttempts(mode.maxAttempts);
        result.setFailed(attempts == FAILED_ATTEMPTS);
        result.setCompleted(attempts != FAILED_ATTEMPTS);
        result.putScore(ATTEMPTS, attempts);
        result.setGrid(squares);
        return result;
    }

    private ParsedResult parseSummary(ShareText text) {
        ParsedResult result = newResult();
        List<String> grid = new ArrayList<>();
        boolean anyFailed = false;

        for (Mode mode : Mode.values()) {
            Matcher matcher = mode.summaryLine.matcher(text.text());
            if (!matcher.find()) {
                continue;
            }
            int misses = missesBeforeSolve(matcher.group(2));
            int attempts = misses == FAILED_ATTEMPTS ? FAILED_ATTEMPTS : misses + 1;
            anyFailed |= attempts == FAILED_ATTEMPTS;
            if (result.getPuzzleNumber() == null) {
                result.setPuzzleNumber(matcher.group(1));
            }
            result.putScore(mode.key, ATTEMPTS, attempts);
            grid.add(matcher.group(2));
        }

        if (grid.isEmpty()) {
            throw mismatch("No Gamedle mode results found.");
        }
        result.setCompleted(true);
        result.setFailed(anyFailed);
        result.setGrid(GlyphAlphabet.joinLines(grid));
        return result;
    }

    private static int missesBeforeSolve(String squares) {
        List<String> glyphs = GlyphAlphabet.tokenize(squares);
        int green = glyphs.indexOf(GREEN);
        if (green < 0) {
            return FAILED_ATTEMPTS;
        }
        int misses = 0;
        for (String glyph : glyphs.subList(0, green)) {
            if (RED.equals(glyph)) {
                misses++;
            }
        }
        return misses;
    }
}
