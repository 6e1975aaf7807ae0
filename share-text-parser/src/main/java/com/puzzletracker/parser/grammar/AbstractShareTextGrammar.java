package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;
import com.puzzletracker.parser.ShareTextParseException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Common plumbing for grammars: header matching and the "n/max or X/max" attempts rule.
 */
public abstract class AbstractShareTextGrammar implements ShareTextGrammar {

    protected static final String ATTEMPTS = "attempts";
    protected static final String SOLVED = "solved";
    protected static final String ACCURACY = "accuracy";
    protected static final String POINTS = "points";
    protected static final String TIME = "time";
    protected static final String GRADE = "grade";

    /** Attempts value stored for an unsolved puzzle. */
    protected static final int FAILED_ATTEMPTS = -1;

    private final String gameName;
    private final Pattern signature;
    private final String expectedFormat;

    protected AbstractShareTextGrammar(String gameName, Pattern signature, String expectedFormat) {
        this.gameName = gameName;
        this.signature = signature;
        this.expectedFormat = expectedFormat;
    }

    @Override
    public String gameName() {
        return gameName;
    }

    @Override
    public Pattern signature() {
        return signature;
    }

    @Override
    public String expectedFormat() {
        return expectedFormat;
    }

    protected ParsedResult newResult() {
        return new ParsedResult(gameName);
    }

    protected Matcher requireMatch(ShareText text, Pattern pattern) {
        return text.find(pattern).orElseThrow(this::mismatch);
    }

    protected ShareTextParseException mismatch() {
        return ShareTextParseException.forGame(gameName, expectedFormat);
    }

    protected ShareTextParseException mismatch(String detail) {
        return ShareTextParseException.forGame(gameName, expectedFormat, detail);
    }

    /**
     * Apply a score token from an "n/max" header: {@code X} marks a failed attempt.
     */
    protected void applyAttempts(ParsedResult result, String scoreToken) {
        result.setCompleted(true);
        if ("X".equalsIgnoreCase(scoreToken)) {
            result.setFailed(true);
            result.putScore(ATTEMPTS, FAILED_ATTEMPTS);
        } else {
            result.setFailed(false);
            result.putScore(ATTEMPTS, readInt(scoreToken));
        }
    }

    protected long secondsToMillis(String seconds) {
        return Math.round(readDecimal(seconds) * 1000);
    }

    /**
     * Read a captured number, ignoring thousands separators.
     *
     * @throws ShareTextParseException if the token is not an integer that fits an int
     */
    protected int readInt(String token) {
        try {
            return Integer.parseInt(token.replace(",", ""));
        } catch (NumberFormatException e) {
            throw mismatch(String.format("\"%s\" is not a valid number.", token));
        }
    }

    /**
     * @throws ShareTextParseException if the token is not a decimal number
     */
    protected double readDecimal(String token) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw mismatch(String.format("\"%s\" is not a valid number.", token));
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + gameName + "]";
    }
}
