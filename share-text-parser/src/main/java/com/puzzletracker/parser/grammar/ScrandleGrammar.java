package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrandle: a single line of ten green/red squares followed by the correct count.
 */
public class ScrandleGrammar extends AbstractShareTextGrammar {

    private static final Pattern HEADER = Pattern.compile(
            "([🟩🟥]+)\\s+(\\d+)/10\\s*\\|\\s*([\\d-]+)\\s*\\|\\s*https://scrandle\\.com", Pattern.CASE_INSENSITIVE);

    private static final int ROUNDS = 10;

    public ScrandleGrammar() {
        super("Scrandle", HEADER, "🟩🟥🟩🟩🟩🟥🟩🟩🟩🟩 8/10 | 2025-01-12 | https://scrandle.com");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher matcher = requireMatch(text, HEADER);
        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(3));
        int correct = readInt(matcher.group(2));
        result.setMaxAttempts(ROUNDS);
        result.setCompleted(true);
        result.setFailed(correct < ROUNDS);
        result.putScore(SOLVED, correct);
        result.setGrid(matcher.group(1));
        return result;
    }
}
