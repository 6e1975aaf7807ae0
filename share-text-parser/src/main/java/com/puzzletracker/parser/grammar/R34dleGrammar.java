package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * r34dle: ten rounds scored as "n/10" under a dated header. Anything short of ten is a loss.
 */
public class R34dleGrammar extends AbstractShareTextGrammar {

    private static final Pattern HEADER = Pattern.compile("Rule34dle Daily ([\\d-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCORE = Pattern.compile("(\\d+)/10");

    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of("🟩", "🟥");

    private static final int ROUNDS = 10;

    public R34dleGrammar() {
        super("r34dle", HEADER, "Rule34dle Daily 2025-01-12\n8/10\n🟩🟥🟩🟩🟩🟥🟩🟩🟩🟩");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher header = requireMatch(text, HEADER);
        Matcher score = text.find(SCORE)
                .orElseThrow(() -> mismatch("Could not find score in format \"n/10\""));

        ParsedResult result = newResult();
        result.setPuzzleNumber(header.group(1));
        int solved = readInt(score.group(1));
        result.setMaxAttempts(ROUNDS);
        result.setCompleted(true);
        result.setFailed(solved < ROUNDS);
        result.putScore(SOLVED, solved);
        result.setGrid(ALPHABET.grid(text.lines()));
        return result;
    }
}
