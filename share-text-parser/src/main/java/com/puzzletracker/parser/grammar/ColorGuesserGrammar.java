package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ColorGuesser: a points score out of a maximum; there is no failure state.
 */
public class ColorGuesserGrammar extends AbstractShareTextGrammar {

    private static final Pattern SIGNATURE = Pattern.compile("ColorGuesser\\s+#[\\d,]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER = Pattern.compile(
            "ColorGuesser\\s+#([\\d,]+).*?Score:\\s*(\\d+)/(\\d+)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public ColorGuesserGrammar() {
        super("ColorGuesser", SIGNATURE, "ColorGuesser #301 Score: 412/500");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher matcher = requireMatch(text, HEADER);
        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(1));
        result.setMaxAttempts(readInt(matcher.group(3)));
        result.setCompleted(true);
        result.setFailed(false);
        result.putScore(POINTS, readInt(matcher.group(2)));
        return result;
    }
}
