package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Timingle: how far off the guessed date ordering was, in seconds. Stored as milliseconds.
 */
public class TimingleGrammar extends AbstractShareTextGrammar {

    private static final Pattern HEADER = Pattern.compile("Timingle\\s+#([\\d,]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECONDS = Pattern.compile(
            "Timingle\\s+#[\\d,]+.*?([-+]?\\d+\\.?\\d*)\\s*seconds", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public TimingleGrammar() {
        super("Timingle", HEADER, "Timingle #88 ... 2.4 seconds");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher matcher = requireMatch(text, HEADER);
        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(1));
        result.setCompleted(true);
        result.setFailed(false);

        Matcher seconds = SECONDS.matcher(text.text());
        Long millis = seconds.find() ? secondsToMillis(seconds.group(1)) : null;
        result.setElapsedMillis(millis);
        result.putScore(TIME, millis);
        return result;
    }
}
