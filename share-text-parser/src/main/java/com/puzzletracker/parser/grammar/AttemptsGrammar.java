package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar for the common "Name puzzle n/max" header, where {@code X} in place of n marks
 * a failed attempt. The header pattern must capture puzzle number, score token and max.
 */
public class AttemptsGrammar extends AbstractShareTextGrammar {

    private final Pattern header;
    private final GlyphAlphabet alphabet;

    public AttemptsGrammar(String gameName, Pattern signature, Pattern header,
                           String expectedFormat, GlyphAlphabet alphabet) {
        super(gameName, signature, expectedFormat);
        this.header = header;
        this.alphabet = alphabet;
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher matcher = requireMatch(text, header);
        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(1));
        result.setMaxAttempts(readInt(matcher.group(3)));
        applyAttempts(result, matcher.group(2));

        extractMetrics(text, result);

        result.setGrid(alphabet.grid(text.lines(), line -> header.matcher(line).find()));
        return result;
    }

    /**
     * Hook for games that report more than attempts.
     */
    protected void extractMetrics(ShareText text, ParsedResult result) {
    }
}
