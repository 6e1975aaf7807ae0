package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Wantedle: a letter grade and the time taken. Grades D and F count as a loss.
 */
public class WantedleGrammar extends AbstractShareTextGrammar {

    private static final Pattern HEADER = Pattern.compile("WANTEDLE\\s+#([\\d,]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCORE = Pattern.compile("([SABCDF])\\s*-\\s*([\\d.]+)s");
    private static final Pattern LOSING_GRADE = Pattern.compile("[DF]");

    public WantedleGrammar() {
        super("Wantedle", HEADER, "WANTEDLE #412 - Hard\nB - 19.2s");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher header = requireMatch(text, HEADER);
        Matcher score = text.find(SCORE)
                .orElseThrow(() -> mismatch("Could not find score line (e.g., \"S - 9.4s\", \"A - 12.3s\", \"F - 30.0s\")"));

        String grade = score.group(1);
        long millis = secondsToMillis(score.group(2));

        ParsedResult result = newResult();
        result.setPuzzleNumber(header.group(1));
        result.setCompleted(true);
        result.setFailed(LOSING_GRADE.matcher(grade).matches());
        result.setGrade(grade);
        result.setElapsedMillis(millis);
        result.putScore(TIME, millis);
        result.putScore(GRADE, grade);

        String grid = GlyphAlphabet.joinLines(text.lines().stream()
                .filter(GlyphAlphabet::isPictographic)
                .collect(Collectors.toList()));
        result.setGrid(grid == null ? "" : grid);
        return result;
    }
}
