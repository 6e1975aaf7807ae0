package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chronophoto: five rounds of points; the record's score is their sum and a zero total
 * is a loss. The grid lists each round's result.
 */
public class ChronophotoGrammar extends AbstractShareTextGrammar {

    private static final Pattern SIGNATURE = Pattern.compile("Chronophoto", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER = Pattern.compile("I got a score of (\\d+) on today's Chronophoto", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROUND = Pattern.compile("Round (\\d+): (\\d+)");
    private static final Pattern ROUND_RESULT = Pattern.compile("Round \\d+: (\\d+[❌✅]|\\d+)");
    private static final Pattern DATE = Pattern.compile("Chronophoto: (\\d{1,2}/\\d{1,2}/\\d{4})");

    public ChronophotoGrammar() {
        super("Chronophoto", SIGNATURE, "I got a score of N on today's Chronophoto");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        requireMatch(text, HEADER);
        ParsedResult result = newResult();
        result.setCompleted(true);

        int total = 0;
        List<String> rounds = new ArrayList<>();
        for (String line : text.lines()) {
            Matcher round = ROUND.matcher(line);
            if (round.find()) {
                total += readInt(round.group(2));
            }
            Matcher roundResult = ROUND_RESULT.matcher(line);
            if (roundResult.find()) {
                rounds.add(roundResult.group(1));
            }
        }
        result.putScore(POINTS, total);
        result.setFailed(total == 0);

        text.find(DATE).ifPresent(date -> result.setPuzzleNumber(date.group(1)));
        result.setGrid(String.join("\n", rounds));
        return result;
    }
}
