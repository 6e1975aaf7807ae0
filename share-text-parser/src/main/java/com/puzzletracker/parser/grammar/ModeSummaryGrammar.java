package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "I've completed all the modes of #Game #n today" summaries: one line per mode with the
 * number of guesses it took. Each mode becomes a sub-puzzle with an {@code attempts} score.
 */
public class ModeSummaryGrammar extends AbstractShareTextGrammar {

    private final Pattern header;
    private final Map<String, Pattern> modeLines = new LinkedHashMap<>();

    public ModeSummaryGrammar(String gameName, String expectedFormat, List<String> modes) {
        this(gameName, Pattern.compile("#" + gameName + "\\s+#([\\d,]+)", Pattern.CASE_INSENSITIVE),
                expectedFormat, modes);
    }

    private ModeSummaryGrammar(String gameName, Pattern header, String expectedFormat, List<String> modes) {
        super(gameName, header, expectedFormat);
        this.header = header;
        for (String mode : modes) {
            modeLines.put(mode.toLowerCase(Locale.ROOT), Pattern.compile(mode + ":\\s*(\\d+)", Pattern.CASE_INSENSITIVE));
        }
    }

    public static ModeSummaryGrammar loldle() {
        return new ModeSummaryGrammar("LoLdle",
                "I've completed all the modes of #LoLdle #1261 today:",
                List.of("Classic", "Quote", "Ability", "Emoji", "Splash"));
    }

    public static ModeSummaryGrammar pokedle() {
        return new ModeSummaryGrammar("Pokedle",
                "I've completed all the modes of #Pokedle #799 today:",
                List.of("Classic", "Card", "Description", "Silhouette"));
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher matcher = requireMatch(text, header);
        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(1));

        modeLines.forEach((key, modeLine) -> {
            for (String line : text.lines()) {
                Matcher guesses = modeLine.matcher(line);
                if (guesses.find()) {
                    result.putScore(key, ATTEMPTS, readInt(guesses.group(1)));
                }
            }
        });

        result.setCompleted(true);
        result.setFailed(false);
        return result;
    }
}
