package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * PokeDoku: cells solved out of nine, with an optional uniqueness score.
 */
public class PokedokuGrammar extends AbstractShareTextGrammar {

    private static final Pattern SIGNATURE = Pattern.compile("PokeDoku\\s+Summary", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER = Pattern.compile(
            "PokeDoku\\s+Summary(?:.*?(\\d{4}-\\d{2}-\\d{2}))?.*?Score:\\s*(\\d+)\\s*/\\s*(\\d+)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern UNIQUENESS = Pattern.compile("Uniqueness:\\s*(\\d+)/(\\d+)", Pattern.CASE_INSENSITIVE);

    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of("✅", "🟥");

    public PokedokuGrammar() {
        super("Pokedoku", SIGNATURE, "PokeDoku Summary 2025-01-12 Score: 7/9");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher matcher = requireMatch(text, HEADER);
        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(1));
        result.setMaxAttempts(readInt(matcher.group(3)));

        int uniqueness = 0;
        int maxUniqueness = 0;
        Matcher unique = UNIQUENESS.matcher(text.text());
        if (unique.find()) {
            uniqueness = readInt(unique.group(1));
            maxUniqueness = readInt(unique.group(2));
            result.setUniqueness(uniqueness);
            result.setMaxUniqueness(maxUniqueness);
        }

        result.putScore(SOLVED, readInt(matcher.group(2)));
        result.putScore("uniqueness", uniqueness);
        result.putScore("maxUniqueness", maxUniqueness);

        result.setGrid(GlyphAlphabet.joinLines(text.lines().stream()
                .filter(ALPHABET::composes)
                .map(String::trim)
                .collect(Collectors.toList())));
        result.setCompleted(true);
        result.setFailed(false);
        return result;
    }
}
