package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Connections: every guess is a row of four coloured squares; a single-colour row is a
 * solved group.
 */
public class ConnectionsGrammar extends AbstractShareTextGrammar {

    private static final Pattern SIGNATURE = Pattern.compile("Connections[\\s\\S]*?Puzzle #[\\d,]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER = Pattern.compile("Connections[\\s\\S]*?Puzzle #([\\d,]+)", Pattern.CASE_INSENSITIVE);

    private static final GlyphAlphabet ALPHABET = GlyphAlphabet.of("🟦", "🟩", "🟨", "🟪");

    private static final int GROUPS = 4;

    public ConnectionsGrammar() {
        super("Connections", SIGNATURE, "Connections\nPuzzle #512");
    }

    @Override
    public ParsedResult parse(ShareText text) {
        Matcher matcher = requireMatch(text, HEADER);
        ParsedResult result = newResult();
        result.setPuzzleNumber(matcher.group(1));

        List<String> guessRows = text.lines().stream()
                .filter(line -> GlyphAlphabet.tokenize(line).size() == GROUPS && ALPHABET.composes(line))
                .collect(Collectors.toList());
        long solved = guessRows.stream()
                .map(GlyphAlphabet::tokenize)
                .filter(tokens -> tokens.stream().allMatch(tokens.get(0)::equals))
                .count();

        result.setMaxAttempts(GROUPS);
        result.setCompleted(true);
        result.setFailed(solved < GROUPS);
        result.putScore(SOLVED, (int) solved);
        result.setGrid(GlyphAlphabet.joinLines(guessRows));
        return result;
    }
}
