package com.puzzletracker.parser;

import com.puzzletracker.parser.grammar.GrammarRegistry;
import com.puzzletracker.parser.grammar.ShareText;
import com.puzzletracker.parser.grammar.ShareTextGrammar;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Entry point for turning pasted share text into a {@link ParsedResult}.
 * <p>
 * With an expected game only that game's grammar runs and any mismatch is an error.
 * Without one the grammar is picked by signature, falling back to a generic reading.
 * Instances hold no mutable state and may be shared between threads.
 */
@Slf4j
public class ShareTextParser {

    private final GrammarRegistry registry;
    private final Clock clock;

    public ShareTextParser() {
        this(GrammarRegistry.defaults(), Clock.systemDefaultZone());
    }

    public ShareTextParser(GrammarRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Parse text whose game is unknown.
     *
     * @throws ShareTextParseException if the text is blank, or the detected game's grammar
     *                                 rejects it
     */
    public ParsedResult parse(String text) {
        ShareText shareText = requireText(text);
        ShareTextGrammar grammar = registry.detect(shareText).orElse(null);
        ParsedResult result;
        if (grammar != null) {
            log.debug("Detected {} share text", grammar.gameName());
            result = grammar.parse(shareText);
        } else {
            log.debug("No signature matched, using generic grammar");
            result = registry.fallback().parse(shareText);
        }
        return ScoreNormalizer.normalize(result, today());
    }

    /**
     * Parse text submitted for a specific game. Never falls back to another grammar.
     *
     * @throws ShareTextParseException if the game is unknown, the text does not match its
     *                                 grammar, or a score field could not be read as a number
     */
    public ParsedResult parse(String text, String expectedGame) {
        if (expectedGame == null || expectedGame.isBlank()) {
            return parse(text);
        }
        ShareText shareText = requireText(text);
        ShareTextGrammar grammar = registry.find(expectedGame)
                .orElseThrow(() -> new ShareTextParseException(
                        String.format("Incorrect share text for %s. Please check the format.", expectedGame),
                        expectedGame, registry.fallback().expectedFormat()));

        ParsedResult result = ScoreNormalizer.normalize(grammar.parse(shareText), today());
        if (result.hasWarnings()) {
            log.warn("Share text for {} parsed with warnings: {}", grammar.gameName(), result.getParseWarnings());
            throw new ShareTextParseException(
                    String.format("Share text parse warnings for %s: %s", grammar.gameName(),
                            String.join("; ", result.getParseWarnings())),
                    grammar.gameName(), grammar.expectedFormat());
        }
        return result;
    }

    public GrammarRegistry getRegistry() {
        return registry;
    }

    private static ShareText requireText(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new ShareTextParseException("Share text is empty");
        }
        return ShareText.of(text);
    }

    private String today() {
        return LocalDate.now(clock).toString();
    }
}
