package com.puzzletracker.parser.grammar;

import com.puzzletracker.parser.ParsedResult;
import com.puzzletracker.parser.ShareTextParseException;

import java.util.regex.Pattern;

/**
 * Parsing rules for one game's share text.
 * <p>
 * The {@link #signature()} must be specific enough that no other game's share text matches
 * it: auto-detection takes the first grammar whose signature is found in the text.
 */
public interface ShareTextGrammar {

    /**
     * Display name of the game, also used to look the grammar up by expected game.
     */
    String gameName();

    Pattern signature();

    /**
     * Example of a valid share text header, shown to the user on mismatch.
     */
    String expectedFormat();

    /**
     * @throws ShareTextParseException if the text does not match this game's header
     */
    ParsedResult parse(ShareText text);

    default boolean matchesSignature(ShareText text) {
        return text.contains(signature());
    }

    default boolean answersTo(String name) {
        return gameName().equalsIgnoreCase(name.trim());
    }
}
