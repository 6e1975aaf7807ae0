package com.puzzletracker.parser.grammar;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pasted share text, trimmed and split into lines once for all grammars.
 */
public final class ShareText {

    private final String text;
    private final List<String> lines;

    private ShareText(String text) {
        this.text = text.trim();
        this.lines = Arrays.asList(this.text.split("\\R"));
    }

    public static ShareText of(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        return new ShareText(text);
    }

    public String text() {
        return text;
    }

    public List<String> lines() {
        return lines;
    }

    public boolean isBlank() {
        return text.isEmpty();
    }

    public Optional<Matcher> find(Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher) : Optional.empty();
    }

    public boolean contains(Pattern pattern) {
        return pattern.matcher(text).find();
    }
}
