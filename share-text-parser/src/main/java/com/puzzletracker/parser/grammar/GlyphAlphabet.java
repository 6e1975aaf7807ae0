package com.puzzletracker.parser.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * The fixed set of marker glyphs a game prints in its share grid.
 * <p>
 * Glyphs are compared with emoji variation selectors removed, so {@code "⬆️"} and
 * {@code "⬆"} are the same marker. Keycap sequences ({@code 1️⃣}) and ZWJ sequences are
 * kept together as one glyph.
 */
public final class GlyphAlphabet {

    private static final int VARIATION_SELECTOR = 0xFE0F;
    private static final int ZERO_WIDTH_JOINER = 0x200D;
    private static final int KEYCAP = 0x20E3;

    private final Set<String> glyphs;

    private GlyphAlphabet(Set<String> glyphs) {
        this.glyphs = glyphs;
    }

    public static GlyphAlphabet of(String... glyphs) {
        Set<String> normalized = Arrays.stream(glyphs)
                .map(GlyphAlphabet::normalize)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return new GlyphAlphabet(Collections.unmodifiableSet(normalized));
    }

    public Set<String> glyphs() {
        return glyphs;
    }

    public boolean contains(String glyph) {
        return glyphs.contains(normalize(glyph));
    }

    /**
     * True if the line holds at least one glyph of this alphabet.
     */
    public boolean anyIn(String line) {
        String normalized = normalize(line);
        for (String glyph : glyphs) {
            if (normalized.contains(glyph)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if the line, ignoring whitespace, is made only of glyphs of this alphabet.
     */
    public boolean composes(String line) {
        List<String> tokens = tokenize(line);
        return !tokens.isEmpty() && tokens.stream().allMatch(glyphs::contains);
    }

    public int count(String line, String glyph) {
        String target = normalize(glyph);
        int count = 0;
        for (String token : tokenize(line)) {
            if (token.equals(target)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Lines holding any glyph of this alphabet, joined verbatim; null if there are none.
     */
    public String grid(List<String> lines) {
        return grid(lines, line -> false);
    }

    public String grid(List<String> lines, Predicate<String> exclude) {
        return joinLines(lines.stream()
                .filter(exclude.negate())
                .filter(this::anyIn)
                .collect(Collectors.toList()));
    }

    public static String joinLines(List<String> lines) {
        return lines.isEmpty() ? null : String.join("\n", lines);
    }

    /**
     * Split a line into glyphs, dropping whitespace and variation selectors.
     */
    public static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        int[] codePoints = line.codePoints().toArray();
        for (int i = 0; i < codePoints.length; i++) {
            int cp = codePoints[i];
            if (cp == VARIATION_SELECTOR || Character.isWhitespace(cp)) {
                continue;
            }
            if (cp == KEYCAP && !tokens.isEmpty()) {
                appendToLast(tokens, cp);
            } else if (cp == ZERO_WIDTH_JOINER && !tokens.isEmpty() && i + 1 < codePoints.length) {
                appendToLast(tokens, cp);
                appendToLast(tokens, codePoints[++i]);
            } else {
                tokens.add(new String(Character.toChars(cp)));
            }
        }
        return tokens;
    }

    /**
     * True if every glyph on the line is a pictographic symbol (an emoji-only line).
     */
    public static boolean isPictographic(String line) {
        List<String> tokens = tokenize(line);
        return !tokens.isEmpty() && tokens.stream().allMatch(token -> {
            int cp = token.codePointAt(0);
            return Character.getType(cp) == Character.OTHER_SYMBOL
                    || (Character.isSupplementaryCodePoint(cp) && !Character.isLetterOrDigit(cp));
        });
    }

    static String normalize(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints()
                .filter(cp -> cp != VARIATION_SELECTOR)
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }

    private static void appendToLast(List<String> tokens, int cp) {
        int last = tokens.size() - 1;
        tokens.set(last, tokens.get(last) + new String(Character.toChars(cp)));
    }
}
