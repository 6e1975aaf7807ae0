package com.puzzletracker.parser.grammar;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordered table of game grammars. Auto-detection walks the table and picks the first
 * grammar whose signature is found in the text; signatures are written so that at most one
 * can match any real share text, so the order only matters as a tie-break.
 */
public class GrammarRegistry {

    private final List<ShareTextGrammar> grammars;
    private final ShareTextGrammar fallback;

    public GrammarRegistry(List<ShareTextGrammar> grammars, ShareTextGrammar fallback) {
        this.grammars = List.copyOf(grammars);
        this.fallback = fallback;
    }

    public static GrammarRegistry defaults() {
        return new GrammarRegistry(List.of(
                new WantedleGrammar(),
                new ChronophotoGrammar(),
                angle(),
                new GenshindleGrammar(),
                new GamedleGrammar(),
                new R34dleGrammar(),
                new ScrandleGrammar(),
                new ConnectionsGrammar(),
                new QuordleGrammar(),
                new WorldleGrammar(),
                nerdle(),
                new ColorfleGrammar(),
                new HexcodleGrammar(),
                new ColorGuesserGrammar(),
                new TimingleGrammar(),
                new SpellcheckGrammar(),
                new PokedokuGrammar(),
                ModeSummaryGrammar.loldle(),
                ModeSummaryGrammar.pokedle(),
                bandle(),
                wordle()
        ), new GenericGrammar());
    }

    public List<ShareTextGrammar> grammars() {
        return grammars;
    }

    public ShareTextGrammar fallback() {
        return fallback;
    }

    public Optional<ShareTextGrammar> detect(ShareText text) {
        return grammars.stream().filter(g -> g.matchesSignature(text)).findFirst();
    }

    public Optional<ShareTextGrammar> find(String gameName) {
        if (gameName == null || gameName.isBlank()) {
            return Optional.empty();
        }
        return grammars.stream().filter(g -> g.answersTo(gameName)).findFirst();
    }

    static AttemptsGrammar wordle() {
        return new AttemptsGrammar("Wordle",
                Pattern.compile("Wordle\\s+[\\d,]+", Pattern.CASE_INSENSITIVE),
                Pattern.compile("Wordle\\s+([\\d,]+)\\s+(X|\\d+)/(\\d+)", Pattern.CASE_INSENSITIVE),
                "Wordle 1,643 X/6",
                GlyphAlphabet.of("⬛", "⬜", "🟨", "🟩"));
    }

    static AttemptsGrammar bandle() {
        return new AttemptsGrammar("Bandle",
                Pattern.compile("Bandle\\s+#[\\d,]+", Pattern.CASE_INSENSITIVE),
                Pattern.compile("Bandle\\s+#([\\d,]+)\\s+(X|\\d+)/(\\d+)", Pattern.CASE_INSENSITIVE),
                "Bandle #1227 4/6",
                GlyphAlphabet.of("⬛", "⬜", "🟨", "🟩", "🟥"));
    }

    static AttemptsGrammar angle() {
        return new AttemptsGrammar("Angle",
                Pattern.compile("#Angle\\s+#[\\d,]+", Pattern.CASE_INSENSITIVE),
                Pattern.compile("#Angle\\s+#([\\d,]+)\\s+(X|\\d+)/(\\d+)", Pattern.CASE_INSENSITIVE),
                "#Angle #512 3/4",
                GlyphAlphabet.of("⬆️", "⬇️", "🎉"));
    }

    static AttemptsGrammar nerdle() {
        return new AttemptsGrammar("Nerdle",
                Pattern.compile("nerdlegame\\s+[\\d,]+", Pattern.CASE_INSENSITIVE),
                Pattern.compile("nerdlegame\\s+([\\d,]+)\\s+(X|\\d+)/(\\d+)", Pattern.CASE_INSENSITIVE),
                "nerdlegame 1,024 3/6",
                GlyphAlphabet.of("⬛", "⬜", "🟪", "🟩"));
    }
}
