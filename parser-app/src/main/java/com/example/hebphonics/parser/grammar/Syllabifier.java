package com.example.hebphonics.parser.grammar;

import com.example.hebphonics.parser.tokens.NiqqudType;
import com.example.hebphonics.parser.tokens.Symbol;
import com.example.hebphonics.parser.tokens.SymbolTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Splits parsed clusters into syllables.
 *
 * <ul>
 *     <li>{@value #BEFORE_VOWEL}: a vowel starts a new syllable.</li>
 *     <li>{@value #AROUND_SHEVA_NA}: a sheva-na starts a syllable and the next letter starts
 *     another one.</li>
 *     <li>{@value #NO_BREAK_AFTER_HATAF}: in strict mode a letter after a hataf vowel stays in
 *     the hataf's syllable.</li>
 * </ul>
 */
public final class Syllabifier {

    public static final String BEFORE_VOWEL = "syllable-before-vowel";
    public static final String AROUND_SHEVA_NA = "syllable-around-sheva-na";
    public static final String NO_BREAK_AFTER_HATAF = "no-syllable-after-hataf";

    static final Set<String> RULE_NAMES = Set.of(BEFORE_VOWEL, AROUND_SHEVA_NA, NO_BREAK_AFTER_HATAF);

    private final RuleSettings settings;

    public Syllabifier(RuleSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Returns the syllables as lists of symbol names; empty clusters contribute nothing.
     */
    public List<List<Symbol>> syllabify(List<Cluster> clusters, boolean strict) {
        Objects.requireNonNull(clusters, "clusters");
        List<List<Symbol>> result = new ArrayList<>();
        List<Symbol> syllable = new ArrayList<>();
        Symbol lastVowel = null;

        for (Cluster cluster : clusters) {
            Symbol vowel = cluster.vowel();
            boolean syllableBreak = false;
            if (SymbolTable.isVowel(vowel)) {
                syllableBreak = allowed(BEFORE_VOWEL);
            } else if (vowel == Symbol.SHEVA_NA || lastVowel == Symbol.SHEVA_NA) {
                syllableBreak = allowed(AROUND_SHEVA_NA);
            }
            if (strict && SymbolTable.categoryOf(lastVowel) == NiqqudType.HATAF && allowed(NO_BREAK_AFTER_HATAF)) {
                syllableBreak = false;
            }

            if (syllableBreak && !syllable.isEmpty()) {
                result.add(Collections.unmodifiableList(syllable));
                syllable = new ArrayList<>();
            }
            syllable.addAll(cluster.items());
            lastVowel = vowel;
        }
        if (!syllable.isEmpty()) {
            result.add(Collections.unmodifiableList(syllable));
        }
        return Collections.unmodifiableList(result);
    }

    private boolean allowed(String rule) {
        return !settings.isDisabled(rule);
    }
}
