package com.example.hebphonics.parser.tokens;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static lookups over the {@link Symbol} catalog: rendering, name normalisation, letter classes
 * and niqqud categories.
 */
public final class SymbolTable {

    private static final Map<Character, Symbol> BEGEDKEFET_SOFT = Map.of(
            CodePoints.LETTER_BET, Symbol.VET,
            CodePoints.LETTER_GIMEL, Symbol.GIMEL,
            CodePoints.LETTER_DALET, Symbol.DALET,
            CodePoints.LETTER_KAF, Symbol.KHAF,
            CodePoints.LETTER_FINAL_KAF, Symbol.KHAF_SOFIT,
            CodePoints.LETTER_PE, Symbol.FE,
            CodePoints.LETTER_FINAL_PE, Symbol.FE_SOFIT,
            CodePoints.LETTER_TAV, Symbol.SAV);

    private static final Map<Character, Symbol> BEGEDKEFET_HARD = Map.of(
            CodePoints.LETTER_BET, Symbol.BET,
            CodePoints.LETTER_GIMEL, Symbol.GIMEL,
            CodePoints.LETTER_DALET, Symbol.DALET,
            CodePoints.LETTER_KAF, Symbol.KAF,
            CodePoints.LETTER_FINAL_KAF, Symbol.KAF_SOFIT,
            CodePoints.LETTER_PE, Symbol.PE,
            CodePoints.LETTER_FINAL_PE, Symbol.PE_SOFIT,
            CodePoints.LETTER_TAV, Symbol.TAV);

    private static final Set<Symbol> BEGEDKEFET_LETTERS = Collections.unmodifiableSet(EnumSet.of(
            Symbol.BET, Symbol.VET, Symbol.GIMEL, Symbol.DALET, Symbol.KAF, Symbol.KHAF,
            Symbol.KAF_SOFIT, Symbol.KHAF_SOFIT, Symbol.PE, Symbol.FE, Symbol.PE_SOFIT,
            Symbol.FE_SOFIT, Symbol.TAV, Symbol.SAV));

    /** Letters that may be an inseparable prefix (be-, ve-, ke-, le-, te-). */
    private static final Set<Symbol> PREFIX_MORPHEMES = Collections.unmodifiableSet(EnumSet.of(
            Symbol.BET, Symbol.VET, Symbol.VAV, Symbol.KAF, Symbol.KHAF, Symbol.LAMED,
            Symbol.TAV, Symbol.SAV));

    private static final Set<Symbol> SONORANT_LETTERS = Collections.unmodifiableSet(EnumSet.of(
            Symbol.YOD, Symbol.LAMED, Symbol.MEM, Symbol.NUN, Symbol.RESH));

    private static final Set<Character> GLOTTAL_LETTERS = Set.of(
            CodePoints.LETTER_ALEF, CodePoints.LETTER_HE, CodePoints.LETTER_AYIN);

    private static final Set<Symbol> GUTTURAL_LETTERS = Collections.unmodifiableSet(EnumSet.of(
            Symbol.ALEF, Symbol.HE, Symbol.HET, Symbol.AYIN));

    /** Gutturals and resh never take a doubling dagesh. */
    private static final Set<Symbol> NON_DAGESH_LETTERS = Collections.unmodifiableSet(EnumSet.of(
            Symbol.ALEF, Symbol.HE, Symbol.HET, Symbol.AYIN, Symbol.RESH));

    private static final List<Set<Symbol>> SIMILAR_LETTERS = List.of(
            EnumSet.of(Symbol.ALEF, Symbol.MAPIQ_ALEF, Symbol.AYIN),
            EnumSet.of(Symbol.VET, Symbol.VAV),
            EnumSet.of(Symbol.DALET, Symbol.TET, Symbol.TAV),
            EnumSet.of(Symbol.HE, Symbol.MAPIQ_HE),
            EnumSet.of(Symbol.HET, Symbol.KHAF, Symbol.KHAF_SOFIT),
            EnumSet.of(Symbol.KAF, Symbol.KAF_SOFIT, Symbol.QOF),
            EnumSet.of(Symbol.MEM, Symbol.MEM_SOFIT),
            EnumSet.of(Symbol.NUN, Symbol.NUN_SOFIT),
            EnumSet.of(Symbol.SAMEKH, Symbol.SIN, Symbol.SAV),
            EnumSet.of(Symbol.PE, Symbol.PE_SOFIT),
            EnumSet.of(Symbol.FE, Symbol.FE_SOFIT),
            EnumSet.of(Symbol.TSADI, Symbol.TSADI_SOFIT));

    private static final Map<Symbol, NiqqudType> NIQQUD_TYPES;

    static {
        Map<Symbol, NiqqudType> types = new EnumMap<>(Symbol.class);
        for (Symbol symbol : EnumSet.of(Symbol.MAPIQ, Symbol.DAGESH, Symbol.DAGESH_QAL, Symbol.DAGESH_HAZAQ)) {
            types.put(symbol, NiqqudType.DAGESH);
        }
        for (Symbol symbol : EnumSet.of(Symbol.SHEVA, Symbol.SHEVA_NA, Symbol.SHEVA_NA_MUTE, Symbol.SHEVA_NAH,
                Symbol.SHEVA_NAH_VOICED, Symbol.SHEVA_GAYA, Symbol.SHEVA_MERAHEF)) {
            types.put(symbol, NiqqudType.SHEVA);
        }
        types.put(Symbol.HATAF_SEGOL, NiqqudType.HATAF);
        types.put(Symbol.HATAF_PATAH, NiqqudType.HATAF);
        types.put(Symbol.HATAF_QAMATS, NiqqudType.HATAF);

        types.put(Symbol.HIRIQ, NiqqudType.SHORT);
        types.put(Symbol.HIRIQ_MALE_YOD, NiqqudType.LONG);
        types.put(Symbol.TSERE, NiqqudType.LONG);
        types.put(Symbol.SEGOL, NiqqudType.SHORT);
        types.put(Symbol.PATAH, NiqqudType.SHORT);
        types.put(Symbol.PATAH_GENUVAH, NiqqudType.SHORT);
        types.put(Symbol.QAMATS, NiqqudType.LONG);
        types.put(Symbol.QAMATS_GADOL, NiqqudType.LONG);
        types.put(Symbol.QAMATS_QATAN, NiqqudType.SHORT);
        types.put(Symbol.HOLAM, NiqqudType.LONG);
        types.put(Symbol.HOLAM_HASER, NiqqudType.LONG);
        types.put(Symbol.HOLAM_MALE_VAV, NiqqudType.LONG);
        types.put(Symbol.QUBUTS, NiqqudType.SHORT);
        types.put(Symbol.SHURUQ, NiqqudType.LONG);
        NIQQUD_TYPES = Collections.unmodifiableMap(types);
    }

    private SymbolTable() {
    }

    /**
     * Renders the symbols back to Unicode text, e.g. {@code shin qamats lamed holam-male-vav
     * mem-sofit} becomes שָׁלוֹם. {@code null} entries are skipped.
     */
    public static String render(List<Symbol> symbols) {
        Objects.requireNonNull(symbols, "symbols");
        StringBuilder builder = new StringBuilder();
        for (Symbol symbol : symbols) {
            if (symbol != null) {
                builder.append(symbol.render());
            }
        }
        return builder.toString();
    }

    /**
     * Resolves a symbol name written in any of its common transliterations ("kamatz",
     * "shva nach", "final mem", ...).
     *
     * @return the matching symbol or {@code null} when nothing matches
     */
    public static Symbol normalizeName(String input) {
        if (input == null) {
            return null;
        }
        String candidate = input.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[\\s_]+", "-");
        if (candidate.isEmpty()) {
            return null;
        }
        Symbol exact = Symbol.forName(candidate);
        if (exact != null) {
            return exact;
        }
        for (Symbol symbol : Symbol.values()) {
            if (symbol.matchesVariant(candidate)) {
                return symbol;
            }
        }
        return null;
    }

    public static boolean isBegedkefet(char letter) {
        return BEGEDKEFET_SOFT.containsKey(letter);
    }

    public static boolean isBegedkefet(Symbol letter) {
        return letter != null && BEGEDKEFET_LETTERS.contains(letter);
    }

    /** Name of a BGDKFT letter written without a dagesh, e.g. bet becomes vet. */
    public static Symbol softLetter(char letter) {
        return BEGEDKEFET_SOFT.get(letter);
    }

    /** Name of a BGDKFT letter written with a dagesh. */
    public static Symbol hardLetter(char letter) {
        return BEGEDKEFET_HARD.get(letter);
    }

    public static boolean isGuttural(Symbol letter) {
        return letter != null && GUTTURAL_LETTERS.contains(letter);
    }

    public static boolean isNonDagesh(Symbol letter) {
        return letter != null && NON_DAGESH_LETTERS.contains(letter);
    }

    public static boolean isSonorant(Symbol letter) {
        return letter != null && SONORANT_LETTERS.contains(letter);
    }

    public static boolean isPrefixMorpheme(Symbol letter) {
        return letter != null && PREFIX_MORPHEMES.contains(letter);
    }

    public static boolean isGlottal(char letter) {
        return GLOTTAL_LETTERS.contains(letter);
    }

    /**
     * Returns {@code true} when both letters are the same or share a sound or manner of
     * articulation (vet/vav, dalet/tet/tav, ...).
     */
    public static boolean isSimilarSound(Symbol first, Symbol second) {
        if (first == null || second == null) {
            return false;
        }
        if (first == second) {
            return true;
        }
        for (Set<Symbol> group : SIMILAR_LETTERS) {
            if (group.contains(first) && group.contains(second)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the category of the point or {@code null} for letters and unclassified names
     */
    public static NiqqudType categoryOf(Symbol point) {
        return point == null ? null : NIQQUD_TYPES.get(point);
    }

    public static boolean isVowel(Symbol point) {
        NiqqudType type = categoryOf(point);
        return type != null && type.isVowel();
    }
}
