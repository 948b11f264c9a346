package com.example.hebphonics.parser.tokens;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;

/**
 * Catalog of the Unicode code points recognised in pointed Hebrew text together with the
 * lexical category of each one. Names follow the Unicode character name with the
 * {@code HEBREW} prefix removed, e.g. {@code POINT_QAMATS} or {@code LETTER_FINAL_KAF}.
 */
public final class CodePoints {

    public static final char LETTER_ALEF = 'א';
    public static final char LETTER_BET = 'ב';
    public static final char LETTER_GIMEL = 'ג';
    public static final char LETTER_DALET = 'ד';
    public static final char LETTER_HE = 'ה';
    public static final char LETTER_VAV = 'ו';
    public static final char LETTER_ZAYIN = 'ז';
    public static final char LETTER_HET = 'ח';
    public static final char LETTER_TET = 'ט';
    public static final char LETTER_YOD = 'י';
    public static final char LETTER_FINAL_KAF = 'ך';
    public static final char LETTER_KAF = 'כ';
    public static final char LETTER_LAMED = 'ל';
    public static final char LETTER_FINAL_MEM = 'ם';
    public static final char LETTER_MEM = 'מ';
    public static final char LETTER_FINAL_NUN = 'ן';
    public static final char LETTER_NUN = 'נ';
    public static final char LETTER_SAMEKH = 'ס';
    public static final char LETTER_AYIN = 'ע';
    public static final char LETTER_FINAL_PE = 'ף';
    public static final char LETTER_PE = 'פ';
    public static final char LETTER_FINAL_TSADI = 'ץ';
    public static final char LETTER_TSADI = 'צ';
    public static final char LETTER_QOF = 'ק';
    public static final char LETTER_RESH = 'ר';
    public static final char LETTER_SHIN = 'ש';
    public static final char LETTER_TAV = 'ת';

    public static final char POINT_SHEVA = '\u05B0';
    public static final char POINT_HATAF_SEGOL = '\u05B1';
    public static final char POINT_HATAF_PATAH = '\u05B2';
    public static final char POINT_HATAF_QAMATS = '\u05B3';
    public static final char POINT_HIRIQ = '\u05B4';
    public static final char POINT_TSERE = '\u05B5';
    public static final char POINT_SEGOL = '\u05B6';
    public static final char POINT_PATAH = '\u05B7';
    public static final char POINT_QAMATS = '\u05B8';
    public static final char POINT_HOLAM = '\u05B9';
    public static final char POINT_HOLAM_HASER_FOR_VAV = '\u05BA';
    public static final char POINT_QUBUTS = '\u05BB';
    public static final char POINT_DAGESH_OR_MAPIQ = '\u05BC';
    public static final char POINT_METEG = '\u05BD';
    public static final char PUNCTUATION_MAQAF = '\u05BE';
    public static final char POINT_RAFE = '\u05BF';
    public static final char POINT_SHIN_DOT = '\u05C1';
    public static final char POINT_SIN_DOT = '\u05C2';
    public static final char POINT_QAMATS_QATAN = '\u05C7';

    public static final char ACCENT_TELISHA_GEDOLA = '\u05A0';
    public static final char ACCENT_MUNAH = '\u05A3';

    /** Points that carry the vowel of a letter; all other points are secondary. */
    private static final Set<Character> VOWEL_POINTS = Set.of(
            POINT_SHEVA, POINT_HATAF_SEGOL, POINT_HATAF_PATAH, POINT_HATAF_QAMATS,
            POINT_HIRIQ, POINT_TSERE, POINT_SEGOL, POINT_PATAH, POINT_QAMATS,
            POINT_HOLAM, POINT_HOLAM_HASER_FOR_VAV, POINT_QUBUTS, POINT_QAMATS_QATAN);

    private static final String HEBREW_PREFIX = "HEBREW ";

    /**
     * Lexical category of a recognised code point, derived from the first word of its name.
     */
    public enum Category {
        LETTER,
        POINT,
        ACCENT,
        /** Punctuation, marks, ligatures, spaces and joiners. */
        OTHER
    }

    private CodePoints() {
    }

    /**
     * Returns the catalog name of the code point or {@code null} when the code point is not
     * part of the recognised set.
     */
    public static String constName(int codePoint) {
        if (!isRecognised(codePoint)) {
            return null;
        }
        String name = Character.getName(codePoint);
        if (name == null) {
            return null;
        }
        if (name.startsWith(HEBREW_PREFIX)) {
            name = name.substring(HEBREW_PREFIX.length());
        }
        return name.replace(' ', '_').replace('-', '_');
    }

    /**
     * Same as {@link #constName(int)} without the category prefix, e.g. {@code FINAL_KAF}.
     */
    public static String shortName(int codePoint) {
        String name = constName(codePoint);
        if (name == null) {
            return null;
        }
        int separator = name.indexOf('_');
        return separator < 0 ? name : name.substring(separator + 1);
    }

    public static Category categoryOf(int codePoint) {
        String name = constName(codePoint);
        if (name == null) {
            return null;
        }
        int separator = name.indexOf('_');
        String prefix = separator < 0 ? name : name.substring(0, separator);
        switch (prefix) {
            case "LETTER":
                return Category.LETTER;
            case "POINT":
                return Category.POINT;
            case "ACCENT":
                return Category.ACCENT;
            default:
                return Category.OTHER;
        }
    }

    public static boolean isVowelPoint(int codePoint) {
        return codePoint <= Character.MAX_VALUE && VOWEL_POINTS.contains((char) codePoint);
    }

    public static boolean isShinOrSinDot(int codePoint) {
        return codePoint == POINT_SHIN_DOT || codePoint == POINT_SIN_DOT;
    }

    /**
     * Returns the fully decomposed (NFKD) form of the text. Normalising an already
     * normalised string returns it unchanged.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return Normalizer.normalize(text, Normalizer.Form.NFKD);
    }

    /**
     * Keeps only letters and points, dropping accents, punctuation, meteg and rafe. Used for the
     * display and search form of a word.
     */
    public static String strip(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            Category category = categoryOf(codePoint);
            boolean letterOrPoint = category == Category.LETTER || category == Category.POINT;
            if (letterOrPoint && codePoint != POINT_METEG && codePoint != POINT_RAFE) {
                builder.appendCodePoint(codePoint);
            }
        });
        return builder.toString();
    }

    /** Lower-cased name used in error messages, e.g. {@code U+0041 latin_capital_letter_a}. */
    public static String describe(int codePoint) {
        String name = Character.getName(codePoint);
        String label = name == null ? "unassigned" : name.toLowerCase(Locale.ROOT).replace(' ', '_');
        return String.format(Locale.ROOT, "U+%04X %s", codePoint, label);
    }

    private static boolean isRecognised(int codePoint) {
        return codePoint == 0x0020
                || codePoint == 0x002F
                || codePoint == 0x034F
                || (codePoint >= 0x200C && codePoint <= 0x200F)
                || (codePoint >= 0x0590 && codePoint <= 0x05F3)
                || (codePoint >= 0xFB1D && codePoint <= 0xFB4E);
    }
}
