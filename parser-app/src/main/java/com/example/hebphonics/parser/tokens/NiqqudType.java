package com.example.hebphonics.parser.tokens;

/**
 * Coarse categories of niqqud used by the syllable and sheva rules.
 */
public enum NiqqudType {
    DAGESH,
    SHEVA,
    HATAF,
    SHORT,
    LONG;

    /**
     * Only hataf, short and long niqqud count as vowels; sheva does not.
     */
    public boolean isVowel() {
        return this == HATAF || this == SHORT || this == LONG;
    }
}
