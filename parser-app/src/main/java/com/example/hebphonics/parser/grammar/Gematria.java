package com.example.hebphonics.parser.grammar;

import com.example.hebphonics.parser.tokens.CodePoints;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Numeric value of a Hebrew word: the sum of its letter values. Final letter forms count as
 * their base letter; every other code point counts as zero.
 */
public final class Gematria {

    private static final Map<Character, Integer> VALUES = new HashMap<>();

    static {
        VALUES.put(CodePoints.LETTER_ALEF, 1);
        VALUES.put(CodePoints.LETTER_BET, 2);
        VALUES.put(CodePoints.LETTER_GIMEL, 3);
        VALUES.put(CodePoints.LETTER_DALET, 4);
        VALUES.put(CodePoints.LETTER_HE, 5);
        VALUES.put(CodePoints.LETTER_VAV, 6);
        VALUES.put(CodePoints.LETTER_ZAYIN, 7);
        VALUES.put(CodePoints.LETTER_HET, 8);
        VALUES.put(CodePoints.LETTER_TET, 9);
        VALUES.put(CodePoints.LETTER_YOD, 10);
        VALUES.put(CodePoints.LETTER_KAF, 20);
        VALUES.put(CodePoints.LETTER_FINAL_KAF, 20);
        VALUES.put(CodePoints.LETTER_LAMED, 30);
        VALUES.put(CodePoints.LETTER_MEM, 40);
        VALUES.put(CodePoints.LETTER_FINAL_MEM, 40);
        VALUES.put(CodePoints.LETTER_NUN, 50);
        VALUES.put(CodePoints.LETTER_FINAL_NUN, 50);
        VALUES.put(CodePoints.LETTER_SAMEKH, 60);
        VALUES.put(CodePoints.LETTER_AYIN, 70);
        VALUES.put(CodePoints.LETTER_PE, 80);
        VALUES.put(CodePoints.LETTER_FINAL_PE, 80);
        VALUES.put(CodePoints.LETTER_TSADI, 90);
        VALUES.put(CodePoints.LETTER_FINAL_TSADI, 90);
        VALUES.put(CodePoints.LETTER_QOF, 100);
        VALUES.put(CodePoints.LETTER_RESH, 200);
        VALUES.put(CodePoints.LETTER_SHIN, 300);
        VALUES.put(CodePoints.LETTER_TAV, 400);
    }

    private Gematria() {
    }

    public static int valueOf(String word) {
        Objects.requireNonNull(word, "word");
        String normalized = CodePoints.normalize(word);
        int total = 0;
        for (int i = 0; i < normalized.length(); i++) {
            total += VALUES.getOrDefault(normalized.charAt(i), 0);
        }
        return total;
    }
}
