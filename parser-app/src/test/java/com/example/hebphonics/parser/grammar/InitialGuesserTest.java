package com.example.hebphonics.parser.grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.example.hebphonics.parser.tokens.Symbol;

class InitialGuesserTest {

    private static Cluster guess(String text) {
        return InitialGuesser.guess(Lexer.lex(text).get(0));
    }

    @Test
    void letterWithDageshAndVowel() {
        Cluster cluster = guess("ב\u05BC\u05B8");
        assertEquals(Symbol.BET, cluster.letter());
        assertEquals(Symbol.DAGESH, cluster.dagesh());
        assertEquals(Symbol.QAMATS, cluster.vowel());
        assertTrue(cluster.isOpen());
        assertTrue(cluster.rules().isEmpty());
    }

    @Test
    void bareLetterIsClosed() {
        Cluster cluster = guess("ר");
        assertEquals(Symbol.RESH, cluster.letter());
        assertNull(cluster.dagesh());
        assertNull(cluster.vowel());
        assertFalse(cluster.isOpen());
    }

    @Test
    void shinWithoutDotIsSin() {
        assertEquals(Symbol.SHIN, guess("ש\u05C1").letter());
        assertEquals(Symbol.SIN, guess("ש\u05C2").letter());
        assertEquals(Symbol.SIN, guess("ש").letter());
    }

    @Test
    void finalFormsAreSofit() {
        assertEquals(Symbol.KAF_SOFIT, guess("ך").letter());
        assertEquals(Symbol.MEM_SOFIT, guess("ם").letter());
        assertEquals(Symbol.TSADI_SOFIT, guess("ץ").letter());
    }

    @Test
    void vowelNamesFollowUnicode() {
        assertEquals(Symbol.HATAF_PATAH, guess("א\u05B2").vowel());
        assertEquals(Symbol.QAMATS_QATAN, guess("כ\u05C7").vowel());
        assertEquals(Symbol.SHEVA, guess("ל\u05B0").vowel());
        assertEquals(Symbol.QUBUTS, guess("ר\u05BB").vowel());
        assertEquals(Symbol.HOLAM_HASER, guess("ו\u05BA").vowel());
    }
}
