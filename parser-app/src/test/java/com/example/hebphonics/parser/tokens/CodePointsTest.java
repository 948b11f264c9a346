package com.example.hebphonics.parser.tokens;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CodePointsTest {

    @Test
    void namesFollowUnicodeWithoutHebrewPrefix() {
        assertEquals("LETTER_FINAL_KAF", CodePoints.constName(CodePoints.LETTER_FINAL_KAF));
        assertEquals("POINT_QAMATS", CodePoints.constName(CodePoints.POINT_QAMATS));
        assertEquals("FINAL_KAF", CodePoints.shortName(CodePoints.LETTER_FINAL_KAF));
        assertEquals("PUNCTUATION_MAQAF", CodePoints.constName(CodePoints.PUNCTUATION_MAQAF));
    }

    @Test
    void categoriesComeFromTheNamePrefix() {
        assertEquals(CodePoints.Category.LETTER, CodePoints.categoryOf(CodePoints.LETTER_ALEF));
        assertEquals(CodePoints.Category.POINT, CodePoints.categoryOf(CodePoints.POINT_METEG));
        assertEquals(CodePoints.Category.ACCENT, CodePoints.categoryOf(CodePoints.ACCENT_MUNAH));
        assertEquals(CodePoints.Category.OTHER, CodePoints.categoryOf(CodePoints.PUNCTUATION_MAQAF));
        assertEquals(CodePoints.Category.OTHER, CodePoints.categoryOf(' '));
        assertEquals(CodePoints.Category.OTHER, CodePoints.categoryOf(0x200D));
    }

    @Test
    void unknownCodePointsHaveNoNameOrCategory() {
        assertNull(CodePoints.constName('A'));
        assertNull(CodePoints.categoryOf('A'));
        assertNull(CodePoints.categoryOf(0x0430));
    }

    @Test
    void vowelPointsExcludeDageshAndMeteg() {
        assertTrue(CodePoints.isVowelPoint(CodePoints.POINT_SHEVA));
        assertTrue(CodePoints.isVowelPoint(CodePoints.POINT_QAMATS_QATAN));
        assertFalse(CodePoints.isVowelPoint(CodePoints.POINT_DAGESH_OR_MAPIQ));
        assertFalse(CodePoints.isVowelPoint(CodePoints.POINT_METEG));
        assertFalse(CodePoints.isVowelPoint(CodePoints.LETTER_ALEF));
    }

    @Test
    void normalizeDecomposesPresentationForms() {
        // alef with patah as a single presentation form
        assertEquals("\u05D0\u05B7", CodePoints.normalize("\uFB2E"));
        String once = CodePoints.normalize("\u05E9\u05C1\u05B8\u05DC\u05D5\u05B9\u05DD");
        assertEquals(once, CodePoints.normalize(once));
        assertEquals("", CodePoints.normalize(null));
    }

    @Test
    void stripKeepsLettersAndVowels() {
        // meteg
        assertEquals("\u05D1\u05BC\u05B8\u05DD", CodePoints.strip("\u05D1\u05BC\u05B8\u05BD\u05DD"));
        // etnahta
        assertEquals("\u05E7\u05B5\u05D3\u05B0\u05DE\u05B8\u05D4",
                CodePoints.strip("\u05E7\u05B5\u0591\u05D3\u05B0\u05DE\u05B8\u05D4"));
        // maqaf
        assertEquals("\u05DE\u05B8\u05E8", CodePoints.strip("\u05DE\u05B8\u05E8\u05BE"));
        assertEquals("", CodePoints.strip(""));
    }

    @Test
    void describeIncludesHexAndName() {
        assertEquals("U+0041 latin_capital_letter_a", CodePoints.describe('A'));
    }
}
