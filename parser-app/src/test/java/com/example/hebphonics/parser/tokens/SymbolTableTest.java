package com.example.hebphonics.parser.tokens;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class SymbolTableTest {

    @Test
    void renderJoinsSymbolText() {
        List<Symbol> shalom = Arrays.asList(Symbol.SHIN, Symbol.QAMATS, Symbol.LAMED,
                Symbol.HOLAM_MALE_VAV, Symbol.MEM_SOFIT);
        assertEquals("\u05E9\u05C1\u05B8\u05DC\u05D5\u05B9\u05DD", SymbolTable.render(shalom));
        assertEquals("", SymbolTable.render(List.of()));
        assertEquals("\u05D1\u05BC", SymbolTable.render(Arrays.asList(Symbol.BET, null, Symbol.DAGESH_QAL)));
    }

    @Test
    void normalizeNameAcceptsCommonSpellings() {
        assertEquals(Symbol.QAMATS, SymbolTable.normalizeName("kamatz"));
        assertEquals(Symbol.SHEVA_NAH, SymbolTable.normalizeName("shva nach"));
        assertEquals(Symbol.MEM_SOFIT, SymbolTable.normalizeName("final mem"));
        assertEquals(Symbol.QAMATS_QATAN, SymbolTable.normalizeName("Qamats Hatuf"));
        assertEquals(Symbol.PATAH_GENUVAH, SymbolTable.normalizeName("furtive patah"));
        assertEquals(Symbol.DAGESH_HAZAQ, SymbolTable.normalizeName("dagesh_forte"));
        assertEquals(Symbol.HIRIQ_MALE_YOD, SymbolTable.normalizeName("hiriq-male-yod"));
    }

    @Test
    void normalizeNameReturnsNullForUnknownInput() {
        assertNull(SymbolTable.normalizeName("zzz"));
        assertNull(SymbolTable.normalizeName("   "));
        assertNull(SymbolTable.normalizeName(null));
    }

    @Test
    void begedkefetHasSoftAndHardForms() {
        assertTrue(SymbolTable.isBegedkefet(CodePoints.LETTER_BET));
        assertFalse(SymbolTable.isBegedkefet(CodePoints.LETTER_ALEF));
        assertEquals(Symbol.VET, SymbolTable.softLetter(CodePoints.LETTER_BET));
        assertEquals(Symbol.BET, SymbolTable.hardLetter(CodePoints.LETTER_BET));
        assertEquals(Symbol.SAV, SymbolTable.softLetter(CodePoints.LETTER_TAV));
        assertEquals(Symbol.KHAF_SOFIT, SymbolTable.softLetter(CodePoints.LETTER_FINAL_KAF));
        assertTrue(SymbolTable.isBegedkefet(Symbol.FE_SOFIT));
        assertFalse(SymbolTable.isBegedkefet(Symbol.QOF));
    }

    @Test
    void letterClasses() {
        assertTrue(SymbolTable.isGuttural(Symbol.AYIN));
        assertFalse(SymbolTable.isGuttural(Symbol.RESH));
        assertTrue(SymbolTable.isNonDagesh(Symbol.RESH));
        assertTrue(SymbolTable.isSonorant(Symbol.NUN));
        assertFalse(SymbolTable.isSonorant(Symbol.GIMEL));
        assertTrue(SymbolTable.isPrefixMorpheme(Symbol.LAMED));
        assertTrue(SymbolTable.isGlottal(CodePoints.LETTER_AYIN));
        assertFalse(SymbolTable.isGlottal(CodePoints.LETTER_HET));
    }

    @Test
    void similarSoundsShareAGroup() {
        assertTrue(SymbolTable.isSimilarSound(Symbol.KHAF, Symbol.HET));
        assertTrue(SymbolTable.isSimilarSound(Symbol.DALET, Symbol.TAV));
        assertTrue(SymbolTable.isSimilarSound(Symbol.LAMED, Symbol.LAMED));
        assertFalse(SymbolTable.isSimilarSound(Symbol.KHAF, Symbol.RESH));
        assertFalse(SymbolTable.isSimilarSound(null, Symbol.RESH));
    }

    @Test
    void niqqudCategories() {
        assertEquals(NiqqudType.SHEVA, SymbolTable.categoryOf(Symbol.SHEVA_MERAHEF));
        assertEquals(NiqqudType.HATAF, SymbolTable.categoryOf(Symbol.HATAF_QAMATS));
        assertEquals(NiqqudType.LONG, SymbolTable.categoryOf(Symbol.QAMATS_GADOL));
        assertEquals(NiqqudType.SHORT, SymbolTable.categoryOf(Symbol.QAMATS_QATAN));
        assertEquals(NiqqudType.DAGESH, SymbolTable.categoryOf(Symbol.MAPIQ));
        assertNull(SymbolTable.categoryOf(Symbol.ALEF));
        assertTrue(SymbolTable.isVowel(Symbol.HATAF_PATAH));
        assertFalse(SymbolTable.isVowel(Symbol.SHEVA_NA));
        assertFalse(SymbolTable.isVowel(Symbol.DAGESH));
    }

    @Test
    void familyMembershipUsesNamePrefix() {
        assertTrue(Symbol.SHEVA_NAH_VOICED.belongsTo(Symbol.SHEVA_NAH));
        assertTrue(Symbol.SHEVA_NA.belongsTo(Symbol.SHEVA));
        assertFalse(Symbol.HATAF_QAMATS.belongsTo(Symbol.QAMATS));
        assertEquals(Symbol.KHAF_SOFIT, Symbol.forName("khaf-sofit"));
        assertNull(Symbol.forName("final-kaf"));
    }
}
