package com.example.hebphonics.parser.grammar.rules;

import static com.example.hebphonics.parser.grammar.ParseAssertions.assertParse;

import org.junit.jupiter.api.Test;

class EimQriaRulesTest {

    @Test
    void holamHaserForVav() {
        assertParse("מִצְוֺת", "mem", "hiriq", "tsadi", "sheva-nah", "vav", "holam-haser", "sav");
    }

    @Test
    void shuruqAtStart() {
        assertParse("וּבֶן", "shuruq", "vet", "segol", "nun-sofit");
    }

    @Test
    void shuruqInsideWord() {
        assertParse("תֹהוּ", "sav", "holam-haser", "he", "shuruq");
    }

    @Test
    void vavWithHolamAfterBareLetterIsHolamMale() {
        assertParse("אוֹר", "alef", "holam-male-vav", "resh");
        assertParse("בּוֹא", "bet", "dagesh-qal", "holam-male-vav", "alef");
    }

    @Test
    void vavWithHolamAfterVowelStaysConsonant() {
        assertParse("עֲוֺן", "ayin", "hataf-patah", "vav", "holam-haser", "nun-sofit");
    }

    @Test
    void vavWithDageshAfterVowelIsDoubled() {
        assertParse("חַוָּה", "het", "patah", "vav", "dagesh-hazaq", "qamats-gadol", "eim-qria-he");
    }

    @Test
    void hiriqBeforeBareYodIsHiriqMale() {
        assertParse("כִּי", "kaf", "dagesh-qal", "hiriq-male-yod", "eim-qria-yod");
    }

    @Test
    void bareAlefAfterVowel() {
        assertParse("נָא", "nun", "qamats-gadol", "eim-qria-alef");
        assertParse("צֵא", "tsadi", "tsere", "eim-qria-alef");
        assertParse("בֹּא", "bet", "dagesh-qal", "holam-haser", "eim-qria-alef");
        assertParse("הוּא", "he", "shuruq", "eim-qria-alef");
    }

    @Test
    void bareHeAfterVowel() {
        assertParse("מָה", "mem", "qamats-gadol", "eim-qria-he");
        assertParse("מַה", "mem", "patah", "eim-qria-he");
        assertParse("שֵׂה", "sin", "tsere", "eim-qria-he");
    }

    @Test
    void bareYodAfterTsereOrSegol() {
        assertParse("אֵין", "alef", "tsere", "eim-qria-yod", "nun-sofit");
        assertParse("אֵלֶיךָ", "alef", "tsere", "lamed", "segol", "eim-qria-yod", "khaf-sofit", "qamats-gadol");
    }
}
