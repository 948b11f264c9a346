package com.example.hebphonics.parser.grammar.rules;

import static com.example.hebphonics.parser.grammar.ParseAssertions.assertParse;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.hebphonics.parser.grammar.HebrewParser;
import com.example.hebphonics.parser.grammar.RuleSettings;

class VowelRulesTest {

    @Test
    void holamDefaultsToHaser() {
        assertParse("צֹר", "tsadi", "holam-haser", "resh");
    }

    @Test
    void patahUnderFinalGutturalIsGenuvah() {
        assertParse("נֹחַ", "nun", "holam-haser", "het", "patah-genuvah");
        assertParse("רֹעַ", "resh", "holam-haser", "ayin", "patah-genuvah");
        assertParse("נֹהַּ", "nun", "holam-haser", "mapiq-he", "mapiq", "patah-genuvah");
        assertParse("הָרֵעַ", "he", "qamats-gadol", "resh", "tsere", "ayin", "patah-genuvah");
    }

    @Test
    void disabledHolamRuleKeepsPlainHolam() {
        HebrewParser parser = new HebrewParser(RuleSettings.of(List.of(), List.of("vowel-holam-haser-default")));
        assertParse(parser, "נֹחַ", "nun", "holam", "het", "patah-genuvah");
    }

    @Test
    void yodGlides() {
        assertParse("אֵלָיו", "alef", "tsere", "lamed", "qamats-gadol", "yod-glide", "vav");
        assertParse("חָי", "het", "qamats-gadol", "yod-glide");
        assertParse("חַי", "het", "patah", "yod-glide");
        assertParse("מַיִם", "mem", "patah", "yod-glide", "hiriq", "mem-sofit");
        assertParse("אוֹי", "alef", "holam-male-vav", "yod-glide");
        assertParse("צִפּוּי", "tsadi", "hiriq", "pe", "dagesh-hazaq", "shuruq", "yod-glide");
    }

    @Test
    void shuruqAtWordStartDoesNotGlide() {
        assertParse("וּמִי", "shuruq", "mem", "hiriq-male-yod", "eim-qria-yod");
    }
}
