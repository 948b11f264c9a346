package com.example.hebphonics.parser.grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.hebphonics.parser.tokens.Symbol;

class HebrewParserTest {

    private final HebrewParser parser = new HebrewParser();

    @Test
    void emptyWordParsesToNothing() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(HebrewParser.flatten(parser.parse("")).isEmpty());
    }

    @Test
    void nullWordIsRejected() {
        assertThrows(NullPointerException.class, () -> parser.parse(null));
    }

    @Test
    void clustersStayAlignedWithLetters() {
        List<Cluster> clusters = parser.parse("אוֹר");
        assertEquals(3, clusters.size());
        assertTrue(clusters.get(1).isEmpty());
        assertEquals(Symbol.HOLAM_MALE_VAV, clusters.get(0).vowel());
        assertEquals(List.of("eim-qria-vav-is-holam-male"), clusters.get(0).rules());
    }

    @Test
    void parsedClustersAreFrozen() {
        List<Cluster> clusters = parser.parse("מַת");
        assertTrue(clusters.get(0).isFrozen());
        assertThrows(IllegalStateException.class, () -> clusters.get(0).setOpen(false));
        assertThrows(UnsupportedOperationException.class, () -> clusters.add(Cluster.empty()));
    }

    @Test
    void presentationFormsAreDecomposed() {
        // bet with dagesh as a single presentation form, then qamats
        assertEquals(List.of("bet", "dagesh-qal", "qamats-gadol"),
                ParseAssertions.flatNames(parser, "\uFB31\u05B8"));
    }

    @Test
    void lexErrorsPropagate() {
        LexException ex = assertThrows(LexException.class, () -> parser.parse("abc"));
        assertEquals(0, ex.position());
    }

    @Test
    void renderWritesTheParseBack() {
        assertEquals("מַת", HebrewParser.render(parser.parse("מַת")));
    }

    @Test
    void ruleTraceFollowsClusterOrder() {
        List<String> trace = HebrewParser.ruleTrace(parser.parse("\u05D1\u05BC\u05B8\u05E8\u05B8\u05D0"));
        assertEquals("dagesh-qal-bgdkft", trace.get(0));
        assertEquals("eim-qria-alef", trace.get(trace.size() - 1));
    }

    @Test
    void syllableCount() {
        assertEquals(2, parser.syllableCount(parser.parse("בָּרָא")));
        assertEquals(1, parser.syllableCount(parser.parse("מַת")));
    }

    @Test
    void settingsAreKept() {
        RuleSettings settings = RuleSettings.of(List.of(), List.of("glide-av"));
        assertSame(settings, new HebrewParser(settings).settings());
    }
}
