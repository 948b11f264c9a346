package com.example.hebphonics.parser.grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.example.hebphonics.parser.tokens.Symbol;

/**
 * Shared helpers for comparing parser output against symbol names.
 */
public final class ParseAssertions {

    private static final HebrewParser DEFAULT_PARSER = new HebrewParser();

    private ParseAssertions() {
    }

    public static HebrewParser defaultParser() {
        return DEFAULT_PARSER;
    }

    public static List<String> names(List<Symbol> symbols) {
        List<String> names = new ArrayList<>(symbols.size());
        for (Symbol symbol : symbols) {
            names.add(symbol.getName());
        }
        return names;
    }

    public static List<String> flatNames(HebrewParser parser, String word) {
        return names(HebrewParser.flatten(parser.parse(word)));
    }

    public static List<String> ruleTrace(String word) {
        return HebrewParser.ruleTrace(DEFAULT_PARSER.parse(word));
    }

    public static void assertParse(String word, String... expected) {
        assertParse(DEFAULT_PARSER, word, expected);
    }

    public static void assertParse(HebrewParser parser, String word, String... expected) {
        assertEquals(Arrays.asList(expected), flatNames(parser, word), "Unexpected parse of " + word);
    }
}
