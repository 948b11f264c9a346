package com.example.hebphonics.parser.grammar;

import com.example.hebphonics.parser.GrammarException;
import com.example.hebphonics.parser.tokens.CodePoints;
import com.example.hebphonics.parser.tokens.Symbol;

import java.util.Locale;
import java.util.Objects;

/**
 * First reading of a token, taken from the Unicode names of its code points only.
 */
public final class InitialGuesser {

    private static final String FINAL_PREFIX = "final-";
    private static final String SOFIT_SUFFIX = "-sofit";

    private InitialGuesser() {
    }

    public static Cluster guess(Token token) {
        Objects.requireNonNull(token, "token");
        Symbol letter = guessLetter(token);
        Symbol dagesh = token.hasDagesh() ? Symbol.DAGESH : null;
        Symbol vowel = guessVowel(token);
        return new Cluster(letter, dagesh, vowel, vowel != null);
    }

    private static Symbol guessLetter(Token token) {
        char base = token.baseLetter();
        if (base == CodePoints.LETTER_SHIN) {
            // a shin without either dot is read as sin
            return token.letter().indexOf(CodePoints.POINT_SHIN_DOT) >= 0 ? Symbol.SHIN : Symbol.SIN;
        }
        String name = symbolName(base);
        if (name.startsWith(FINAL_PREFIX)) {
            name = name.substring(FINAL_PREFIX.length()) + SOFIT_SUFFIX;
        }
        return lookup(name, base);
    }

    private static Symbol guessVowel(Token token) {
        if (!token.hasVowel()) {
            return null;
        }
        char point = token.vowel().charAt(0);
        if (point == CodePoints.POINT_HOLAM_HASER_FOR_VAV) {
            return Symbol.HOLAM_HASER;
        }
        return lookup(symbolName(point), point);
    }

    private static String symbolName(char codePoint) {
        String shortName = CodePoints.shortName(codePoint);
        if (shortName == null) {
            throw new GrammarException("No grammatical name for " + CodePoints.describe(codePoint));
        }
        return shortName.toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private static Symbol lookup(String name, char codePoint) {
        Symbol symbol = Symbol.forName(name);
        if (symbol == null) {
            throw new GrammarException("Unknown symbol '" + name + "' for " + CodePoints.describe(codePoint));
        }
        return symbol;
    }
}
