package com.example.hebphonics.parser.grammar;

import com.example.hebphonics.parser.tokens.CodePoints;
import com.example.hebphonics.parser.tokens.CodePoints.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Groups the code points of a normalised word into one {@link Token} per letter.
 */
public final class Lexer {

    private Lexer() {
    }

    /**
     * Splits a word that is already in NFKD form into tokens.
     *
     * @throws LexException when a code point is not recognised or precedes the first letter
     */
    public static List<Token> lex(String word) {
        Objects.requireNonNull(word, "word");
        List<Token> tokens = new ArrayList<>();
        Token.Builder current = null;
        int position = 0;
        for (int offset = 0; offset < word.length(); position++) {
            int codePoint = word.codePointAt(offset);
            offset += Character.charCount(codePoint);
            String text = new String(Character.toChars(codePoint));

            Category category = CodePoints.categoryOf(codePoint);
            if (category == null) {
                throw new LexException(word, position, codePoint, "Unrecognised code point");
            }
            if (category == Category.LETTER) {
                if (current != null) {
                    tokens.add(current.build());
                }
                current = Token.builder(text);
                continue;
            }
            if (current == null) {
                throw new LexException(word, position, codePoint, "No base letter for mark");
            }

            if (CodePoints.isShinOrSinDot(codePoint)) {
                current.appendToLetter(text);
            } else if (codePoint == CodePoints.POINT_DAGESH_OR_MAPIQ) {
                current.dagesh(text);
            } else if (CodePoints.isVowelPoint(codePoint)) {
                current.vowel(text);
            } else if (category == Category.POINT) {
                current.point(text);
            } else if (category == Category.ACCENT) {
                current.accent(text);
            } else {
                current.punctuation(text);
            }
        }
        if (current != null) {
            tokens.add(current.build());
        }
        return Collections.unmodifiableList(tokens);
    }
}
