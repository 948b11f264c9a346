package com.example.hebphonics.parser.grammar;

import com.example.hebphonics.parser.GrammarException;
import com.example.hebphonics.parser.tokens.CodePoints;

/**
 * Raised when a word cannot be split into letter tokens: it contains a code point outside the
 * recognised catalog, or a point, accent or mark appears before any letter.
 */
public class LexException extends GrammarException {

    /** Value of {@link #codePoint()} when the failure is not tied to a single code point. */
    public static final int NO_CODE_POINT = -1;

    private final String word;
    private final int position;
    private final int codePoint;

    public LexException(String word, int position, int codePoint, String reason) {
        super(formatMessage(word, position, codePoint, reason));
        this.word = word;
        this.position = position;
        this.codePoint = codePoint;
    }

    /**
     * The normalised word that failed to lex.
     */
    public String word() {
        return word;
    }

    /**
     * Zero-based code point offset of the failure within {@link #word()}.
     */
    public int position() {
        return position;
    }

    public int codePoint() {
        return codePoint;
    }

    private static String formatMessage(String word, int position, int codePoint, String reason) {
        StringBuilder message = new StringBuilder(reason)
                .append(" at position ").append(position)
                .append(" in '").append(word).append('\'');
        if (codePoint != NO_CODE_POINT) {
            message.append(" (").append(CodePoints.describe(codePoint)).append(')');
        }
        return message.toString();
    }
}
