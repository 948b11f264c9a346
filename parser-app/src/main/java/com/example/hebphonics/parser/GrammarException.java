package com.example.hebphonics.parser;

/**
 * Exception thrown when a word or a rule configuration cannot be processed.
 */
public class GrammarException extends RuntimeException {
    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
