package com.example.hebphonics.parser.cli;

import com.example.hebphonics.parser.tokens.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text rendering of symbols and syllables shared by the command line tools.
 */
final class SymbolFormat {

    static final String NAME_SEPARATOR = "·";
    static final String SYLLABLE_SEPARATOR = " | ";

    private SymbolFormat() {
    }

    static String names(List<Symbol> symbols, String separator) {
        List<String> names = new ArrayList<>(symbols.size());
        for (Symbol symbol : symbols) {
            names.add(symbol.getName());
        }
        return String.join(separator, names);
    }

    /** e.g. {@code bet·dagesh-qal·sheva-na | lamed·hiriq-male-yod·eim-qria-yod} */
    static String syllables(List<List<Symbol>> syllables) {
        List<String> parts = new ArrayList<>(syllables.size());
        for (List<Symbol> syllable : syllables) {
            parts.add(names(syllable, NAME_SEPARATOR));
        }
        return String.join(SYLLABLE_SEPARATOR, parts);
    }
}
