package com.example.hebphonics.parser.grammar.rules;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.grammar.Token;
import com.example.hebphonics.parser.tokens.CodePoints;
import com.example.hebphonics.parser.tokens.Symbol;
import com.example.hebphonics.parser.tokens.SymbolTable;

import java.util.List;

/**
 * Classifies the dagesh point: soft and hard BGDKFT letters, dagesh-qal, dagesh-hazaq and
 * mapiq. A doubling dagesh closes the syllable of the previous letter.
 */
final class DageshRules {

    private DageshRules() {
    }

    static List<Rule> rules() {
        return List.of(
                Rule.of(Stage.DAGESH, "dagesh-none-bgdkft", DageshRules::noneBgdkft),
                Rule.of(Stage.DAGESH, "dagesh-qal-bgdkft", DageshRules::qalBgdkft),
                Rule.of(Stage.DAGESH, "dagesh-hazaq-bgdkft", DageshRules::hazaqBgdkft),
                Rule.of(Stage.DAGESH, "dagesh-is-mapiq-alef", DageshRules::mapiqAlef),
                Rule.of(Stage.DAGESH, "dagesh-is-mapiq-he", DageshRules::mapiqHe),
                Rule.of(Stage.DAGESH, "dagesh-in-guttural", DageshRules::inGuttural),
                Rule.of(Stage.DAGESH, "dagesh-hazaq-default", DageshRules::hazaqDefault));
    }

    private static Cluster noneBgdkft(RuleContext context) {
        Token token = context.token();
        if (SymbolTable.isBegedkefet(token.baseLetter()) && !token.hasDagesh()) {
            return context.guess().setLetter(SymbolTable.softLetter(token.baseLetter()));
        }
        return null;
    }

    // also covers a dagesh after a sheva, which cannot be a doubling dagesh
    private static Cluster qalBgdkft(RuleContext context) {
        Token token = context.token();
        if (SymbolTable.isBegedkefet(token.baseLetter()) && token.hasDagesh()
                && !SymbolTable.isVowel(context.prev().vowel())) {
            return context.guess()
                    .setLetter(SymbolTable.hardLetter(token.baseLetter()))
                    .setDagesh(Symbol.DAGESH_QAL);
        }
        return null;
    }

    private static Cluster hazaqBgdkft(RuleContext context) {
        Token token = context.token();
        if (SymbolTable.isBegedkefet(token.baseLetter()) && token.hasDagesh()
                && SymbolTable.isVowel(context.prev().vowel())) {
            context.prev().setOpen(false);
            return context.guess()
                    .setLetter(SymbolTable.hardLetter(token.baseLetter()))
                    .setDagesh(Symbol.DAGESH_HAZAQ);
        }
        return null;
    }

    private static Cluster mapiqAlef(RuleContext context) {
        Token token = context.token();
        if (token.baseLetter() == CodePoints.LETTER_ALEF && token.hasDagesh()) {
            return context.guess().setLetter(Symbol.MAPIQ_ALEF).setDagesh(Symbol.MAPIQ);
        }
        return null;
    }

    /** A dagesh in a final he marks it as pronounced. */
    private static Cluster mapiqHe(RuleContext context) {
        Token token = context.token();
        if (context.isLast() && token.baseLetter() == CodePoints.LETTER_HE && token.hasDagesh()) {
            return context.guess().setLetter(Symbol.MAPIQ_HE).setDagesh(Symbol.MAPIQ);
        }
        return null;
    }

    /** Non-standard gemination mark in a letter that cannot be doubled. */
    private static Cluster inGuttural(RuleContext context) {
        Cluster guess = context.guess();
        if (SymbolTable.isNonDagesh(guess.letter()) && guess.hasDagesh()) {
            context.prev().setOpen(false);
            return guess.setDagesh(Symbol.DAGESH_HAZAQ);
        }
        return null;
    }

    private static Cluster hazaqDefault(RuleContext context) {
        Cluster guess = context.guess();
        if (guess.dagesh() == Symbol.DAGESH) {
            context.prev().setOpen(false);
            return guess.setDagesh(Symbol.DAGESH_HAZAQ);
        }
        return null;
    }
}
