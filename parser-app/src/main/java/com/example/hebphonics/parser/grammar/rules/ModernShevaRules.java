package com.example.hebphonics.parser.grammar.rules;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.tokens.Symbol;
import com.example.hebphonics.parser.tokens.SymbolTable;

import java.util.List;

/**
 * Modern Hebrew pronunciation of the sheva. These rules never change the traditional
 * classification; a match only adds the rule name to the trace.
 */
final class ModernShevaRules {

    private ModernShevaRules() {
    }

    static List<Rule> rules() {
        return List.of(
                Rule.of(Stage.SHEVA2, "sheva-modern-double-sound", ModernShevaRules::doubleSound),
                Rule.of(Stage.SHEVA2, "sheva-modern-voiced-sonorant", ModernShevaRules::voicedSonorant),
                Rule.of(Stage.SHEVA2, "sheva-modern-voiced-before-glottal", ModernShevaRules::voicedBeforeGlottal),
                Rule.of(Stage.SHEVA2, "sheva-modern-voiced-prefix", ModernShevaRules::voicedPrefix),
                Rule.of(Stage.SHEVA2, "sheva-modern-muted", ModernShevaRules::muted));
    }

    /** Sheva between two letters with the same sound is pronounced. */
    private static Cluster doubleSound(RuleContext context) {
        Cluster guess = context.guess();
        if (guess.vowelBelongsTo(Symbol.SHEVA) && SymbolTable.isSimilarSound(guess.letter(), context.nextGuess().letter())) {
            return guess;
        }
        return null;
    }

    private static Cluster voicedSonorant(RuleContext context) {
        Cluster guess = context.guess();
        if (isInitialShevaNa(context) && SymbolTable.isSonorant(guess.letter())) {
            return guess;
        }
        return null;
    }

    private static Cluster voicedBeforeGlottal(RuleContext context) {
        if (isInitialShevaNa(context) && SymbolTable.isGlottal(context.nextToken().baseLetter())) {
            return context.guess();
        }
        return null;
    }

    private static Cluster voicedPrefix(RuleContext context) {
        Cluster guess = context.guess();
        if (isInitialShevaNa(context) && SymbolTable.isPrefixMorpheme(guess.letter())) {
            return guess;
        }
        return null;
    }

    private static Cluster muted(RuleContext context) {
        return isInitialShevaNa(context) ? context.guess() : null;
    }

    private static boolean isInitialShevaNa(RuleContext context) {
        return context.isFirst() && context.guess().vowel() == Symbol.SHEVA_NA;
    }
}
