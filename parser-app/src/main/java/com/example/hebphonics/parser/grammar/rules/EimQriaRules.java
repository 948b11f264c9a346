package com.example.hebphonics.parser.grammar.rules;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.tokens.Symbol;

import java.util.List;

/**
 * Letters that are written but not pronounced: a vav that spells shuruq or holam-male, and a
 * bare alef, he or yod after a vowel it lengthens.
 */
final class EimQriaRules {

    private EimQriaRules() {
    }

    static List<Rule> rules() {
        return List.of(
                Rule.of(Stage.VAV, "eim-qria-vav-is-shuruq-start", EimQriaRules::shuruqStart),
                Rule.of(Stage.VAV, "eim-qria-vav-is-shuruq-middle", EimQriaRules::shuruqMiddle),
                Rule.of(Stage.VAV, "eim-qria-vav-is-holam-male", EimQriaRules::holamMale),
                Rule.of(Stage.EIM_QRIA, "eim-qria-yod-is-hiriq-male", EimQriaRules::hiriqMale),
                Rule.of(Stage.EIM_QRIA, "eim-qria-alef", EimQriaRules::alef),
                Rule.of(Stage.EIM_QRIA, "eim-qria-he", EimQriaRules::he),
                Rule.of(Stage.EIM_QRIA, "eim-qria-yod", EimQriaRules::yod));
    }

    private static Cluster shuruqStart(RuleContext context) {
        Cluster guess = context.guess();
        if (context.isFirst() && isShuruqVav(guess)) {
            return guess.reset().setVowel(Symbol.SHURUQ).setOpen(true);
        }
        return null;
    }

    private static Cluster shuruqMiddle(RuleContext context) {
        Cluster guess = context.guess();
        Cluster next = context.nextGuess();
        if (!guess.hasVowel() && isShuruqVav(next)) {
            next.reset();
            return guess.setVowel(Symbol.SHURUQ).setOpen(true);
        }
        return null;
    }

    private static Cluster holamMale(RuleContext context) {
        Cluster guess = context.guess();
        Cluster next = context.nextGuess();
        if (!guess.hasVowel() && next.letterIn(Symbol.VAV) && next.vowel() == Symbol.HOLAM && !next.hasDagesh()) {
            next.reset();
            return guess.setVowel(Symbol.HOLAM_MALE_VAV).setOpen(true);
        }
        return null;
    }

    private static Cluster hiriqMale(RuleContext context) {
        Cluster guess = context.guess();
        Cluster next = context.nextGuess();
        if (guess.vowel() == Symbol.HIRIQ && next.isBare(Symbol.YOD)) {
            next.setLetter(Symbol.EIM_QRIA_YOD).setOpen(true);
            return guess.setVowel(Symbol.HIRIQ_MALE_YOD);
        }
        return null;
    }

    private static Cluster alef(RuleContext context) {
        Cluster next = nextNonEmpty(context);
        if (next.isBare(Symbol.ALEF) && context.guess().vowelIn(Symbol.QAMATS, Symbol.QAMATS_GADOL, Symbol.PATAH,
                Symbol.SEGOL, Symbol.TSERE, Symbol.HOLAM, Symbol.HOLAM_HASER, Symbol.SHURUQ)) {
            return next.setLetter(Symbol.EIM_QRIA_ALEF).setOpen(true);
        }
        return null;
    }

    private static Cluster he(RuleContext context) {
        Cluster next = nextNonEmpty(context);
        if (next.isBare(Symbol.HE) && context.guess().vowelIn(Symbol.QAMATS, Symbol.QAMATS_GADOL, Symbol.PATAH,
                Symbol.SEGOL, Symbol.TSERE, Symbol.HOLAM, Symbol.HOLAM_HASER)) {
            return next.setLetter(Symbol.EIM_QRIA_HE).setOpen(true);
        }
        return null;
    }

    private static Cluster yod(RuleContext context) {
        Cluster next = context.nextGuess();
        if (next.isBare(Symbol.YOD) && context.guess().vowelIn(Symbol.HIRIQ, Symbol.SEGOL, Symbol.TSERE)) {
            return next.setLetter(Symbol.EIM_QRIA_YOD).setOpen(true);
        }
        return null;
    }

    private static boolean isShuruqVav(Cluster cluster) {
        return cluster.letterIn(Symbol.VAV) && cluster.hasDagesh() && !cluster.hasVowel();
    }

    // skips a vav already absorbed into holam-male or shuruq
    private static Cluster nextNonEmpty(RuleContext context) {
        Cluster next = context.nextGuess();
        return next.isEmpty() ? context.nextGuess2() : next;
    }
}
