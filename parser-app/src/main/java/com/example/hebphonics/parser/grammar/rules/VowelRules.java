package com.example.hebphonics.parser.grammar.rules;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.tokens.Symbol;

import java.util.List;

/**
 * General vowel rules: the default holam, patah-genuvah and yod glides.
 */
final class VowelRules {

    private VowelRules() {
    }

    static List<Rule> rules() {
        return List.of(
                Rule.of(Stage.VOWEL, "vowel-holam-haser-default", VowelRules::holamHaserDefault),
                Rule.of(Stage.VOWEL, "vowel-patah-genuvah", VowelRules::patahGenuvah),
                Rule.of(Stage.VOWEL, "glide-av", VowelRules::glideAv),
                Rule.of(Stage.VOWEL, "glide-ai-qamats", context -> glideAfter(context, Symbol.QAMATS)),
                Rule.of(Stage.VOWEL, "glide-ai-patah", context -> glideAfter(context, Symbol.PATAH)),
                Rule.of(Stage.VOWEL, "glide-aiy", VowelRules::glideAiy),
                Rule.of(Stage.VOWEL, "glide-oy", VowelRules::glideOy),
                Rule.of(Stage.VOWEL, "glide-uy", VowelRules::glideUy));
    }

    private static Cluster holamHaserDefault(RuleContext context) {
        Cluster guess = context.guess();
        if (guess.vowel() == Symbol.HOLAM) {
            return guess.setVowel(Symbol.HOLAM_HASER).setOpen(true);
        }
        return null;
    }

    /** Furtive patah is pronounced before its final guttural, so the syllable is closed. */
    private static Cluster patahGenuvah(RuleContext context) {
        Cluster guess = context.guess();
        if (context.isLast() && guess.letterIn(Symbol.HET, Symbol.AYIN, Symbol.MAPIQ_HE)
                && guess.vowel() == Symbol.PATAH) {
            return guess.setVowel(Symbol.PATAH_GENUVAH).setOpen(false);
        }
        return null;
    }

    private static Cluster glideAv(RuleContext context) {
        Cluster next = context.nextGuess();
        if (context.guess().vowelIn(Symbol.QAMATS, Symbol.QAMATS_GADOL)
                && next.isBare(Symbol.YOD) && context.nextGuess2().isBare(Symbol.VAV)) {
            return glide(next);
        }
        return null;
    }

    private static Cluster glideAfter(RuleContext context, Symbol vowel) {
        Cluster next = context.nextGuess();
        if (context.guess().vowel() == vowel && next.isBare(Symbol.YOD)) {
            return glide(next);
        }
        return null;
    }

    private static Cluster glideAiy(RuleContext context) {
        Cluster next = context.nextGuess();
        if (context.guess().vowel() == Symbol.PATAH && next.letterIn(Symbol.YOD) && next.vowel() == Symbol.HIRIQ) {
            return glide(next);
        }
        return null;
    }

    private static Cluster glideOy(RuleContext context) {
        Cluster next2 = context.nextGuess2();
        if (context.guess().vowel() == Symbol.HOLAM_MALE_VAV && next2.isBare(Symbol.YOD)) {
            return glide(next2);
        }
        return null;
    }

    private static Cluster glideUy(RuleContext context) {
        Cluster next2 = context.nextGuess2();
        if (context.index() >= 1 && context.guess().vowel() == Symbol.SHURUQ && next2.isBare(Symbol.YOD)) {
            return glide(next2);
        }
        return null;
    }

    private static Cluster glide(Cluster yod) {
        return yod.setLetter(Symbol.YOD_GLIDE).setOpen(true);
    }
}
