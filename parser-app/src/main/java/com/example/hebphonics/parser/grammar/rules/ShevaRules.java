package com.example.hebphonics.parser.grammar.rules;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.grammar.Token;
import com.example.hebphonics.parser.tokens.CodePoints;
import com.example.hebphonics.parser.tokens.NiqqudType;
import com.example.hebphonics.parser.tokens.Symbol;
import com.example.hebphonics.parser.tokens.SymbolTable;

import java.util.List;

/**
 * Positional sheva rules: sheva-na (vocal) versus sheva-nah (silent), decided from the position
 * in the word, the neighbouring sheva and the type of the preceding vowel.
 */
final class ShevaRules {

    private ShevaRules() {
    }

    static List<Rule> rules() {
        return List.of(
                Rule.of(Stage.SHEVA, "sheva-gaya", ShevaRules::gaya),
                Rule.of(Stage.SHEVA, "sheva-merahef", ShevaRules::merahef),
                Rule.optIn(Stage.SHEVA, "sheva-na-after-meteg", ShevaRules::naAfterMeteg),
                Rule.of(Stage.SHEVA, "sheva-na-start", ShevaRules::naStart),
                Rule.of(Stage.SHEVA, "sheva-nah-end", ShevaRules::nahEnd),
                Rule.of(Stage.SHEVA, "sheva-nah-alef-end", ShevaRules::nahAlefEnd),
                Rule.of(Stage.SHEVA, "sheva-double-end", ShevaRules::doubleEnd),
                Rule.of(Stage.SHEVA, "sheva-na-double-letter", ShevaRules::naDoubleLetter),
                Rule.of(Stage.SHEVA, "sheva-double-middle", ShevaRules::doubleMiddle),
                Rule.of(Stage.SHEVA, "sheva-na-dagesh-hazaq", ShevaRules::naDageshHazaq),
                Rule.optIn(Stage.SHEVA, "sheva-nah-yod-after-he", ShevaRules::nahYodAfterHe),
                Rule.of(Stage.SHEVA, "sheva-nah-after-shuruq-start", ShevaRules::nahAfterShuruqStart),
                Rule.of(Stage.SHEVA, "sheva-nah-after-short-vowel", ShevaRules::nahAfterShortVowel),
                Rule.of(Stage.SHEVA, "sheva-nah-after-accent", ShevaRules::nahAfterAccent),
                Rule.of(Stage.SHEVA, "sheva-nah-before-bgdkft-dagesh", ShevaRules::nahBeforeBgdkftDagesh),
                Rule.of(Stage.SHEVA, "sheva-na-after-long-vowel", ShevaRules::naAfterLongVowel));
    }

    private static Cluster gaya(RuleContext context) {
        Cluster guess = context.guess();
        if (isSheva(guess) && context.token().hasPoint(CodePoints.POINT_METEG)) {
            return guess.setVowel(Symbol.SHEVA_GAYA);
        }
        return null;
    }

    /**
     * Between a short vowel and a soft BGDKFT letter. The following letter keeps its soft
     * pronunciation even though the sheva does not open a syllable.
     */
    private static Cluster merahef(RuleContext context) {
        Cluster guess = context.guess();
        Token next = context.nextToken();
        if (isSheva(guess) && !guess.hasDagesh()
                && isShortOrHataf(context.lastVowel())
                && SymbolTable.isBegedkefet(next.baseLetter()) && !next.hasDagesh()
                && !next.vowel().equals(String.valueOf(CodePoints.POINT_SHEVA))) {
            return guess.setVowel(Symbol.SHEVA_MERAHEF).setOpen(false);
        }
        return null;
    }

    private static Cluster naAfterMeteg(RuleContext context) {
        Cluster next = context.nextGuess();
        if (context.token().hasPoint(CodePoints.POINT_METEG) && next.vowel() == Symbol.SHEVA) {
            return next.setVowel(Symbol.SHEVA_NA);
        }
        return null;
    }

    private static Cluster naStart(RuleContext context) {
        Cluster guess = context.guess();
        if (context.isFirst() && isSheva(guess)) {
            return guess.setVowel(Symbol.SHEVA_NA);
        }
        return null;
    }

    private static Cluster nahEnd(RuleContext context) {
        Cluster guess = context.guess();
        if (context.isLast() && isSheva(guess)) {
            return guess.setVowel(Symbol.SHEVA_NAH).setOpen(false);
        }
        return null;
    }

    private static Cluster nahAlefEnd(RuleContext context) {
        Cluster guess = context.guess();
        Cluster next = context.nextGuess();
        if (context.negIndex() == 1 && isSheva(guess) && next.isBare(Symbol.ALEF)) {
            next.setOpen(false);
            return guess.setVowel(Symbol.SHEVA_NAH);
        }
        return null;
    }

    private static Cluster doubleEnd(RuleContext context) {
        Cluster guess = context.guess();
        Cluster next = context.nextGuess();
        if (context.negIndex() == 1 && isSheva(guess) && next.vowel() == Symbol.SHEVA) {
            next.setVowel(Symbol.SHEVA_NAH).setOpen(false);
            return guess.setVowel(Symbol.SHEVA_NAH).setOpen(false);
        }
        return null;
    }

    private static Cluster naDoubleLetter(RuleContext context) {
        Cluster guess = context.guess();
        Cluster next = context.nextGuess();
        if (isSheva(guess) && guess.letter() == next.letter() && !next.vowelBelongsTo(Symbol.SHEVA)) {
            return guess.setVowel(Symbol.SHEVA_NA);
        }
        return null;
    }

    /** In a run of two shevas inside the word the first is silent and the second vocal. */
    private static Cluster doubleMiddle(RuleContext context) {
        Cluster guess = context.guess();
        Cluster next = context.nextGuess();
        if (context.negIndex() > 1
                && guess.vowelIn(Symbol.SHEVA, Symbol.SHEVA_MERAHEF)
                && next.vowel() == Symbol.SHEVA) {
            next.setVowel(Symbol.SHEVA_NA);
            return guess.setVowel(Symbol.SHEVA_NAH).setOpen(false);
        }
        return null;
    }

    private static Cluster naDageshHazaq(RuleContext context) {
        Cluster guess = context.guess();
        if (isSheva(guess) && guess.dagesh() == Symbol.DAGESH_HAZAQ) {
            return guess.setVowel(Symbol.SHEVA_NA);
        }
        return null;
    }

    private static Cluster nahYodAfterHe(RuleContext context) {
        Cluster guess = context.guess();
        if (guess.letterIn(Symbol.YOD) && !guess.hasDagesh() && isSheva(guess)
                && context.prev().letter() == Symbol.HE) {
            return guess.setVowel(Symbol.SHEVA_NAH);
        }
        return null;
    }

    private static Cluster nahAfterShuruqStart(RuleContext context) {
        Cluster guess = context.guess();
        if (context.index() == 1
                && context.prev().vowel() == Symbol.SHURUQ
                && isSheva(guess) && !guess.hasDagesh()) {
            return guess.setVowel(Symbol.SHEVA_NAH).setOpen(false);
        }
        return null;
    }

    private static Cluster nahAfterShortVowel(RuleContext context) {
        Cluster guess = context.guess();
        if (isSheva(guess) && isShortOrHataf(context.lastVowel())) {
            return guess.setVowel(Symbol.SHEVA_NAH).setOpen(false);
        }
        return null;
    }

    // munah is a conjunctive accent and does not mark stress here
    private static Cluster nahAfterAccent(RuleContext context) {
        Cluster guess = context.guess();
        Token prevToken = context.prevToken();
        if (context.hasAccents() && isSheva(guess)
                && prevToken.hasAccents() && !prevToken.hasAccent(CodePoints.ACCENT_MUNAH)) {
            return guess.setVowel(Symbol.SHEVA_NAH).setOpen(false);
        }
        return null;
    }

    /** BGDKFT letters take a dagesh-qal inside a word only after a silent sheva. */
    private static Cluster nahBeforeBgdkftDagesh(RuleContext context) {
        Cluster guess = context.guess();
        Token next = context.nextToken();
        if (isSheva(guess) && SymbolTable.isBegedkefet(next.baseLetter()) && next.hasDagesh()) {
            return guess.setVowel(Symbol.SHEVA_NAH);
        }
        return null;
    }

    // a plain qamats is still unclassified at this point
    private static Cluster naAfterLongVowel(RuleContext context) {
        Cluster guess = context.guess();
        if (isSheva(guess)
                && SymbolTable.categoryOf(context.lastVowel()) == NiqqudType.LONG
                && context.prev().vowel() != Symbol.QAMATS) {
            return guess.setVowel(Symbol.SHEVA_NA);
        }
        return null;
    }

    private static boolean isSheva(Cluster guess) {
        return guess.vowel() == Symbol.SHEVA;
    }

    private static boolean isShortOrHataf(Symbol vowel) {
        NiqqudType type = SymbolTable.categoryOf(vowel);
        return type == NiqqudType.SHORT || type == NiqqudType.HATAF;
    }
}
