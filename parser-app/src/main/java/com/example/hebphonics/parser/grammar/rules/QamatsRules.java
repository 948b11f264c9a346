package com.example.hebphonics.parser.grammar.rules;

import static com.example.hebphonics.parser.grammar.rules.ClusterPattern.slot;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.grammar.Token;
import com.example.hebphonics.parser.tokens.CodePoints;
import com.example.hebphonics.parser.tokens.Symbol;
import com.example.hebphonics.parser.tokens.SymbolTable;

import java.util.List;

/**
 * Decides between qamats-gadol (long "a") and qamats-qatan (short "o").
 *
 * <p>The first pass uses local evidence: doubling, vowel letters, an open syllable and accents.
 * The second pass, after the sheva stage, uses the resolved sheva of the next letter. A qamats
 * that neither pass can decide stays plain {@code qamats}.</p>
 */
final class QamatsRules {

    private static final ClusterPattern BEFORE_SHEVA_NA = ClusterPattern.of(
            slot().vowel(Symbol.QAMATS),
            slot().noDagesh().vowel(Symbol.SHEVA_NA));

    private QamatsRules() {
    }

    static List<Rule> rules() {
        return List.of(
                Rule.of(Stage.QAMATS, "qamats-gadol-dagesh-hazaq", QamatsRules::gadolDageshHazaq),
                Rule.of(Stage.QAMATS, "qamats-gadol-yod-glide", QamatsRules::gadolYodGlide),
                Rule.of(Stage.QAMATS, "qamats-gadol-mapiq-he", QamatsRules::gadolMapiqHe),
                Rule.of(Stage.QAMATS, "qamats-gadol-eim-qria", QamatsRules::gadolEimQria),
                Rule.of(Stage.QAMATS, "qamats-gadol-vowel", QamatsRules::gadolVowel),
                Rule.of(Stage.QAMATS, "qamats-gadol-meteg", QamatsRules::gadolMeteg),
                Rule.of(Stage.QAMATS, "qamats-gadol-accent", QamatsRules::gadolAccent),
                Rule.of(Stage.QAMATS, "qamats-gadol-next-accent", QamatsRules::gadolNextAccent),
                Rule.of(Stage.QAMATS, "qamats-gadol-telisha-gedola", QamatsRules::gadolTelishaGedola),
                Rule.of(Stage.QAMATS, "qamats-qatan-in-maqaf", QamatsRules::qatanInMaqaf),
                Rule.of(Stage.QAMATS, "qamats-qatan-closed-unaccented", QamatsRules::qatanClosedUnaccented),
                Rule.of(Stage.QAMATS, "qamats-qatan-before-dagesh-sheva", QamatsRules::qatanBeforeDageshSheva),
                Rule.optIn(Stage.QAMATS, "qamats-qatan-before-hataf-qamats", QamatsRules::qatanBeforeHatafQamats),
                // needs the stress position of the word
                Rule.unimplemented(Stage.QAMATS, "qamats-qatan-unstressed-closed"),
                // needs to know whether be- or le- is a prefix of the root
                Rule.unimplemented(Stage.QAMATS, "qamats-qatan-be-le-prefix"),
                Rule.of(Stage.QAMATS2, "qamats-gadol-before-sheva-na", QamatsRules::gadolBeforeShevaNa),
                Rule.of(Stage.QAMATS2, "qamats-qatan-before-sheva-nah", QamatsRules::qatanBeforeShevaNah));
    }

    private static Cluster gadolDageshHazaq(RuleContext context) {
        Cluster guess = context.guess();
        if (guess.dagesh() == Symbol.DAGESH_HAZAQ && isQamats(guess)) {
            return gadol(guess);
        }
        return null;
    }

    private static Cluster gadolYodGlide(RuleContext context) {
        Cluster guess = context.guess();
        if (isQamats(guess) && context.nextGuess().letter() == Symbol.YOD_GLIDE) {
            return gadol(guess);
        }
        return null;
    }

    private static Cluster gadolMapiqHe(RuleContext context) {
        Cluster guess = context.guess();
        Cluster next = context.nextGuess();
        if (isQamats(guess) && next.letter() == Symbol.MAPIQ_HE && !next.hasVowel()) {
            return gadol(guess);
        }
        return null;
    }

    private static Cluster gadolEimQria(RuleContext context) {
        Cluster guess = context.guess();
        if (isQamats(guess) && context.nextGuess().letterIn(Symbol.EIM_QRIA_ALEF, Symbol.EIM_QRIA_HE, Symbol.EIM_QRIA_YOD)) {
            return gadol(guess);
        }
        return null;
    }

    /** A qamats at the end of the word or right before another vowel is in an open syllable. */
    private static Cluster gadolVowel(RuleContext context) {
        Cluster guess = context.guess();
        if (isQamats(guess) && (context.isLast() || SymbolTable.isVowel(context.nextGuess().vowel()))) {
            return gadol(guess);
        }
        return null;
    }

    private static Cluster gadolMeteg(RuleContext context) {
        Cluster guess = context.guess();
        if (context.hasAccents() && isQamats(guess) && context.token().hasPoint(CodePoints.POINT_METEG)) {
            return gadol(guess);
        }
        return null;
    }

    private static Cluster gadolAccent(RuleContext context) {
        Cluster guess = context.guess();
        if (context.hasAccents() && isQamats(guess) && context.token().hasAccents()) {
            return gadol(guess);
        }
        return null;
    }

    /** The syllable is closed by a letter carrying the first accent of the word. */
    private static Cluster gadolNextAccent(RuleContext context) {
        Cluster guess = context.guess();
        if (context.hasAccents()
                && isQamats(guess)
                && !SymbolTable.isVowel(context.nextGuess().vowel())
                && context.nextToken().hasAccents()
                && context.accentsBefore().isEmpty()) {
            return gadol(guess);
        }
        return null;
    }

    /** Telisha gedola is prepositive: it sits on the first letter but marks a later one. */
    private static Cluster gadolTelishaGedola(RuleContext context) {
        Cluster guess = context.guess();
        if (context.hasAccents() && isQamats(guess) && hasTelishaGedolaBefore(context)) {
            return gadol(guess);
        }
        return null;
    }

    /** A word joined by maqaf is unaccented. */
    private static Cluster qatanInMaqaf(RuleContext context) {
        Cluster guess = context.guess();
        if (isQamats(guess)
                && context.hasMaqaf()
                && (!guess.isOpen() || !context.nextGuess().isOpen())
                && !context.token().hasPoint(CodePoints.POINT_METEG)) {
            return qatan(guess);
        }
        return null;
    }

    private static Cluster qatanClosedUnaccented(RuleContext context) {
        Cluster guess = context.guess();
        Cluster next = context.nextGuess();
        Token token = context.token();
        boolean closed = !context.isLast() && !next.isOpen() && (next.vowel() == null || next.vowel() == Symbol.SHEVA_NAH);
        boolean unaccented = !token.hasPoint(CodePoints.POINT_METEG)
                && !token.hasAccents()
                && !hasTelishaGedolaBefore(context);
        if (context.hasAccents() && isQamats(guess) && unaccented && closed) {
            return qatan(guess);
        }
        return null;
    }

    /** The dagesh doubles the next letter, which closes this syllable. */
    private static Cluster qatanBeforeDageshSheva(RuleContext context) {
        Cluster guess = context.guess();
        Cluster next = context.nextGuess();
        Token token = context.token();
        if (isQamats(guess)
                && !token.hasPoint(CodePoints.POINT_METEG)
                && !token.hasAccents()
                && next.hasDagesh()
                && next.vowel() == Symbol.SHEVA) {
            return qatan(guess);
        }
        return null;
    }

    private static Cluster qatanBeforeHatafQamats(RuleContext context) {
        Cluster guess = context.guess();
        if (isQamats(guess)
                && !context.token().hasPoint(CodePoints.POINT_METEG)
                && context.nextGuess().vowel() == Symbol.HATAF_QAMATS) {
            return qatan(guess);
        }
        return null;
    }

    private static Cluster gadolBeforeShevaNa(RuleContext context) {
        if (context.matchesAt(context.index(), BEFORE_SHEVA_NA)) {
            return gadol(context.guess());
        }
        return null;
    }

    private static Cluster qatanBeforeShevaNah(RuleContext context) {
        Cluster guess = context.guess();
        if (isQamats(guess) && context.nextGuess().vowelBelongsTo(Symbol.SHEVA_NAH)) {
            return qatan(guess);
        }
        return null;
    }

    private static boolean isQamats(Cluster guess) {
        return guess.vowel() == Symbol.QAMATS;
    }

    private static boolean hasTelishaGedolaBefore(RuleContext context) {
        return context.accentsBefore().contains(String.valueOf(CodePoints.ACCENT_TELISHA_GEDOLA));
    }

    private static Cluster gadol(Cluster guess) {
        return guess.setVowel(Symbol.QAMATS_GADOL);
    }

    private static Cluster qatan(Cluster guess) {
        return guess.setVowel(Symbol.QAMATS_QATAN);
    }
}
