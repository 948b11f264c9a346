package com.example.hebphonics.parser.grammar;

import com.example.hebphonics.parser.grammar.rules.RuleBook;
import com.example.hebphonics.parser.grammar.rules.RuleEngine;
import com.example.hebphonics.parser.tokens.CodePoints;
import com.example.hebphonics.parser.tokens.Symbol;
import com.example.hebphonics.parser.tokens.SymbolTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the grammar core: lexes a word, guesses each letter, runs the rule stages and
 * splits the result into syllables.
 *
 * <p>Instances are immutable. The rule table is compiled once in the constructor, so a single
 * parser can be shared between threads.</p>
 */
public final class HebrewParser {

    private static final Logger LOG = LogManager.getLogger(HebrewParser.class);

    private final RuleSettings settings;
    private final RuleEngine engine;
    private final Syllabifier syllabifier;

    public HebrewParser() {
        this(RuleSettings.defaults());
    }

    public HebrewParser(RuleSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.engine = RuleEngine.compile(RuleBook.catalog(), settings::isActive);
        this.syllabifier = new Syllabifier(settings);
        LOG.debug("Compiled {} rules, disabled {}", RuleBook.catalog().size(), settings.disabled());
    }

    public RuleSettings settings() {
        return settings;
    }

    public String normalize(String word) {
        return CodePoints.normalize(Objects.requireNonNull(word, "word"));
    }

    /**
     * Normalises the word and groups its code points into tokens.
     *
     * @throws LexException when the word contains an unrecognised code point or a mark before
     *                      its first letter
     */
    public List<Token> lex(String word) {
        return Lexer.lex(normalize(word));
    }

    public Cluster guess(Token token) {
        return InitialGuesser.guess(token);
    }

    /**
     * Parses a word into frozen clusters, one per letter. Clusters emptied by a rule keep their
     * position.
     *
     * @throws LexException when the word cannot be lexed
     */
    public List<Cluster> parse(String word) {
        List<Token> tokens = lex(word);
        List<Cluster> clusters = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            clusters.add(guess(token));
        }
        engine.apply(tokens, clusters);
        for (Cluster cluster : clusters) {
            cluster.freeze();
        }
        return Collections.unmodifiableList(clusters);
    }

    public List<List<Symbol>> syllabify(List<Cluster> clusters) {
        return syllabify(clusters, false);
    }

    /**
     * @param strict when {@code true}, a letter after a hataf vowel stays in the hataf's syllable
     */
    public List<List<Symbol>> syllabify(List<Cluster> clusters, boolean strict) {
        return syllabifier.syllabify(clusters, strict);
    }

    public int syllableCount(List<Cluster> clusters) {
        return syllabify(clusters).size();
    }

    /**
     * Letter, dagesh and vowel symbols of all clusters in order, skipping empty ones.
     */
    public static List<Symbol> flatten(List<Cluster> clusters) {
        Objects.requireNonNull(clusters, "clusters");
        List<Symbol> symbols = new ArrayList<>();
        for (Cluster cluster : clusters) {
            symbols.addAll(cluster.items());
        }
        return Collections.unmodifiableList(symbols);
    }

    public static List<String> ruleTrace(List<Cluster> clusters) {
        Objects.requireNonNull(clusters, "clusters");
        List<String> rules = new ArrayList<>();
        for (Cluster cluster : clusters) {
            rules.addAll(cluster.rules());
        }
        return Collections.unmodifiableList(rules);
    }

    public static String render(List<Cluster> clusters) {
        return SymbolTable.render(flatten(clusters));
    }
}
