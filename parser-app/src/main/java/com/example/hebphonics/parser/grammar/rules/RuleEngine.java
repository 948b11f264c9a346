package com.example.hebphonics.parser.grammar.rules;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.grammar.Token;
import com.example.hebphonics.parser.tokens.CodePoints;
import com.example.hebphonics.parser.tokens.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Runs the compiled rule table over a word. The table is built once and never changes, so one
 * engine may serve any number of threads; all per-word state lives in the cluster list.
 */
public final class RuleEngine {

    private static final Logger LOG = LogManager.getLogger(RuleEngine.class);

    private final Map<Stage, List<Rule>> stages;

    private RuleEngine(Map<Stage, List<Rule>> stages) {
        this.stages = stages;
    }

    /**
     * Compiles the active rules of the catalog, keeping their declared order within each stage.
     *
     * @param catalog all known rules
     * @param active  decides whether a rule takes part in parsing
     */
    public static RuleEngine compile(List<Rule> catalog, Predicate<Rule> active) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(active, "active");
        Map<Stage, List<Rule>> compiled = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.values()) {
            compiled.put(stage, new ArrayList<>());
        }
        for (Rule rule : catalog) {
            if (rule.availability() != Rule.Availability.UNIMPLEMENTED && active.test(rule)) {
                compiled.get(rule.stage()).add(rule);
            }
        }
        for (Map.Entry<Stage, List<Rule>> entry : compiled.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
            LOG.debug("Stage {} compiled with {} rules", entry.getKey(), entry.getValue().size());
        }
        return new RuleEngine(Collections.unmodifiableMap(compiled));
    }

    public List<Rule> rules(Stage stage) {
        return stages.get(stage);
    }

    /**
     * Applies every stage in order. {@code clusters} must be index-aligned with {@code tokens}
     * and is rewritten in place.
     */
    public void apply(List<Token> tokens, List<Cluster> clusters) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(clusters, "clusters");
        if (tokens.size() != clusters.size()) {
            throw new IllegalArgumentException("Expected " + tokens.size() + " clusters but got " + clusters.size());
        }
        boolean hasAccents = false;
        boolean hasMaqaf = false;
        for (Token token : tokens) {
            hasAccents |= token.hasAccents() || token.hasPoint(CodePoints.POINT_METEG);
            hasMaqaf |= token.hasPunctuation(CodePoints.PUNCTUATION_MAQAF);
        }
        for (Stage stage : Stage.values()) {
            List<Rule> rules = stages.get(stage);
            if (!rules.isEmpty()) {
                applyStage(rules, tokens, clusters, hasAccents, hasMaqaf);
            }
        }
    }

    private static void applyStage(List<Rule> rules,
                                   List<Token> tokens,
                                   List<Cluster> clusters,
                                   boolean hasAccents,
                                   boolean hasMaqaf) {
        Cluster prev2 = Cluster.empty();
        Cluster prev1 = Cluster.empty();
        for (int index = 0; index < clusters.size(); index++) {
            Cluster guess = clusters.get(index);
            if (guess.isEmpty()) {
                continue;
            }
            for (Rule rule : rules) {
                // recomputed per rule: an earlier rule at this position may have rewritten prev
                Symbol lastVowel = prev1.vowel() != null ? prev1.vowel() : prev2.vowel();
                RuleContext context = new RuleContext(tokens, clusters, index, prev1, lastVowel, hasAccents, hasMaqaf);
                if (rule.fire(context)) {
                    break;
                }
            }
            prev2 = prev1;
            prev1 = guess;
        }
    }
}
