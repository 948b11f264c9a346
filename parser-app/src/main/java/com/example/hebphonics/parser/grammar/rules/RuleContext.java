package com.example.hebphonics.parser.grammar.rules;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.grammar.Token;
import com.example.hebphonics.parser.tokens.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything a rule may read about the position it is applied to. The cluster list is shared
 * with the engine, so rules reach neighbours by index and may rewrite them.
 */
public final class RuleContext {

    private final List<Token> tokens;
    private final List<Cluster> clusters;
    private final int index;
    private final Cluster previous;
    private final Symbol lastVowel;
    private final boolean hasAccents;
    private final boolean hasMaqaf;

    RuleContext(List<Token> tokens,
                List<Cluster> clusters,
                int index,
                Cluster previous,
                Symbol lastVowel,
                boolean hasAccents,
                boolean hasMaqaf) {
        this.tokens = tokens;
        this.clusters = clusters;
        this.index = index;
        this.previous = previous;
        this.lastVowel = lastVowel;
        this.hasAccents = hasAccents;
        this.hasMaqaf = hasMaqaf;
    }

    public int index() {
        return index;
    }

    /**
     * Distance from the last position; {@code 0} on the last letter.
     */
    public int negIndex() {
        return clusters.size() - 1 - index;
    }

    public boolean isFirst() {
        return index == 0;
    }

    public boolean isLast() {
        return index == clusters.size() - 1;
    }

    /** Whether any letter of the word carries an accent or a meteg. */
    public boolean hasAccents() {
        return hasAccents;
    }

    public boolean hasMaqaf() {
        return hasMaqaf;
    }

    /**
     * The last non-empty cluster visited before this position in the current pass, or an empty
     * cluster at the start of the word.
     */
    public Cluster prev() {
        return previous;
    }

    /**
     * Vowel of {@link #prev()}, or of the cluster before it when {@code prev} has none.
     */
    public Symbol lastVowel() {
        return lastVowel;
    }

    public Token token() {
        return tokens.get(index);
    }

    public Token prevToken() {
        return index > 0 ? tokens.get(index - 1) : Token.EMPTY;
    }

    public Token nextToken() {
        return tokenAt(index + 1);
    }

    public Cluster guess() {
        return clusters.get(index);
    }

    public Cluster nextGuess() {
        return clusterAt(index + 1);
    }

    public Cluster nextGuess2() {
        return clusterAt(index + 2);
    }

    /**
     * Cluster at an absolute position or a detached empty cluster outside the word.
     */
    public Cluster clusterAt(int position) {
        return position >= 0 && position < clusters.size() ? clusters.get(position) : Cluster.empty();
    }

    public Token tokenAt(int position) {
        return position >= 0 && position < tokens.size() ? tokens.get(position) : Token.EMPTY;
    }

    public int size() {
        return clusters.size();
    }

    /**
     * Accents of all letters before this position, in order.
     */
    public List<String> accentsBefore() {
        List<String> accents = new ArrayList<>();
        for (int i = 0; i < index; i++) {
            accents.addAll(tokens.get(i).accents());
        }
        return Collections.unmodifiableList(accents);
    }

    /**
     * Tests the pattern against the clusters starting at {@code start}.
     */
    public boolean matchesAt(int start, ClusterPattern pattern) {
        return pattern.matchesAt(clusters, start);
    }

    /**
     * Tests whether the word ends in the pattern followed by {@code extra} unchecked clusters and
     * this position is the first cluster of that ending.
     */
    public boolean endsWith(ClusterPattern pattern, int extra) {
        return pattern.matchesEnding(clusters, negIndex(), extra);
    }

    public boolean endsWith(ClusterPattern pattern) {
        return endsWith(pattern, 0);
    }
}
