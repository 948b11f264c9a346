package com.example.hebphonics.parser.grammar;

import com.example.hebphonics.parser.tokens.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Grammatical reading of one {@link Token}: letter, dagesh and vowel symbols, whether the
 * syllable is still open, and the names of the rules that produced the reading.
 *
 * <p>Clusters are mutable while the rule engine runs. A rule may empty a cluster when its
 * letter turns out to be part of the previous vowel; the cluster keeps its position so that
 * clusters and tokens stay index-aligned. {@link #freeze()} makes a cluster read-only.</p>
 */
public final class Cluster {

    private Symbol letter;
    private Symbol dagesh;
    private Symbol vowel;
    private boolean open;
    private final List<String> rules = new ArrayList<>();
    private boolean frozen;

    public Cluster(Symbol letter, Symbol dagesh, Symbol vowel, boolean open) {
        this.letter = letter;
        this.dagesh = dagesh;
        this.vowel = vowel;
        this.open = open;
    }

    /**
     * Returns a new empty cluster, used for positions outside the word.
     */
    public static Cluster empty() {
        return new Cluster(null, null, null, false);
    }

    public Symbol letter() {
        return letter;
    }

    public Symbol dagesh() {
        return dagesh;
    }

    public Symbol vowel() {
        return vowel;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Names of the rules that changed this cluster, in the order they fired.
     */
    public List<String> rules() {
        return Collections.unmodifiableList(rules);
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Cluster setLetter(Symbol value) {
        checkMutable();
        this.letter = value;
        return this;
    }

    public Cluster setDagesh(Symbol value) {
        checkMutable();
        this.dagesh = value;
        return this;
    }

    public Cluster setVowel(Symbol value) {
        checkMutable();
        this.vowel = value;
        return this;
    }

    public Cluster setOpen(boolean value) {
        checkMutable();
        this.open = value;
        return this;
    }

    /**
     * Clears letter, dagesh, vowel and the rule trace.
     */
    public Cluster reset() {
        checkMutable();
        letter = null;
        dagesh = null;
        vowel = null;
        open = false;
        rules.clear();
        return this;
    }

    public void recordRule(String name) {
        checkMutable();
        rules.add(Objects.requireNonNull(name, "name"));
    }

    public void freeze() {
        frozen = true;
    }

    /**
     * A cluster is empty when it has no letter, dagesh or vowel, e.g. after a reset.
     */
    public boolean isEmpty() {
        return letter == null && dagesh == null && vowel == null;
    }

    public boolean hasDagesh() {
        return dagesh != null;
    }

    public boolean hasVowel() {
        return vowel != null;
    }

    public boolean letterIn(Symbol... candidates) {
        return contains(candidates, letter);
    }

    public boolean vowelIn(Symbol... candidates) {
        return contains(candidates, vowel);
    }

    /**
     * Returns {@code true} when the vowel's name starts with the family name, e.g. every
     * sheva variant belongs to {@code sheva}.
     */
    public boolean vowelBelongsTo(Symbol family) {
        return vowel != null && vowel.belongsTo(family);
    }

    /**
     * Returns {@code true} for a letter from {@code candidates} carrying neither dagesh nor vowel.
     */
    public boolean isBare(Symbol... candidates) {
        return dagesh == null && vowel == null && letterIn(candidates);
    }

    /**
     * Non-empty letter, dagesh and vowel symbols in that order.
     */
    public List<Symbol> items() {
        List<Symbol> items = new ArrayList<>(3);
        if (letter != null) {
            items.add(letter);
        }
        if (dagesh != null) {
            items.add(dagesh);
        }
        if (vowel != null) {
            items.add(vowel);
        }
        return items;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Cluster{");
        List<Symbol> items = items();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                builder.append(' ');
            }
            builder.append(items.get(i));
        }
        return builder.append(open ? ", open" : ", closed")
                .append(", rules=").append(rules)
                .append('}')
                .toString();
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Cluster is frozen: " + this);
        }
    }

    private static boolean contains(Symbol[] candidates, Symbol value) {
        if (value == null) {
            return false;
        }
        for (Symbol candidate : candidates) {
            if (candidate == value) {
                return true;
            }
        }
        return false;
    }
}
