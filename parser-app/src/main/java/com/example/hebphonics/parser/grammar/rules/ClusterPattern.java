package com.example.hebphonics.parser.grammar.rules;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.tokens.Symbol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed-length sequence of per-cluster constraints, used for the word-ending exceptions.
 */
public final class ClusterPattern {

    private final List<Slot> slots;

    private ClusterPattern(List<Slot> slots) {
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
    }

    public static ClusterPattern of(Slot... slots) {
        if (slots.length == 0) {
            throw new IllegalArgumentException("Pattern must have at least one slot");
        }
        return new ClusterPattern(Arrays.asList(slots));
    }

    /**
     * Starts a slot that accepts any cluster; narrow it with the fluent methods.
     */
    public static Slot slot() {
        return new Slot();
    }

    public int size() {
        return slots.size();
    }

    boolean matchesAt(List<Cluster> clusters, int start) {
        if (start < 0 || start + slots.size() > clusters.size()) {
            return false;
        }
        for (int i = 0; i < slots.size(); i++) {
            if (!slots.get(i).matches(clusters.get(start + i))) {
                return false;
            }
        }
        return true;
    }

    boolean matchesEnding(List<Cluster> clusters, int negIndex, int extra) {
        int length = slots.size() + extra;
        if (negIndex != length - 1) {
            return false;
        }
        return matchesAt(clusters, clusters.size() - length);
    }

    @Override
    public String toString() {
        return slots.toString();
    }

    /**
     * Constraint on one cluster. Unset attributes match anything.
     */
    public static final class Slot {
        private Set<Symbol> letters;
        private Set<Symbol> vowels;
        private Boolean dagesh;

        private Slot() {
        }

        public Slot letter(Symbol first, Symbol... rest) {
            this.letters = EnumSet.of(first, rest);
            return this;
        }

        public Slot vowel(Symbol first, Symbol... rest) {
            this.vowels = EnumSet.of(first, rest);
            return this;
        }

        public Slot noDagesh() {
            this.dagesh = Boolean.FALSE;
            return this;
        }

        boolean matches(Cluster cluster) {
            Objects.requireNonNull(cluster, "cluster");
            if (letters != null && !letters.contains(cluster.letter())) {
                return false;
            }
            if (vowels != null && !vowels.contains(cluster.vowel())) {
                return false;
            }
            return dagesh == null || dagesh == cluster.hasDagesh();
        }

        @Override
        public String toString() {
            return "{letter=" + letters + ", dagesh=" + dagesh + ", vowel=" + vowels + '}';
        }
    }
}
