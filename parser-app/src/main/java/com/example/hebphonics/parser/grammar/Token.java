package com.example.hebphonics.parser.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raw Unicode content attached to one letter of a word: the letter itself (with its shin or
 * sin dot), an optional dagesh, an optional vowel and the secondary points, accents and
 * punctuation that follow it. Tokens are immutable once the lexer has produced them.
 */
public final class Token {

    /** Placeholder used for positions before the first or after the last letter. */
    public static final Token EMPTY = new Token("", "", "", List.of(), List.of(), List.of());

    private final String letter;
    private final String dagesh;
    private final String vowel;
    private final List<String> points;
    private final List<String> accents;
    private final List<String> puncta;

    private Token(String letter,
                  String dagesh,
                  String vowel,
                  List<String> points,
                  List<String> accents,
                  List<String> puncta) {
        this.letter = Objects.requireNonNull(letter, "letter");
        this.dagesh = Objects.requireNonNull(dagesh, "dagesh");
        this.vowel = Objects.requireNonNull(vowel, "vowel");
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.accents = Collections.unmodifiableList(new ArrayList<>(accents));
        this.puncta = Collections.unmodifiableList(new ArrayList<>(puncta));
    }

    /**
     * Letter code point, followed by the shin or sin dot when present.
     */
    public String letter() {
        return letter;
    }

    /**
     * Base letter code point or {@code 0} for {@link #EMPTY}.
     */
    public char baseLetter() {
        return letter.isEmpty() ? 0 : letter.charAt(0);
    }

    public String dagesh() {
        return dagesh;
    }

    public String vowel() {
        return vowel;
    }

    public List<String> points() {
        return points;
    }

    public List<String> accents() {
        return accents;
    }

    public List<String> puncta() {
        return puncta;
    }

    public boolean hasDagesh() {
        return !dagesh.isEmpty();
    }

    public boolean hasVowel() {
        return !vowel.isEmpty();
    }

    public boolean hasVowel(char point) {
        return vowel.indexOf(point) >= 0;
    }

    public boolean hasPoint(char point) {
        return points.contains(String.valueOf(point));
    }

    public boolean hasAccents() {
        return !accents.isEmpty();
    }

    public boolean hasAccent(char accent) {
        return accents.contains(String.valueOf(accent));
    }

    public boolean hasPunctuation(char mark) {
        return puncta.contains(String.valueOf(mark));
    }

    public boolean isEmpty() {
        return letter.isEmpty() && dagesh.isEmpty() && vowel.isEmpty()
                && points.isEmpty() && accents.isEmpty() && puncta.isEmpty();
    }

    /**
     * Returns {@code true} when the letter carries neither a dagesh nor secondary points.
     * The vowel is not taken into account.
     */
    public boolean isBare() {
        return dagesh.isEmpty() && points.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Token)) {
            return false;
        }
        Token that = (Token) other;
        return letter.equals(that.letter)
                && dagesh.equals(that.dagesh)
                && vowel.equals(that.vowel)
                && points.equals(that.points)
                && accents.equals(that.accents)
                && puncta.equals(that.puncta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(letter, dagesh, vowel, points, accents, puncta);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(letter).append(dagesh).append(vowel);
        points.forEach(builder::append);
        accents.forEach(builder::append);
        puncta.forEach(builder::append);
        return builder.toString();
    }

    static Builder builder(String letter) {
        return new Builder(letter);
    }

    /**
     * Collects the code points of one letter while the lexer walks the word.
     */
    static final class Builder {
        private final StringBuilder letter;
        private String dagesh = "";
        private String vowel = "";
        private final List<String> points = new ArrayList<>();
        private final List<String> accents = new ArrayList<>();
        private final List<String> puncta = new ArrayList<>();

        private Builder(String letter) {
            this.letter = new StringBuilder(letter);
        }

        Builder appendToLetter(String dot) {
            letter.append(dot);
            return this;
        }

        Builder dagesh(String value) {
            this.dagesh = value;
            return this;
        }

        Builder vowel(String value) {
            this.vowel = value;
            return this;
        }

        Builder point(String value) {
            points.add(value);
            return this;
        }

        Builder accent(String value) {
            accents.add(value);
            return this;
        }

        Builder punctuation(String value) {
            puncta.add(value);
            return this;
        }

        Token build() {
            return new Token(letter.toString(), dagesh, vowel, points, accents, puncta);
        }
    }
}
