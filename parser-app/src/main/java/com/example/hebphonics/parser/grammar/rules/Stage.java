package com.example.hebphonics.parser.grammar.rules;

/**
 * Named passes of the rule engine in execution order. Every stage is a complete left to right
 * pass over the clusters, so a stage sees the results of all earlier stages.
 */
public enum Stage {
    /** A vav absorbed into shuruq or holam-male. */
    VAV("vav"),
    DAGESH("dagesh"),
    /** Bare letters absorbed into the preceding long vowel. */
    EIM_QRIA("eim-qria"),
    VOWEL("vowel"),
    QAMATS("qamats"),
    SHEVA("sheva"),
    /** Modern pronunciation notes; these only add trace entries. */
    SHEVA2("sheva2"),
    /** Qamats decisions that depend on the resolved sheva. */
    QAMATS2("qamats2");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
