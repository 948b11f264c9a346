package com.example.hebphonics.parser.grammar.rules;

import com.example.hebphonics.parser.grammar.Cluster;

import java.util.Objects;

/**
 * A named predicate and rewrite applied at one cluster position.
 */
public final class Rule {

    /**
     * Rewrite step of a rule. Returns the cluster that was modified, which receives the rule's
     * name in its trace, or {@code null} when the rule does not apply.
     */
    @FunctionalInterface
    public interface Action {
        Cluster apply(RuleContext context);
    }

    /**
     * How a rule takes part in parsing when the settings do not mention it.
     */
    public enum Availability {
        /** Runs unless disabled. */
        DEFAULT,
        /** Runs only when enabled. */
        OPT_IN,
        /** Named but never applied. */
        UNIMPLEMENTED
    }

    private static final Action NEVER = context -> null;

    private final Stage stage;
    private final String name;
    private final Availability availability;
    private final Action action;

    private Rule(Stage stage, String name, Availability availability, Action action) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.name = Objects.requireNonNull(name, "name");
        this.availability = Objects.requireNonNull(availability, "availability");
        this.action = Objects.requireNonNull(action, "action");
    }

    public static Rule of(Stage stage, String name, Action action) {
        return new Rule(stage, name, Availability.DEFAULT, action);
    }

    public static Rule optIn(Stage stage, String name, Action action) {
        return new Rule(stage, name, Availability.OPT_IN, action);
    }

    public static Rule unimplemented(Stage stage, String name) {
        return new Rule(stage, name, Availability.UNIMPLEMENTED, NEVER);
    }

    public Stage stage() {
        return stage;
    }

    public String name() {
        return name;
    }

    public Availability availability() {
        return availability;
    }

    /**
     * Applies the rule and records its name on the modified cluster.
     *
     * @return {@code true} when the rule fired
     */
    boolean fire(RuleContext context) {
        Cluster modified = action.apply(context);
        if (modified == null) {
            return false;
        }
        modified.recordRule(name);
        return true;
    }

    @Override
    public String toString() {
        return stage + ":" + name;
    }
}
