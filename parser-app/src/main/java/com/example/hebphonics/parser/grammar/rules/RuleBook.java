package com.example.hebphonics.parser.grammar.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The complete, statically built rule catalog in execution order.
 */
public final class RuleBook {

    private static final List<Rule> CATALOG;
    private static final Map<String, Rule> BY_NAME;

    static {
        List<Rule> rules = new ArrayList<>();
        rules.addAll(EimQriaRules.rules());
        rules.addAll(DageshRules.rules());
        rules.addAll(VowelRules.rules());
        rules.addAll(QamatsRules.rules());
        rules.addAll(ShevaRules.rules());
        rules.addAll(ShevaEndingRules.rules());
        rules.addAll(ModernShevaRules.rules());

        Map<String, Rule> byName = new LinkedHashMap<>();
        for (Rule rule : rules) {
            if (byName.put(rule.name(), rule) != null) {
                throw new IllegalStateException("Duplicate rule name: " + rule.name());
            }
        }
        CATALOG = Collections.unmodifiableList(rules);
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private RuleBook() {
    }

    public static List<Rule> catalog() {
        return CATALOG;
    }

    /**
     * @return the rule or {@code null} when no rule has this name
     */
    public static Rule forName(String name) {
        return BY_NAME.get(name);
    }
}
