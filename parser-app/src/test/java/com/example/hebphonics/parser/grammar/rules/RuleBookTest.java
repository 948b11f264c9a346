package com.example.hebphonics.parser.grammar.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class RuleBookTest {

    @Test
    void lookupByName() {
        Rule rule = RuleBook.forName("sheva-na-ending-a|kh|l|f-ah");
        assertEquals(Stage.SHEVA, rule.stage());
        assertEquals(Rule.Availability.DEFAULT, rule.availability());
        assertNull(RuleBook.forName("no-such-rule"));
    }

    @Test
    void availabilityOfHeuristicRules() {
        assertEquals(Rule.Availability.OPT_IN, RuleBook.forName("sheva-na-after-meteg").availability());
        assertEquals(Rule.Availability.OPT_IN, RuleBook.forName("qamats-qatan-before-hataf-qamats").availability());
        assertEquals(Rule.Availability.UNIMPLEMENTED, RuleBook.forName("qamats-qatan-be-le-prefix").availability());
    }

    @Test
    void positionalShevaRulesRunBeforeEndings() {
        List<String> sheva = new ArrayList<>();
        for (Rule rule : RuleBook.catalog()) {
            if (rule.stage() == Stage.SHEVA) {
                sheva.add(rule.name());
            }
        }
        assertEquals("sheva-gaya", sheva.get(0));
        assertEquals(sheva.indexOf("sheva-na-after-long-vowel") + 1, sheva.indexOf("sheva-na-ending-sah"));
    }
}
