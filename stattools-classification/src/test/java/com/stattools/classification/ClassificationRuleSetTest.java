package com.stattools.classification;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClassificationRuleSetTest {

    private static final ClassificationRuleSet METEORITES = ClassificationRuleSet.of(List.of(
            ClassificationRule.of(List.of("L", "H", "LL"), List.of(), "Chondrite (Ordinary)"),
            ClassificationRule.of(List.of("IRON"), null, "Iron")
    ), "Stony (Other)");

    @Test
    void classify_firstMatchingRuleWins() {
        assertEquals("Chondrite (Ordinary)", METEORITES.classify("L6"));
        assertEquals("Chondrite (Ordinary)", METEORITES.classify("LL3.4"));
        assertEquals("Chondrite (Ordinary)", METEORITES.classify("H/L3.6"));
        assertEquals("Iron", METEORITES.classify("Iron"));
        assertEquals("Iron", METEORITES.classify("Iron, IIIAB"));
    }

    @Test
    void classify_unmatchedCodeGetsDefaultLabel() {
        assertEquals("Stony (Other)", METEORITES.classify("Pallasite"));
        assertEquals("Stony (Other)", METEORITES.classify("Eucrite-mmict"));
    }

    @Test
    void classify_missingCodeIsUnknown() {
        assertEquals("Unknown", METEORITES.classify(null));
        assertEquals("Unknown", METEORITES.classify("   "));
        assertEquals(Optional.empty(), METEORITES.findRule(null));
    }

    @Test
    void classify_excludeOverridesInclude() {
        ClassificationRuleSet set = ClassificationRuleSet.of(List.of(
                ClassificationRule.of(List.of("C"), List.of("CALCIUM"), "Carbonaceous")), "Other");

        assertEquals("Carbonaceous", set.classify("CM2"));
        assertEquals("Other", set.classify("Calcium-rich"));
        assertEquals("Other", set.classify("CM-CALCIUM"));
    }

    @Test
    void classify_earlierRuleTakesPriority() {
        ClassificationRuleSet set = ClassificationRuleSet.of(List.of(
                ClassificationRule.of(List.of("IRON"), List.of(), "Iron"),
                ClassificationRule.of(List.of("IRON", "PALLASITE"), List.of(), "Stony-Iron")), "Other");

        assertEquals("Iron", set.classify("Iron, ungrouped"));
        assertEquals("Stony-Iron", set.classify("Pallasite, PMG"));
        assertEquals("Stony-Iron", set.findRule("pallasite").orElseThrow().getLabel());
    }

    @Test
    void classify_supportsRegularExpressions() {
        ClassificationRuleSet set = ClassificationRuleSet.of(List.of(
                ClassificationRule.of(List.of("H\\d"), List.of(), "H chondrite")), "Other");

        assertEquals("H chondrite", set.classify("h5"));
        assertEquals("Other", set.classify("Howardite"));
    }

    @Test
    void getLabels_listsEveryPossibleOutput() {
        assertEquals(List.of("Chondrite (Ordinary)", "Iron", "Stony (Other)", "Unknown"), METEORITES.getLabels());
    }

    @Test
    void rule_rejectsEmptyPatternsAndBlankLabel() {
        assertThrows(IllegalArgumentException.class, () -> ClassificationRule.of(List.of(), List.of(), "Iron"));
        assertThrows(IllegalArgumentException.class, () -> ClassificationRule.of(List.of("IRON"), List.of(), " "));
        assertThrows(IllegalArgumentException.class, () -> ClassificationRuleSet.of(List.of(), ""));
    }

    @Test
    void rule_matchesAtTokenStartOnly() {
        ClassificationRule rule = ClassificationRule.of(List.of("L"), List.of(), "Ordinary");

        assertTrue(rule.matches("L5"));
        assertTrue(rule.matches("H/L4"));
        assertFalse(rule.matches("PALLASITE"));
        assertFalse(rule.matches(null));
    }
}
