package com.stattools.classification;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ColumnClassifierTest {

    private static final ClassificationRuleSet RULES = ClassificationRuleSet.of(List.of(
            ClassificationRule.of(List.of("L", "H", "LL"), List.of(), "Chondrite (Ordinary)"),
            ClassificationRule.of(List.of("IRON"), List.of(), "Iron")
    ), "Stony (Other)");

    private static Map<String, Object> row(String name, Object recclass) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", name);
        row.put("recclass", recclass);
        return row;
    }

    @Test
    void classify_appendsLabelColumnAndCounts() {
        List<Map<String, Object>> rows = List.of(
                row("Aachen", "L5"),
                row("Abee", "EH4"),
                row("Gibeon", "Iron, IVA"),
                row("Lost", null),
                row("Acapulco", "Acapulcoite"));

        ColumnClassifier.ClassificationResult result = new ColumnClassifier(RULES).classify(rows, "recclass", "scientific_type");

        assertEquals(5, result.rows().size());
        assertEquals("Chondrite (Ordinary)", result.rows().get(0).get("scientific_type"));
        assertEquals("Stony (Other)", result.rows().get(1).get("scientific_type"));
        assertEquals("Iron", result.rows().get(2).get("scientific_type"));
        assertEquals("Unknown", result.rows().get(3).get("scientific_type"));
        assertEquals(List.of("name", "recclass", "scientific_type"), new ArrayList<>(result.rows().get(0).keySet()));
        Map<String, Integer> expected = new LinkedHashMap<>();
        expected.put("Chondrite (Ordinary)", 1);
        expected.put("Stony (Other)", 2);
        expected.put("Iron", 1);
        expected.put("Unknown", 1);
        assertEquals(expected, result.labelCounts());
        assertEquals(List.copyOf(expected.keySet()), new ArrayList<>(result.labelCounts().keySet()));
    }

    @Test
    void classify_doesNotModifyInputRows() {
        Map<String, Object> original = new HashMap<>(row("Aachen", "L5"));

        new ColumnClassifier(RULES).classify(List.of(original), "recclass", "scientific_type");

        assertFalse(original.containsKey("scientific_type"));
    }

    @Test
    void classify_absentColumnYieldsUnknown() {
        ColumnClassifier.ClassificationResult result =
                new ColumnClassifier(RULES).classify(List.of(row("Aachen", "L5")), "class", "type");

        assertEquals("Unknown", result.rows().get(0).get("type"));
    }
}
