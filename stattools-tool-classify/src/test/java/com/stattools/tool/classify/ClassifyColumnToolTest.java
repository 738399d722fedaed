package com.stattools.tool.classify;

import com.stattools.classification.ClassificationRule;
import com.stattools.classification.ClassificationRuleSet;
import com.stattools.config.SessionConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClassifyColumnToolTest {

    private static final ClassificationRuleSet RULES = ClassificationRuleSet.of(List.of(
            ClassificationRule.of(List.of("L", "H", "LL"), List.of(), "Chondrite (Ordinary)"),
            ClassificationRule.of(List.of("IRON"), List.of(), "Iron")
    ), "Stony (Other)");

    private static final List<Map<String, Object>> ROWS = List.of(
            Map.of("name", "Aachen", "RecClass", "L5"),
            Map.of("name", "Gibeon", "RecClass", "Iron, IVA"),
            Map.of("name", "Imilac", "RecClass", "Pallasite"));

    @Test
    void execute_appendsLabelColumn() {
        ClassifyColumnTool tool = new ClassifyColumnTool(Optional.of(RULES), "class", "scientific_type");

        Map<String, Object> out = tool.execute(Map.of("rows", ROWS, "column", "recclass"), SessionConfig.EMPTY);

        assertEquals(true, out.get("classified"));
        assertEquals("RecClass", out.get("column"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rows = (List<Map<String, Object>>) out.get("rows");
        assertEquals("Chondrite (Ordinary)", rows.get(0).get("scientific_type"));
        assertEquals("Iron", rows.get(1).get("scientific_type"));
        assertEquals("Stony (Other)", rows.get(2).get("scientific_type"));
        assertEquals(Map.of("Chondrite (Ordinary)", 1, "Iron", 1, "Stony (Other)", 1), out.get("labelCounts"));
    }

    @Test
    void execute_usesRequestedLabelColumn() {
        ClassifyColumnTool tool = new ClassifyColumnTool(Optional.of(RULES), "recclass", "scientific_type");

        Map<String, Object> out = tool.execute(Map.of("rows", ROWS, "labelColumn", "group"), SessionConfig.EMPTY);

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rows = (List<Map<String, Object>>) out.get("rows");
        assertEquals("Iron", rows.get(1).get("group"));
        assertEquals("group", out.get("labelColumn"));
    }

    @Test
    void execute_takesColumnsFromSessionWhenCallOmitsThem() {
        ClassifyColumnTool tool = new ClassifyColumnTool(Optional.of(RULES), "class", "scientific_type");
        SessionConfig session = SessionConfig.builder()
                .sessionId("meteorites")
                .classificationColumn("recclass")
                .classificationLabelColumn("group")
                .build();

        Map<String, Object> out = tool.execute(Map.of("rows", ROWS), session);

        assertEquals(true, out.get("classified"));
        assertEquals("RecClass", out.get("column"));
        assertEquals("group", out.get("labelColumn"));
        Map<String, Object> explicit = tool.execute(Map.of("rows", ROWS, "labelColumn", "kind"), session);
        assertEquals("kind", explicit.get("labelColumn"));
    }

    @Test
    void execute_passesRowsThroughWithoutRuleSet() {
        ClassifyColumnToolProvider provider = new ClassifyColumnToolProvider(Optional.empty(), "recclass", "scientific_type");

        Map<String, Object> out = provider.getTool().execute(Map.of("rows", ROWS), SessionConfig.EMPTY);

        assertFalse(provider.getTool().hasRuleSet());
        assertEquals(false, out.get("classified"));
        assertSame(ROWS, out.get("rows"));
        assertTrue(((Map<?, ?>) out.get("labelCounts")).isEmpty());
    }

    @Test
    void execute_passesRowsThroughWhenColumnMissing() {
        ClassifyColumnTool tool = new ClassifyColumnTool(Optional.of(RULES), "class", "scientific_type");

        Map<String, Object> out = tool.execute(Map.of("rows", ROWS), SessionConfig.EMPTY);

        assertEquals(false, out.get("classified"));
        assertSame(ROWS, out.get("rows"));
    }

    @Test
    void execute_requiresRows() {
        ClassifyColumnTool tool = new ClassifyColumnTool(Optional.of(RULES), "class", "scientific_type");

        assertThrows(IllegalArgumentException.class, () -> tool.execute(Map.of(), SessionConfig.EMPTY));
    }

    @Test
    void provider_describesTool() {
        ClassifyColumnToolProvider provider = new ClassifyColumnToolProvider(Optional.of(RULES), "class", "scientific_type");

        assertEquals("CLASSIFY_COLUMN", provider.getToolId());
        assertEquals("CLASSIFICATION", provider.getCategoryName());
        assertTrue(provider.isEnabled());
    }
}
