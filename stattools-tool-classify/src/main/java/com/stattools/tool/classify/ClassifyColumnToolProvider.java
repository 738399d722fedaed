package com.stattools.tool.classify;

import com.stattools.classification.ClassificationRuleSet;
import com.stattools.tools.ToolCategory;
import com.stattools.tools.ToolProvider;

import java.util.Map;
import java.util.Optional;

/**
 * Provider for CLASSIFY_COLUMN. Always registered: without a rule set the tool passes rows through.
 */
public final class ClassifyColumnToolProvider implements ToolProvider {

    public static final String TOOL_ID = "CLASSIFY_COLUMN";

    private final ClassifyColumnTool tool;

    public ClassifyColumnToolProvider(Optional<ClassificationRuleSet> ruleSet, String defaultColumn, String defaultLabelColumn) {
        this.tool = new ClassifyColumnTool(ruleSet, defaultColumn, defaultLabelColumn);
    }

    @Override
    public String getToolId() {
        return TOOL_ID;
    }

    @Override
    public ClassifyColumnTool getTool() {
        return tool;
    }

    @Override
    public String getDescription() {
        return "Adds a coarse label column derived from a messy categorical column (e.g. meteorite class codes -> "
                + "'Chondrite (Ordinary)', 'Iron'). Missing values are labelled 'Unknown'.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.CLASSIFICATION;
    }

    @Override
    public Map<String, String> getInputSchema() {
        return Map.of("rows", "LIST", "column", "STRING", "labelColumn", "STRING");
    }

    @Override
    public Map<String, String> getOutputSchema() {
        return Map.of("rows", "LIST", "labelCounts", "MAP", "classified", "BOOLEAN", "column", "STRING", "labelColumn", "STRING");
    }
}
