package com.stattools.tool.columns;

import com.stattools.tools.ToolCategory;
import com.stattools.tools.ToolProvider;

import java.util.Map;

/**
 * Provider for CLEAN_COLUMN_NAMES.
 */
public final class CleanColumnNamesToolProvider implements ToolProvider {

    public static final String TOOL_ID = "CLEAN_COLUMN_NAMES";

    private final CleanColumnNamesTool tool = new CleanColumnNamesTool();

    @Override
    public String getToolId() {
        return TOOL_ID;
    }

    @Override
    public CleanColumnNamesTool getTool() {
        return tool;
    }

    @Override
    public String getDescription() {
        return "Maps dataset column names to clean canonical names (e.g. 'mass (g)' -> 'mass_g') and resolves "
                + "column names given in any spelling to the actual dataset columns.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.DATA_PREP;
    }

    @Override
    public Map<String, String> getInputSchema() {
        return Map.of("columns", "LIST", "names", "LIST");
    }

    @Override
    public Map<String, String> getOutputSchema() {
        return Map.of("columnMap", "MAP", "renamed", "MAP", "resolved", "LIST", "unresolved", "LIST", "collisions", "LIST");
    }
}
