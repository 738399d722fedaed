package com.stattools.tool.formula;

import com.stattools.formula.QuoteStyle;
import com.stattools.tools.ToolCategory;
import com.stattools.tools.ToolProvider;

import java.util.Map;

/**
 * Provider for RESOLVE_FORMULA.
 */
public final class ResolveFormulaToolProvider implements ToolProvider {

    public static final String TOOL_ID = "RESOLVE_FORMULA";

    private final ResolveFormulaTool tool;

    public ResolveFormulaToolProvider() {
        this(QuoteStyle.BACKTICK);
    }

    public ResolveFormulaToolProvider(QuoteStyle quoteStyle) {
        this.tool = new ResolveFormulaTool(quoteStyle);
    }

    @Override
    public String getToolId() {
        return TOOL_ID;
    }

    @Override
    public ResolveFormulaTool getTool() {
        return tool;
    }

    @Override
    public String getDescription() {
        return "Rewrites a model formula (e.g. 'mass (g) ~ year') so every variable refers to an actual dataset column, "
                + "quoting names with spaces or punctuation. Fails naming any variable that matches no column.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.FORMULA;
    }

    @Override
    public Map<String, String> getInputSchema() {
        return Map.of("formula", "STRING", "columns", "LIST");
    }

    @Override
    public Map<String, String> getOutputSchema() {
        return Map.of("formula", "STRING", "variables", "LIST", "columns", "LIST");
    }
}
