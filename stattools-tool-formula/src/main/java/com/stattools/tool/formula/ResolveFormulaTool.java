package com.stattools.tool.formula;

import com.stattools.config.SessionConfig;
import com.stattools.formula.FormulaRewriter;
import com.stattools.formula.QuoteStyle;
import com.stattools.formula.ResolvedFormula;
import com.stattools.formula.VariableToken;
import com.stattools.formula.naming.ColumnMap;
import com.stattools.tools.Tool;
import com.stattools.tools.ToolInputs;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites an agent-supplied model formula against the dataset header before it is handed to the
 * model-fitting step. Accepts "formula" and "columns"; returns the rewritten "formula", the resolved
 * "variables" and the referenced "columns".
 * Columns are quoted in the session's {@link SessionConfig#getFormulaQuoteStyle() quote style} when it
 * sets one, else in the style this tool was built with.
 * Unresolvable terms raise {@link com.stattools.formula.ColumnNotFoundException} naming the term.
 */
public final class ResolveFormulaTool implements Tool {

    static final String KEY_FORMULA = "formula";
    static final String KEY_COLUMNS = "columns";
    static final String KEY_VARIABLES = "variables";

    private final FormulaRewriter rewriter;

    public ResolveFormulaTool() {
        this(QuoteStyle.BACKTICK);
    }

    public ResolveFormulaTool(QuoteStyle quoteStyle) {
        this.rewriter = new FormulaRewriter(quoteStyle);
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs, SessionConfig session) {
        String formula = ToolInputs.requireString(inputs, KEY_FORMULA);
        List<String> columns = ToolInputs.requireStringList(inputs, KEY_COLUMNS);
        ResolvedFormula resolved = rewriterFor(session).resolve(formula, ColumnMap.build(columns));

        List<Map<String, Object>> variables = new ArrayList<>(resolved.variables().size());
        for (VariableToken v : resolved.variables()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("token", v.token());
            entry.put("canonical", v.canonical());
            entry.put("column", v.column());
            entry.put("replacement", v.replacement());
            variables.add(entry);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(KEY_FORMULA, resolved.rewritten());
        out.put(KEY_VARIABLES, variables);
        out.put(KEY_COLUMNS, resolved.columns());
        return out;
    }

    /**
     * @throws IllegalArgumentException if the session names an unknown quote style
     */
    private FormulaRewriter rewriterFor(SessionConfig session) {
        QuoteStyle style = session.getFormulaQuoteStyle().map(QuoteStyle::fromName).orElse(rewriter.getQuoteStyle());
        return style == rewriter.getQuoteStyle() ? rewriter : new FormulaRewriter(style);
    }
}
