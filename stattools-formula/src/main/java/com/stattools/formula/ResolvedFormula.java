package com.stattools.formula;

import java.util.List;

/**
 * Result of {@link FormulaRewriter#resolve}: the input formula, the rewritten formula that refers to
 * actual dataset columns, and the resolved terms in first-occurrence order.
 */
public record ResolvedFormula(String original, String rewritten, List<VariableToken> variables) {

    public ResolvedFormula {
        variables = variables != null ? List.copyOf(variables) : List.of();
    }

    /** Raw dataset columns referenced by the formula, in first-occurrence order. */
    public List<String> columns() {
        return variables.stream().map(VariableToken::column).distinct().toList();
    }
}
