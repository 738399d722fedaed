package com.stattools.formula;

import java.util.List;

/**
 * Thrown when formula terms match no dataset column after normalization. Carries the first offending
 * term and every unmatched term, in formula order.
 */
public final class ColumnNotFoundException extends FormulaResolutionException {

    private final List<String> unmatchedTokens;

    public ColumnNotFoundException(List<String> unmatchedTokens) {
        super("The following variables in the formula do not match any column in the data: "
                + String.join(", ", unmatchedTokens));
        if (unmatchedTokens.isEmpty()) {
            throw new IllegalArgumentException("unmatchedTokens must not be empty");
        }
        this.unmatchedTokens = List.copyOf(unmatchedTokens);
    }

    /** First term that could not be resolved. */
    public String getToken() {
        return unmatchedTokens.get(0);
    }

    public List<String> getUnmatchedTokens() {
        return unmatchedTokens;
    }
}
