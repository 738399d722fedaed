package com.stattools.formula;

/**
 * Thrown when a formula yields no variable terms (null, blank, or operators only).
 */
public final class MalformedFormulaException extends FormulaResolutionException {

    private final String formula;

    public MalformedFormulaException(String formula) {
        super("Formula contains no variables: '" + (formula != null ? formula : "") + "'");
        this.formula = formula;
    }

    public String getFormula() {
        return formula;
    }
}
