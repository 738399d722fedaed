package com.stattools.formula;

/**
 * Base type for failures that make a formula unusable against a dataset. These are surfaced to the
 * calling agent unchanged so it can correct the formula and retry.
 */
public class FormulaResolutionException extends RuntimeException {

    protected FormulaResolutionException(String message) {
        super(message);
    }
}
