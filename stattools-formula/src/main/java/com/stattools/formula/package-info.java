/**
 * Formula resolution: makes agent-supplied model formulas refer to actual dataset columns regardless
 * of naming drift (case, spaces, units, punctuation).
 * <ul>
 *   <li>{@link com.stattools.formula.naming.NameNormalizer} – raw identifier → canonical name</li>
 *   <li>{@link com.stattools.formula.naming.ColumnMap} – canonical → raw lookup per dataset (first occurrence wins)</li>
 *   <li>{@link com.stattools.formula.FormulaTokenizer} – variable terms between {@code ~ + * :}</li>
 *   <li>{@link com.stattools.formula.FormulaRewriter} – resolve, quote and substitute terms</li>
 *   <li>{@link com.stattools.formula.ColumnNotFoundException}, {@link com.stattools.formula.MalformedFormulaException} – surfaced to the caller for retry</li>
 * </ul>
 */
package com.stattools.formula;
