package com.stattools.formula;

/**
 * A variable term of a formula after resolution against a dataset.
 *
 * @param token       term as written in the formula (e.g. "Mass (g)")
 * @param canonical   canonical name of the term (e.g. "mass_g")
 * @param column      raw dataset column it resolved to (e.g. "mass (g)")
 * @param replacement text substituted for the term (e.g. "`mass (g)`")
 */
public record VariableToken(String token, String canonical, String column, String replacement) {
}
