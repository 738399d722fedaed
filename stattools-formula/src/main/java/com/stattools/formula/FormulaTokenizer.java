package com.stattools.formula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Extracts the variable terms of a model formula: the pieces between the operators
 * {@code ~ + * :}, trimmed, non-empty, de-duplicated in first-occurrence order.
 * Operators inside quoted segments (per the {@link QuoteStyle}) do not split, so
 * {@code `a+b` ~ x} yields {@code [`a+b`, x]}.
 * <p>
 * Parenthesized wrappers and nested interaction terms are not parsed; {@code log(x)} is one opaque term.
 */
public final class FormulaTokenizer {

    private static final String OPERATORS = "~+*:";

    private final QuoteStyle quoteStyle;

    public FormulaTokenizer() {
        this(QuoteStyle.BACKTICK);
    }

    public FormulaTokenizer(QuoteStyle quoteStyle) {
        this.quoteStyle = Objects.requireNonNull(quoteStyle, "quoteStyle");
    }

    /**
     * Returns the unique variable terms of {@code formula} in first-occurrence order.
     *
     * @param formula formula text (e.g. "mass (g) ~ year + fall"); null yields an empty list
     * @return terms, raw as written (quoted terms keep their delimiters)
     */
    public List<String> tokenize(String formula) {
        if (formula == null || formula.isEmpty()) return List.of();
        Set<String> tokens = new LinkedHashSet<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (quoted) {
                if (c == quoteStyle.getClose()) quoted = false;
                current.append(c);
            } else if (c == quoteStyle.getOpen()) {
                quoted = true;
                current.append(c);
            } else if (OPERATORS.indexOf(c) >= 0) {
                addToken(tokens, current);
            } else {
                current.append(c);
            }
        }
        addToken(tokens, current);
        return new ArrayList<>(tokens);
    }

    private static void addToken(Set<String> tokens, StringBuilder current) {
        String token = current.toString().trim();
        if (!token.isEmpty()) tokens.add(token);
        current.setLength(0);
    }
}
