package com.stattools.formula;

import com.stattools.formula.naming.ColumnMap;
import com.stattools.formula.naming.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a formula so every variable term refers to an actual dataset column, whatever spelling the
 * caller used: {@code "Mass (g) ~ Year"} against columns {@code [mass (g), year]} becomes
 * {@code "`mass (g)` ~ year"}.
 * <p>
 * Steps: tokenize; resolve each term by canonical name (fail fast with {@link ColumnNotFoundException});
 * quote columns that are not plain identifiers; substitute longest terms first (ties in first-occurrence
 * order) with identifier-boundary anchored literal matches. A quoted term is kept only when its inner
 * text is the resolved column ({@code `Mass (G)`} becomes {@code `mass (g)`}); other quoted segments are
 * never re-substituted, so rewriting an already rewritten formula returns it unchanged.
 * <p>
 * Stateless apart from the quote style; one instance can serve concurrent calls.
 */
public final class FormulaRewriter {

    private static final Logger log = LoggerFactory.getLogger(FormulaRewriter.class);

    /** Identifier characters a term must not be glued to on either side. */
    private static final String BOUNDARY_BEFORE = "(?<![A-Za-z0-9_.])";
    private static final String BOUNDARY_AFTER = "(?![A-Za-z0-9_.])";

    private final QuoteStyle quoteStyle;
    private final FormulaTokenizer tokenizer;

    public FormulaRewriter() {
        this(QuoteStyle.BACKTICK);
    }

    public FormulaRewriter(QuoteStyle quoteStyle) {
        this.quoteStyle = Objects.requireNonNull(quoteStyle, "quoteStyle");
        this.tokenizer = new FormulaTokenizer(quoteStyle);
    }

    public QuoteStyle getQuoteStyle() {
        return quoteStyle;
    }

    /**
     * Returns {@code formula} with its terms replaced by resolvable column references.
     *
     * @throws MalformedFormulaException if the formula has no variable terms
     * @throws ColumnNotFoundException   if a term matches no column
     */
    public String rewrite(String formula, ColumnMap columnMap) {
        return resolve(formula, columnMap).rewritten();
    }

    /**
     * Same as {@link #rewrite} but also returns the resolved terms.
     *
     * @throws MalformedFormulaException if the formula has no variable terms
     * @throws ColumnNotFoundException   if a term matches no column
     */
    public ResolvedFormula resolve(String formula, ColumnMap columnMap) {
        Objects.requireNonNull(columnMap, "columnMap");
        List<String> terms = tokenizer.tokenize(formula);
        if (terms.isEmpty()) {
            throw new MalformedFormulaException(formula);
        }

        List<VariableToken> variables = new ArrayList<>(terms.size());
        List<String> unmatched = new ArrayList<>();
        for (String term : terms) {
            String canonical = NameNormalizer.normalize(term);
            Optional<String> column = columnMap.resolve(canonical);
            if (column.isEmpty()) {
                unmatched.add(term);
                continue;
            }
            String replacement = quoteStyle.isQuoted(term) && quoteStyle.unquote(term).equals(column.get())
                    ? term
                    : quoteStyle.quote(column.get());
            variables.add(new VariableToken(term, canonical, column.get(), replacement));
        }
        if (!unmatched.isEmpty()) {
            throw new ColumnNotFoundException(unmatched);
        }

        // List.sort is stable: equal lengths keep first-occurrence order
        List<VariableToken> bySubstitutionOrder = new ArrayList<>(variables);
        bySubstitutionOrder.sort(Comparator.comparingInt((VariableToken v) -> v.token().length()).reversed());

        String rewritten = formula;
        for (VariableToken v : bySubstitutionOrder) {
            if (!v.token().equals(v.replacement())) {
                rewritten = substitute(rewritten, v.token(), v.replacement());
            }
        }
        log.debug("Formula '{}' rewritten to '{}'", formula, rewritten);
        return new ResolvedFormula(formula, rewritten, variables);
    }

    /**
     * Replaces every boundary-anchored occurrence of {@code term} outside quoted segments. A quoted
     * {@code term} replaces whole quoted segments equal to it instead.
     */
    private String substitute(String text, String term, String replacement) {
        if (quoteStyle.isQuoted(term)) {
            return substituteQuoted(text, term, replacement);
        }
        Pattern pattern = Pattern.compile(BOUNDARY_BEFORE + Pattern.quote(term) + BOUNDARY_AFTER);
        String quotedReplacement = Matcher.quoteReplacement(replacement);
        StringBuilder out = new StringBuilder(text.length() + replacement.length());
        int segmentStart = 0;
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) == quoteStyle.getOpen()) {
                out.append(pattern.matcher(text.substring(segmentStart, i)).replaceAll(quotedReplacement));
                int close = text.indexOf(quoteStyle.getClose(), i + 1);
                int end = close < 0 ? text.length() : close + 1;
                out.append(text, i, end);
                i = end;
                segmentStart = end;
            } else {
                i++;
            }
        }
        out.append(pattern.matcher(text.substring(segmentStart)).replaceAll(quotedReplacement));
        return out.toString();
    }

    private String substituteQuoted(String text, String term, String replacement) {
        StringBuilder out = new StringBuilder(text.length() + replacement.length());
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) == quoteStyle.getOpen()) {
                int close = text.indexOf(quoteStyle.getClose(), i + 1);
                int end = close < 0 ? text.length() : close + 1;
                String segment = text.substring(i, end);
                out.append(segment.equals(term) ? replacement : segment);
                i = end;
            } else {
                out.append(text.charAt(i++));
            }
        }
        return out.toString();
    }
}
