package com.stattools.classification;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One rule of a {@link ClassificationRuleSet}: a code gets {@link #getLabel()} when it matches at least
 * one include pattern and no exclude pattern. Patterns are compiled once, case-insensitive.
 * <p>
 * An include pattern must match at the start of a token, i.e. not preceded by a letter, so {@code L}
 * matches {@code L6} and {@code H/L3.6} but not {@code PALLASITE}. An exclude pattern matches anywhere
 * in the code.
 */
public final class ClassificationRule {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final String TOKEN_START = "(?<!\\p{L})";

    private final List<String> includeSources;
    private final List<String> excludeSources;
    private final List<Pattern> includes;
    private final List<Pattern> excludes;
    private final String label;

    private ClassificationRule(List<String> includeSources, List<String> excludeSources, String label) {
        this.includeSources = List.copyOf(includeSources);
        this.excludeSources = List.copyOf(excludeSources);
        this.includes = this.includeSources.stream()
                .map(p -> Pattern.compile(TOKEN_START + "(?:" + p + ")", FLAGS))
                .toList();
        this.excludes = this.excludeSources.stream()
                .map(p -> Pattern.compile(p, FLAGS))
                .toList();
        this.label = label;
    }

    /**
     * Compiles a rule.
     *
     * @param patterns include patterns (regular expressions); at least one
     * @param excludes exclude patterns; null = none
     * @param label    label assigned on match; non-blank
     * @throws IllegalArgumentException if patterns is empty or label is blank
     * @throws java.util.regex.PatternSyntaxException if a pattern is not a valid regular expression
     */
    public static ClassificationRule of(List<String> patterns, List<String> excludes, String label) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("Classification rule needs at least one pattern (label=" + label + ")");
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Classification rule label must be non-blank (patterns=" + patterns + ")");
        }
        for (String p : patterns) {
            Objects.requireNonNull(p, "pattern");
        }
        List<String> ex = excludes != null ? excludes : List.of();
        for (String p : ex) {
            Objects.requireNonNull(p, "exclude pattern");
        }
        return new ClassificationRule(patterns, ex, label.trim());
    }

    /**
     * Whether the (upper-cased) code satisfies this rule.
     */
    public boolean matches(String code) {
        if (code == null) return false;
        boolean included = false;
        for (Pattern p : includes) {
            if (p.matcher(code).find()) {
                included = true;
                break;
            }
        }
        if (!included) return false;
        for (Pattern p : excludes) {
            if (p.matcher(code).find()) return false;
        }
        return true;
    }

    public String getLabel() {
        return label;
    }

    /** Include patterns as written in the rule-set file. */
    public List<String> getPatterns() {
        return includeSources;
    }

    /** Exclude patterns as written in the rule-set file. */
    public List<String> getExcludes() {
        return excludeSources;
    }

    @Override
    public String toString() {
        return "ClassificationRule{label=" + label + ", patterns=" + includeSources + ", excludes=" + excludeSources + "}";
    }
}
