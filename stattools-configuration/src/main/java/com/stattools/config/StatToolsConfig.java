package com.stattools.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the statistical tool layer.
 * <p>
 * Classification: STAT_TOOLS_CLASSIFICATION_RULES (comma-separated candidate paths, tried in order),
 * STAT_TOOLS_CLASSIFICATION_DEFAULT_LABEL, STAT_TOOLS_CLASSIFICATION_COLUMN,
 * STAT_TOOLS_CLASSIFICATION_LABEL_COLUMN.
 * <p>
 * Formula: STAT_TOOLS_FORMULA_QUOTE_STYLE ({@code BACKTICK} or {@code DOUBLE_QUOTE}).
 */
public final class StatToolsConfig {

    private static final String ENV_CLASSIFICATION_RULES = "STAT_TOOLS_CLASSIFICATION_RULES";
    private static final String ENV_CLASSIFICATION_DEFAULT_LABEL = "STAT_TOOLS_CLASSIFICATION_DEFAULT_LABEL";
    private static final String ENV_CLASSIFICATION_COLUMN = "STAT_TOOLS_CLASSIFICATION_COLUMN";
    private static final String ENV_CLASSIFICATION_LABEL_COLUMN = "STAT_TOOLS_CLASSIFICATION_LABEL_COLUMN";
    private static final String ENV_FORMULA_QUOTE_STYLE = "STAT_TOOLS_FORMULA_QUOTE_STYLE";

    private static final String DEFAULT_CLASSIFICATION_RULES = "config/classification_rules.json";
    private static final String DEFAULT_CLASSIFICATION_DEFAULT_LABEL = "Other";
    private static final String DEFAULT_CLASSIFICATION_COLUMN = "class";
    private static final String DEFAULT_CLASSIFICATION_LABEL_COLUMN = "scientific_type";
    private static final String DEFAULT_FORMULA_QUOTE_STYLE = "BACKTICK";

    /**
     * Quote styles accepted for {@value #ENV_FORMULA_QUOTE_STYLE}: the constant names of
     * {@code com.stattools.formula.QuoteStyle}, which this module does not depend on. Keep in sync;
     * {@code InternalToolsTest} checks both lists are equal.
     */
    public static final List<String> FORMULA_QUOTE_STYLES = List.of("BACKTICK", "DOUBLE_QUOTE");

    private final List<Path> classificationRulePaths;
    private final String classificationDefaultLabel;
    private final String classificationColumn;
    private final String classificationLabelColumn;
    private final String formulaQuoteStyle;

    private StatToolsConfig(Builder b) {
        this.classificationRulePaths = Collections.unmodifiableList(new ArrayList<>(b.classificationRulePaths));
        this.classificationDefaultLabel = b.classificationDefaultLabel;
        this.classificationColumn = b.classificationColumn;
        this.classificationLabelColumn = b.classificationLabelColumn;
        this.formulaQuoteStyle = b.formulaQuoteStyle;
    }

    /**
     * Candidate locations of the classification rule-set file, in lookup order.
     * The loader uses the first one that exists; none existing means classification is skipped.
     */
    public List<Path> getClassificationRulePaths() {
        return classificationRulePaths;
    }

    /** Label used when the rule-set file does not declare its own default. */
    public String getClassificationDefaultLabel() {
        return classificationDefaultLabel;
    }

    /** Categorical column classified when a tool call names none (e.g. "class"). */
    public String getClassificationColumn() {
        return classificationColumn;
    }

    /** Name of the label column appended by the classification pass (e.g. "scientific_type"). */
    public String getClassificationLabelColumn() {
        return classificationLabelColumn;
    }

    /** Quote style name for rewritten formulas: BACKTICK or DOUBLE_QUOTE. */
    public String getFormulaQuoteStyle() {
        return formulaQuoteStyle;
    }

    /**
     * Builds config from environment variables.
     */
    public static StatToolsConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Builds config from the given variables (same keys as the environment). Missing or blank values use defaults.
     *
     * @param env variable name to value; null is treated as empty
     * @throws IllegalArgumentException if STAT_TOOLS_FORMULA_QUOTE_STYLE is not a known style
     */
    public static StatToolsConfig fromMap(Map<String, String> env) {
        Map<String, String> vars = env != null ? env : Map.of();
        Builder b = builder();
        String paths = getEnv(vars, ENV_CLASSIFICATION_RULES, DEFAULT_CLASSIFICATION_RULES);
        b.classificationRulePaths(Stream.of(paths.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Path::of)
                .collect(Collectors.toList()));
        b.classificationDefaultLabel(getEnv(vars, ENV_CLASSIFICATION_DEFAULT_LABEL, DEFAULT_CLASSIFICATION_DEFAULT_LABEL));
        b.classificationColumn(getEnv(vars, ENV_CLASSIFICATION_COLUMN, DEFAULT_CLASSIFICATION_COLUMN));
        b.classificationLabelColumn(getEnv(vars, ENV_CLASSIFICATION_LABEL_COLUMN, DEFAULT_CLASSIFICATION_LABEL_COLUMN));
        b.formulaQuoteStyle(getEnv(vars, ENV_FORMULA_QUOTE_STYLE, DEFAULT_FORMULA_QUOTE_STYLE));
        return b.build();
    }

    private static String getEnv(Map<String, String> vars, String key, String defaultValue) {
        String v = vars.get(key);
        return v != null && !v.isBlank() ? v.trim() : defaultValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<Path> classificationRulePaths = List.of(Path.of(DEFAULT_CLASSIFICATION_RULES));
        private String classificationDefaultLabel = DEFAULT_CLASSIFICATION_DEFAULT_LABEL;
        private String classificationColumn = DEFAULT_CLASSIFICATION_COLUMN;
        private String classificationLabelColumn = DEFAULT_CLASSIFICATION_LABEL_COLUMN;
        private String formulaQuoteStyle = DEFAULT_FORMULA_QUOTE_STYLE;

        public Builder classificationRulePaths(List<Path> classificationRulePaths) {
            this.classificationRulePaths = classificationRulePaths != null ? classificationRulePaths : List.of();
            return this;
        }

        public Builder classificationDefaultLabel(String classificationDefaultLabel) {
            this.classificationDefaultLabel = Objects.requireNonNull(classificationDefaultLabel, "classificationDefaultLabel");
            return this;
        }

        public Builder classificationColumn(String classificationColumn) {
            this.classificationColumn = Objects.requireNonNull(classificationColumn, "classificationColumn");
            return this;
        }

        public Builder classificationLabelColumn(String classificationLabelColumn) {
            this.classificationLabelColumn = Objects.requireNonNull(classificationLabelColumn, "classificationLabelColumn");
            return this;
        }

        public Builder formulaQuoteStyle(String formulaQuoteStyle) {
            String style = Objects.requireNonNull(formulaQuoteStyle, "formulaQuoteStyle").trim().toUpperCase(Locale.ROOT);
            if (!FORMULA_QUOTE_STYLES.contains(style)) {
                throw new IllegalArgumentException("Unknown formula quote style: " + formulaQuoteStyle
                        + " (expected one of " + String.join(", ", FORMULA_QUOTE_STYLES) + ")");
            }
            this.formulaQuoteStyle = style;
            return this;
        }

        public StatToolsConfig build() {
            return new StatToolsConfig(this);
        }
    }
}
