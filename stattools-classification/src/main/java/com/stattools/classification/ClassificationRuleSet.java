package com.stattools.classification;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Ordered classification rules plus a default label. Collapses a large, messy categorical vocabulary
 * (e.g. hundreds of meteorite class codes) into a few stable labels.
 * <p>
 * Evaluation: missing code → {@value #UNKNOWN}; otherwise the label of the first rule (in file order)
 * that matches the upper-cased code; otherwise the default label. Immutable; safe for concurrent use.
 * <p>
 * A blank or whitespace-only code counts as missing: an empty CSV cell carries no class, so it is
 * reported as {@value #UNKNOWN} rather than falling through to the default label.
 */
public final class ClassificationRuleSet {

    /** Label for a null or blank code; distinct from the default label (present but unmatched). */
    public static final String UNKNOWN = "Unknown";

    private final List<ClassificationRule> rules;
    private final String defaultLabel;

    private ClassificationRuleSet(List<ClassificationRule> rules, String defaultLabel) {
        this.rules = List.copyOf(rules);
        this.defaultLabel = defaultLabel;
    }

    /**
     * @param rules        rules in priority order
     * @param defaultLabel label for codes no rule matches; non-blank
     */
    public static ClassificationRuleSet of(List<ClassificationRule> rules, String defaultLabel) {
        Objects.requireNonNull(rules, "rules");
        if (defaultLabel == null || defaultLabel.isBlank()) {
            throw new IllegalArgumentException("Default label must be non-blank");
        }
        return new ClassificationRuleSet(rules, defaultLabel.trim());
    }

    /**
     * Returns the label for {@code rawCode}: {@value #UNKNOWN} when null or blank, else the first matching
     * rule's label, else the default label.
     */
    public String classify(String rawCode) {
        if (rawCode == null || rawCode.isBlank()) {
            return UNKNOWN;
        }
        return findRule(rawCode).map(ClassificationRule::getLabel).orElse(defaultLabel);
    }

    /**
     * First rule that matches {@code rawCode}, or empty when none does (or the code is missing).
     */
    public Optional<ClassificationRule> findRule(String rawCode) {
        if (rawCode == null || rawCode.isBlank()) return Optional.empty();
        String code = rawCode.trim().toUpperCase(Locale.ROOT);
        return rules.stream().filter(r -> r.matches(code)).findFirst();
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }

    public String getDefaultLabel() {
        return defaultLabel;
    }

    /** Every label this set can produce: rule labels in order, the default label, then {@value #UNKNOWN}. */
    public List<String> getLabels() {
        return Stream.concat(
                        rules.stream().map(ClassificationRule::getLabel),
                        Stream.of(defaultLabel, UNKNOWN))
                .distinct()
                .toList();
    }

    @Override
    public String toString() {
        return "ClassificationRuleSet{rules=" + rules.size() + ", defaultLabel=" + defaultLabel + "}";
    }
}
