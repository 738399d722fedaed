package com.stattools.classification.load;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Rule record in the rule-set file: include patterns, optional exclude patterns, and the label. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RuleDefinition {

    private final List<String> patterns;
    private final List<String> excludes;
    private final String scientificType;

    @JsonCreator
    public RuleDefinition(
            @JsonProperty("patterns") List<String> patterns,
            @JsonProperty("excludes") List<String> excludes,
            @JsonProperty("scientific_type") String scientificType) {
        this.patterns = patterns != null ? List.copyOf(patterns) : List.of();
        this.excludes = excludes != null ? List.copyOf(excludes) : List.of();
        this.scientificType = scientificType;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    /** Exclude patterns; empty when the file omits them. */
    public List<String> getExcludes() {
        return excludes;
    }

    /** Label assigned by this rule (file key {@code scientific_type}). */
    public String getScientificType() {
        return scientificType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RuleDefinition that = (RuleDefinition) o;
        return Objects.equals(patterns, that.patterns) && Objects.equals(excludes, that.excludes)
                && Objects.equals(scientificType, that.scientificType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patterns, excludes, scientificType);
    }
}
