package com.stattools.classification.load;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stattools.classification.ClassificationRule;
import com.stattools.classification.ClassificationRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads a {@link ClassificationRuleSet} from a JSON file. The file is either an array of rule records or
 * an object {@code {"defaultLabel": "...", "rules": [...]}}; each record is
 * {@code {"patterns": [...], "excludes": [...], "scientific_type": "..."}}.
 * <p>
 * Candidate paths are tried in the given order; the first regular file wins. A missing, unreadable or
 * invalid file is not an error: it is logged and an empty result is returned so the caller can skip
 * classification and pass the dataset through unmodified.
 */
public final class ClassificationRuleSetLoader {

    private static final Logger log = LoggerFactory.getLogger(ClassificationRuleSetLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<RuleDefinition>> RULES_TYPE = new TypeReference<>() {};
    private static final String KEY_RULES = "rules";
    private static final String KEY_DEFAULT_LABEL = "defaultLabel";

    private final String fallbackDefaultLabel;

    /**
     * @param fallbackDefaultLabel default label used when the file does not declare {@code defaultLabel}
     */
    public ClassificationRuleSetLoader(String fallbackDefaultLabel) {
        this.fallbackDefaultLabel = Objects.requireNonNull(fallbackDefaultLabel, "fallbackDefaultLabel");
    }

    /**
     * Loads from the first existing candidate path.
     *
     * @param candidates paths in lookup order (e.g. from STAT_TOOLS_CLASSIFICATION_RULES)
     * @return rule set, or empty when no candidate exists or the file found is unusable
     */
    public Optional<ClassificationRuleSet> load(List<Path> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            log.warn("No classification rule-set path configured; classification will be skipped");
            return Optional.empty();
        }
        for (Path candidate : candidates) {
            if (candidate != null && Files.isRegularFile(candidate)) {
                return load(candidate);
            }
        }
        log.warn("Classification rule-set file not found (tried {}); classification will be skipped", candidates);
        return Optional.empty();
    }

    /**
     * Loads from one file.
     *
     * @return rule set, or empty when the file is missing, unreadable or invalid
     */
    public Optional<ClassificationRuleSet> load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            log.warn("Classification rule-set file not found: {}; classification will be skipped", file);
            return Optional.empty();
        }
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            log.warn("Failed to read classification rule-set file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        Optional<ClassificationRuleSet> ruleSet = parse(json, "file:" + file);
        ruleSet.ifPresent(rs -> log.info("Classification rule set loaded from file: {} ({} rules, default label '{}')",
                file, rs.getRules().size(), rs.getDefaultLabel()));
        return ruleSet;
    }

    /**
     * Parses rule-set JSON. Returns empty (with a WARN log naming {@code source}) when the JSON, a rule,
     * or a pattern is invalid.
     */
    public Optional<ClassificationRuleSet> parse(String json, String source) {
        try {
            JsonNode root = MAPPER.readTree(json);
            JsonNode rulesNode;
            String defaultLabel = fallbackDefaultLabel;
            if (root != null && root.isArray()) {
                rulesNode = root;
            } else if (root != null && root.isObject() && root.has(KEY_RULES)) {
                rulesNode = root.get(KEY_RULES);
                JsonNode dl = root.get(KEY_DEFAULT_LABEL);
                if (dl != null && dl.isTextual() && !dl.asText().isBlank()) {
                    defaultLabel = dl.asText();
                }
            } else {
                log.warn("Classification rule set from {} is neither a rule array nor an object with \"rules\"", source);
                return Optional.empty();
            }
            List<RuleDefinition> definitions = MAPPER.convertValue(rulesNode, RULES_TYPE);
            return Optional.of(toRuleSet(definitions, defaultLabel));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to parse classification rule set from {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Compiles definitions in file order.
     *
     * @throws IllegalArgumentException if a rule has no patterns, a blank label, or an invalid pattern
     */
    static ClassificationRuleSet toRuleSet(List<RuleDefinition> definitions, String defaultLabel) {
        List<ClassificationRule> rules = new ArrayList<>(definitions.size());
        for (RuleDefinition def : definitions) {
            if (def == null) continue;
            rules.add(ClassificationRule.of(def.getPatterns(), def.getExcludes(), def.getScientificType()));
        }
        return ClassificationRuleSet.of(rules, defaultLabel);
    }
}
