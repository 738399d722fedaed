package com.stattools.classification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cleaning pass that classifies one categorical column of a dataset and appends the label as a new
 * column. Input rows are not modified; each output row is a copy with the label column added last.
 */
public final class ColumnClassifier {

    private static final Logger log = LoggerFactory.getLogger(ColumnClassifier.class);

    private final ClassificationRuleSet ruleSet;

    public ColumnClassifier(ClassificationRuleSet ruleSet) {
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet");
    }

    /**
     * Classifies {@code column} of every row into {@code labelColumn}.
     *
     * @param rows        dataset rows (column name → value); null values count as missing
     * @param column      raw name of the categorical column
     * @param labelColumn name of the appended column; replaces an existing column of that name
     * @return labelled rows and per-label row counts
     */
    public ClassificationResult classify(List<Map<String, Object>> rows, String column, String labelColumn) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(labelColumn, "labelColumn");
        List<Map<String, Object>> labelled = new ArrayList<>(rows.size());
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object value = row != null ? row.get(column) : null;
            String label = ruleSet.classify(value != null ? value.toString() : null);
            Map<String, Object> copy = row != null ? new LinkedHashMap<>(row) : new LinkedHashMap<>();
            copy.remove(labelColumn);
            copy.put(labelColumn, label);
            labelled.add(copy);
            counts.merge(label, 1, Integer::sum);
        }
        log.info("Classified {} row(s) of column '{}' into '{}': {}", rows.size(), column, labelColumn, counts);
        return new ClassificationResult(labelled, counts);
    }

    /**
     * Labelled rows and label → row count (labels in first-seen order).
     */
    public record ClassificationResult(List<Map<String, Object>> rows, Map<String, Integer> labelCounts) {
    }
}
