package com.stattools.tool.classify;

import com.stattools.classification.ClassificationRuleSet;
import com.stattools.classification.ColumnClassifier;
import com.stattools.config.SessionConfig;
import com.stattools.formula.naming.ColumnMap;
import com.stattools.tools.Tool;
import com.stattools.tools.ToolInputs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Enriches dataset rows with a coarse label derived from a messy categorical column (e.g. meteorite
 * "recclass" → "Chondrite (Ordinary)").
 * <p>
 * Inputs: "rows" (list of objects), optional "column" (any spelling; resolved against the row keys),
 * optional "labelColumn". A column or label column the call leaves out comes from the session's overrides
 * ({@link SessionConfig#getClassificationColumn()}), then from the configured defaults. Outputs: "rows", "labelCounts", "classified", "column", "labelColumn".
 * <p>
 * Classification is enrichment: when the rule set could not be loaded or the column is absent, the rows
 * are returned unmodified with {@code classified=false} and a warning is logged.
 */
public final class ClassifyColumnTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(ClassifyColumnTool.class);

    static final String KEY_ROWS = "rows";
    static final String KEY_COLUMN = "column";
    static final String KEY_LABEL_COLUMN = "labelColumn";
    static final String KEY_LABEL_COUNTS = "labelCounts";
    static final String KEY_CLASSIFIED = "classified";

    private final ColumnClassifier classifier;
    private final String defaultColumn;
    private final String defaultLabelColumn;

    /**
     * @param ruleSet            loaded rule set; empty when the rule-set file was missing or unusable
     * @param defaultColumn      column classified when the call names none (e.g. "class")
     * @param defaultLabelColumn label column appended when the call names none (e.g. "scientific_type")
     */
    public ClassifyColumnTool(Optional<ClassificationRuleSet> ruleSet, String defaultColumn, String defaultLabelColumn) {
        this.classifier = Objects.requireNonNull(ruleSet, "ruleSet").map(ColumnClassifier::new).orElse(null);
        this.defaultColumn = Objects.requireNonNull(defaultColumn, "defaultColumn");
        this.defaultLabelColumn = Objects.requireNonNull(defaultLabelColumn, "defaultLabelColumn");
    }

    /** Whether a rule set is available. */
    public boolean hasRuleSet() {
        return classifier != null;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs, SessionConfig session) {
        List<Map<String, Object>> rows = ToolInputs.requireRows(inputs, KEY_ROWS);
        String requested = ToolInputs.optionalString(inputs, KEY_COLUMN,
                session.getClassificationColumn().orElse(defaultColumn));
        String labelColumn = ToolInputs.optionalString(inputs, KEY_LABEL_COLUMN,
                session.getClassificationLabelColumn().orElse(defaultLabelColumn));

        if (classifier == null) {
            log.warn("Classification rule set unavailable; rows passed through unmodified (session={})", session.getSessionId());
            return passThrough(rows, requested, labelColumn);
        }
        Optional<String> column = ColumnMap.build(columnsOf(rows)).resolveName(requested);
        if (column.isEmpty()) {
            log.warn("Column '{}' not found in dataset; classification skipped (session={})", requested, session.getSessionId());
            return passThrough(rows, requested, labelColumn);
        }

        ColumnClassifier.ClassificationResult result = classifier.classify(rows, column.get(), labelColumn);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(KEY_ROWS, result.rows());
        out.put(KEY_LABEL_COUNTS, result.labelCounts());
        out.put(KEY_CLASSIFIED, true);
        out.put(KEY_COLUMN, column.get());
        out.put(KEY_LABEL_COLUMN, labelColumn);
        return out;
    }

    private static Map<String, Object> passThrough(List<Map<String, Object>> rows, String column, String labelColumn) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(KEY_ROWS, rows);
        out.put(KEY_LABEL_COUNTS, Map.of());
        out.put(KEY_CLASSIFIED, false);
        out.put(KEY_COLUMN, column);
        out.put(KEY_LABEL_COLUMN, labelColumn);
        return out;
    }

    /** Column names across all rows, in first-seen order. */
    private static List<String> columnsOf(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            if (row != null) columns.addAll(row.keySet());
        }
        return new ArrayList<>(columns);
    }
}
