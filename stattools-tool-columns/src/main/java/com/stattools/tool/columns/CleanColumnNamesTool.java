package com.stattools.tool.columns;

import com.stattools.config.SessionConfig;
import com.stattools.formula.naming.ColumnCollision;
import com.stattools.formula.naming.ColumnMap;
import com.stattools.tools.Tool;
import com.stattools.tools.ToolInputs;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports how a dataset header maps to canonical names, and resolves column arguments given in any
 * spelling (e.g. the columns whose missing values should be dropped) to actual column names.
 * <p>
 * Inputs: "columns" (header), optional "names" (column arguments).
 * Outputs: "columnMap" (canonical → raw), "renamed" (raw → canonical, changed names only),
 * "resolved" (raw columns for "names"; unknown names skipped), "unresolved", "collisions".
 */
public final class CleanColumnNamesTool implements Tool {

    static final String KEY_COLUMNS = "columns";
    static final String KEY_NAMES = "names";

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs, SessionConfig session) {
        ColumnMap columnMap = ColumnMap.build(ToolInputs.requireStringList(inputs, KEY_COLUMNS));
        List<String> names = ToolInputs.optionalStringList(inputs, KEY_NAMES);

        List<String> unresolved = new ArrayList<>();
        if (names != null) {
            for (String name : names) {
                if (columnMap.resolveName(name).isEmpty()) unresolved.add(name);
            }
        }
        List<Map<String, Object>> collisions = new ArrayList<>();
        for (ColumnCollision c : columnMap.getCollisions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("canonical", c.canonical());
            entry.put("retained", c.retained());
            entry.put("shadowed", c.shadowed());
            collisions.add(entry);
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("columnMap", columnMap.asMap());
        out.put("renamed", columnMap.renamedColumns());
        out.put("resolved", columnMap.resolveAll(names));
        out.put("unresolved", unresolved);
        out.put("collisions", collisions);
        return out;
    }
}
