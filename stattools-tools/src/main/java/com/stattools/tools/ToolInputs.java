package com.stattools.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed access to tool input maps. Missing required values and wrong types raise
 * {@link IllegalArgumentException} naming the parameter, so the agent can fix its call.
 */
public final class ToolInputs {

    private ToolInputs() {
    }

    /** Required non-blank string. */
    public static String requireString(Map<String, Object> inputs, String key) {
        String value = optionalString(inputs, key, null);
        if (value == null) {
            throw new IllegalArgumentException("Missing required input: " + key);
        }
        return value;
    }

    /** Optional string; {@code defaultValue} when absent or blank. */
    public static String optionalString(Map<String, Object> inputs, String key, String defaultValue) {
        Object v = inputs != null ? inputs.get(key) : null;
        if (v == null) return defaultValue;
        String s = v.toString().trim();
        return s.isEmpty() ? defaultValue : s;
    }

    /** Required list of strings; elements are converted with {@code toString()}, nulls kept as null. */
    public static List<String> requireStringList(Map<String, Object> inputs, String key) {
        List<String> values = optionalStringList(inputs, key);
        if (values == null) {
            throw new IllegalArgumentException("Missing required input: " + key);
        }
        return values;
    }

    /** Optional list of strings; null when absent. */
    public static List<String> optionalStringList(Map<String, Object> inputs, String key) {
        Object v = inputs != null ? inputs.get(key) : null;
        if (v == null) return null;
        if (!(v instanceof List<?> list)) {
            throw new IllegalArgumentException("Input " + key + " must be a list of strings");
        }
        List<String> values = new ArrayList<>(list.size());
        for (Object o : list) {
            values.add(o != null ? o.toString() : null);
        }
        return values;
    }

    /** Required list of row objects (column name → value). */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> requireRows(Map<String, Object> inputs, String key) {
        Object v = inputs != null ? inputs.get(key) : null;
        if (v == null) {
            throw new IllegalArgumentException("Missing required input: " + key);
        }
        if (!(v instanceof List<?> list)) {
            throw new IllegalArgumentException("Input " + key + " must be a list of objects");
        }
        for (Object o : list) {
            if (o != null && !(o instanceof Map)) {
                throw new IllegalArgumentException("Input " + key + " must be a list of objects");
            }
        }
        return (List<Map<String, Object>>) list;
    }
}
