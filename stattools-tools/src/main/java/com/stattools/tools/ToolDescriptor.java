package com.stattools.tools;

import java.util.Map;

/**
 * Metadata a tool exposes to the calling agent: id, description, category, and parameter schema.
 * {@link ToolProvider} extends this with defaults so every tool can contribute.
 */
public interface ToolDescriptor {

    /** Tool id (e.g. RESOLVE_FORMULA, CLASSIFY_COLUMN). */
    String getToolId();

    /** Human-readable description. */
    String getDescription();

    /** Category name for grouping (FORMULA, DATA_PREP, etc.). */
    String getCategoryName();

    /** Input parameter names to schema type (e.g. "formula" → "STRING"). */
    Map<String, String> getInputSchema();

    /** Output parameter names to schema type (e.g. "formula" → "STRING"). */
    Map<String, String> getOutputSchema();

    /** Version (e.g. "1.0"). */
    String getVersion();
}
