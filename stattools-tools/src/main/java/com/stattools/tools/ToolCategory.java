package com.stattools.tools;

/**
 * Category for tool discovery and grouping in the agent's tool list.
 */
public enum ToolCategory {

    /** Model-formula handling (e.g. RESOLVE_FORMULA). */
    FORMULA,

    /** Data preparation / cleaning (e.g. CLEAN_COLUMN_NAMES). */
    DATA_PREP,

    /** Categorical enrichment (e.g. CLASSIFY_COLUMN). */
    CLASSIFICATION,

    /** Other / custom. */
    OTHER
}
