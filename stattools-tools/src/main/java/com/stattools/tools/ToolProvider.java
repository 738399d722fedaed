package com.stattools.tools;

import java.util.Collections;
import java.util.Map;

/**
 * Provider for a tool: the tool instance plus its {@link ToolDescriptor} metadata.
 * Providers are registered with a {@link ToolRegistry} and invoked by id through {@link ToolExecutor}.
 */
public interface ToolProvider extends ToolDescriptor {

    /**
     * Category for grouping.
     */
    ToolCategory getCategory();

    /** Tool instance; shared across calls. */
    Tool getTool();

    /**
     * Whether this provider should be registered. Override to skip registration when a required
     * resource is unavailable.
     */
    default boolean isEnabled() {
        return true;
    }

    @Override
    default Map<String, String> getInputSchema() {
        return Collections.emptyMap();
    }

    @Override
    default Map<String, String> getOutputSchema() {
        return Collections.emptyMap();
    }

    @Override
    default String getVersion() {
        return "1.0";
    }

    @Override
    default String getCategoryName() {
        ToolCategory cat = getCategory();
        return cat != null ? cat.name() : "OTHER";
    }
}
