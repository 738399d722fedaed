package com.stattools.tools;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of tool providers by tool id. Populated at startup, read concurrently afterwards.
 */
public final class ToolRegistry {

    /** toolId → provider */
    private final Map<String, ToolProvider> providersById = new ConcurrentHashMap<>();

    /**
     * Registers a provider under its {@link ToolProvider#getToolId()}.
     *
     * @throws IllegalArgumentException if the id is blank or already registered
     */
    public void register(ToolProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String id = Objects.requireNonNull(provider.getToolId(), "toolId").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Tool id must be non-blank");
        }
        if (providersById.putIfAbsent(id, provider) != null) {
            throw new IllegalArgumentException("Tool already registered: " + id);
        }
    }

    /**
     * Returns the provider for the given id, or null if not registered.
     */
    public ToolProvider get(String toolId) {
        if (toolId == null || toolId.isBlank()) return null;
        return providersById.get(toolId.trim());
    }

    /**
     * Returns the tool for the given id, or null if not registered.
     */
    public Tool getTool(String toolId) {
        ToolProvider provider = get(toolId);
        return provider != null ? provider.getTool() : null;
    }

    /** All registered providers, ordered by tool id. */
    public List<ToolProvider> getAll() {
        List<ToolProvider> all = new ArrayList<>(providersById.values());
        all.sort(Comparator.comparing(ToolProvider::getToolId));
        return all;
    }

    /** All tool descriptors for the agent's tool list, ordered by tool id. */
    public List<ToolDescriptor> describe() {
        return new ArrayList<>(getAll());
    }

    public int size() {
        return providersById.size();
    }

    /** Removes all registrations (mainly for tests). */
    public void clear() {
        providersById.clear();
    }
}
