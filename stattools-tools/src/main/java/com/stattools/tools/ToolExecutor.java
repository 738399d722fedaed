package com.stattools.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stattools.config.SessionConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Resolves tools from a {@link ToolRegistry} by id and invokes them, with JSON in/out for the agent
 * transport. Unchecked exceptions from a tool (invalid input, unresolvable formula) propagate unchanged so
 * the agent sees the offending value and can retry; checked exceptions are wrapped in
 * {@link ToolExecutionException}.
 * <p>
 * Each call increments {@value #INVOCATIONS_METRIC} tagged with {@code tool} and {@code outcome}.
 */
public final class ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);

    static final String INVOCATIONS_METRIC = "stattools.tool.invocations";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ToolRegistry registry;
    private final MeterRegistry meterRegistry;

    public ToolExecutor(ToolRegistry registry) {
        this(registry, new SimpleMeterRegistry());
    }

    public ToolExecutor(ToolRegistry registry, MeterRegistry meterRegistry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    /**
     * Invokes the tool with a JSON object of inputs and returns its outputs as JSON.
     *
     * @param toolId     registered tool id
     * @param inputsJson JSON object (null or blank = no inputs)
     * @param session    session config; null = {@link SessionConfig#EMPTY}
     * @throws IllegalArgumentException if the tool is unknown or the JSON is invalid
     */
    public String execute(String toolId, String inputsJson, SessionConfig session) {
        Map<String, Object> inputs;
        try {
            inputs = inputsJson == null || inputsJson.isBlank() ? Map.of() : MAPPER.readValue(inputsJson, MAP_TYPE);
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid inputs JSON for tool " + toolId + ": " + e.getMessage(), e);
        }
        Map<String, Object> outputs = execute(toolId, inputs, session);
        try {
            return MAPPER.writeValueAsString(outputs);
        } catch (Exception e) {
            throw new ToolExecutionException(toolId, e);
        }
    }

    /**
     * Invokes the tool with an input map.
     *
     * @throws IllegalArgumentException if the tool is unknown
     */
    public Map<String, Object> execute(String toolId, Map<String, Object> inputs, SessionConfig session) {
        Tool tool = registry.getTool(toolId);
        if (tool == null) {
            throw new IllegalArgumentException("No tool registered with id=" + toolId);
        }
        SessionConfig sessionConfig = session != null ? session : SessionConfig.EMPTY;
        try {
            Map<String, Object> outputs = tool.execute(inputs != null ? inputs : Map.of(), sessionConfig);
            record(toolId, "success");
            return outputs != null ? outputs : Map.of();
        } catch (RuntimeException e) {
            record(toolId, "failure");
            log.warn("Tool {} failed for session={}: {}", toolId, sessionConfig.getSessionId(), e.getMessage());
            throw e;
        } catch (Exception e) {
            record(toolId, "failure");
            throw new ToolExecutionException(toolId, e);
        }
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    private void record(String toolId, String outcome) {
        meterRegistry.counter(INVOCATIONS_METRIC, "tool", toolId, "outcome", outcome).increment();
    }
}
