package com.stattools.tools;

import com.stattools.config.SessionConfig;

import java.util.Map;

/**
 * A named tool the agent can call: execute with an input map and the session config, return an output map.
 * <p>
 * <b>Threading and state:</b> one instance serves every call of every session and may be invoked
 * concurrently. Implementations hold only read-only state built at construction (e.g. a compiled rule set).
 */
public interface Tool {

    /**
     * Executes the tool with the given inputs.
     *
     * @param inputs  map of parameter names to values (tool-specific; see {@link ToolProvider#getInputSchema()})
     * @param session session config; never null
     * @return map of output names to values
     * @throws IllegalArgumentException on missing or mistyped inputs
     * @throws Exception on execution failure
     */
    Map<String, Object> execute(Map<String, Object> inputs, SessionConfig session) throws Exception;
}
