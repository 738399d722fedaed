/**
 * Tool contract for the agent-facing layer: tools are named, described, and invoked with a map of inputs.
 * <p>
 * Implement {@link com.stattools.tools.ToolProvider} and register it with a
 * {@link com.stattools.tools.ToolRegistry} (see {@code com.stattools.internal.tools.InternalTools});
 * the agent transport calls {@link com.stattools.tools.ToolExecutor} with the tool id and JSON arguments.
 */
package com.stattools.tools;
