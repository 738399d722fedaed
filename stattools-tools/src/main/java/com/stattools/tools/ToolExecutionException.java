package com.stattools.tools;

/**
 * Thrown by {@link ToolExecutor} when a tool fails for a reason other than invalid input or an
 * unresolvable formula.
 */
public final class ToolExecutionException extends RuntimeException {

    private final String toolId;

    public ToolExecutionException(String toolId, Throwable cause) {
        super("Tool execution failed: " + toolId + " - " + cause.getMessage(), cause);
        this.toolId = toolId;
    }

    public String getToolId() {
        return toolId;
    }
}
