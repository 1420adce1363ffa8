package com.dburyak.proxybase.mcp.err;

/**
 * Tool-level failure. Never becomes a JSON-RPC error: the message is handed back to the agent as tool output flagged
 * with {@code isError}, so the agent can read it and decide what to do next.
 */
public class ToolCallException extends RuntimeException {

    public ToolCallException(String message) {
        super(message);
    }

    public ToolCallException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ToolCallException missingArgument(String argName) {
        return new ToolCallException("Missing required argument: " + argName);
    }

    public static ToolCallException unknownTool(String toolName) {
        return new ToolCallException("Unknown tool: " + toolName);
    }
}
