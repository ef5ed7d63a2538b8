package com.agentgraph.capability;

/**
 * A named capability an agent or a tool node can invoke.
 */
public interface AgentTool {

    String name();

    String description();

    /**
     * JSON schema of the arguments object.
     */
    String inputSchema();

    /**
     * Runs the tool with a JSON arguments object and returns its textual output.
     *
     * @throws ToolExecutionException when the tool fails
     */
    String invoke(String argumentsJson);
}
