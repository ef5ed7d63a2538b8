package com.agentgraph.capability;

public record ToolCall(
        String id,
        String name,
        String arguments
) {
}
