package com.agentgraph.graph;

import com.agentgraph.capability.AgentTool;

import java.util.List;

public record AgentDefinition(
        String name,
        String prompt,
        List<AgentTool> tools
) {

    public AgentDefinition {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public List<String> toolNames() {
        return tools.stream().map(AgentTool::name).toList();
    }
}
