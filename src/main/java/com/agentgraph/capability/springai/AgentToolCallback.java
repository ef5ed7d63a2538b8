package com.agentgraph.capability.springai;

import com.agentgraph.capability.AgentTool;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Exposes an {@link AgentTool} to Spring AI so its definition reaches the model.
 */
final class AgentToolCallback implements ToolCallback {

    private final AgentTool tool;
    private final ToolDefinition definition;

    AgentToolCallback(AgentTool tool) {
        this.tool = tool;
        this.definition = ToolDefinition.builder()
                .name(tool.name())
                .description(tool.description())
                .inputSchema(tool.inputSchema())
                .build();
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        return tool.invoke(toolInput);
    }
}
