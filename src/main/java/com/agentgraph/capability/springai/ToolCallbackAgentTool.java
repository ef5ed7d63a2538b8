package com.agentgraph.capability.springai;

import com.agentgraph.capability.AgentTool;
import com.agentgraph.capability.ToolExecutionException;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.util.StringUtils;

/**
 * Adapts a Spring AI {@link ToolCallback} (for example one supplied by an MCP
 * client) to the engine's {@link AgentTool} contract.
 */
public final class ToolCallbackAgentTool implements AgentTool {

    private static final String EMPTY_SCHEMA = "{\"type\":\"object\",\"properties\":{}}";

    private final ToolCallback delegate;

    public ToolCallbackAgentTool(ToolCallback delegate) {
        this.delegate = delegate;
    }

    @Override
    public String name() {
        return delegate.getToolDefinition().name();
    }

    @Override
    public String description() {
        String description = delegate.getToolDefinition().description();
        return description == null ? "" : description;
    }

    @Override
    public String inputSchema() {
        ToolDefinition definition = delegate.getToolDefinition();
        return StringUtils.hasText(definition.inputSchema()) ? definition.inputSchema() : EMPTY_SCHEMA;
    }

    @Override
    public String invoke(String argumentsJson) {
        try {
            return delegate.call(StringUtils.hasText(argumentsJson) ? argumentsJson : "{}");
        } catch (ToolExecutionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ToolExecutionException(name(), ex.getMessage(), ex);
        }
    }
}
