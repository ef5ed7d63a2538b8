package com.agentgraph.capability;

import java.util.List;

/**
 * The assembled result of one model call.
 */
public record ModelTurn(
        String content,
        List<ToolCall> toolCalls
) {

    public ModelTurn {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelTurn text(String content) {
        return new ModelTurn(content, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
