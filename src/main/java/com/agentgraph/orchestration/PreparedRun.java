package com.agentgraph.orchestration;

import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.RunOptions;
import com.agentgraph.engine.ToolResolver;
import com.agentgraph.graph.ExecutableGraph;

import java.util.List;

/**
 * A request that passed graph construction and is ready to execute.
 *
 * @param messages    thread history followed by the request's new messages
 * @param newMessages the request's own messages
 */
public record PreparedRun(
        String threadId,
        ExecutableGraph graph,
        List<ChatMessage> messages,
        List<ChatMessage> newMessages,
        ToolResolver tools,
        RunOptions options,
        int stepLimit
) {
}
