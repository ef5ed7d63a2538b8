package com.agentgraph.orchestration;

import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.RunOptions;

import java.util.List;

/**
 * @param threadId  conversation to continue; a new one is started when {@code null}
 * @param messages  new messages of this turn, appended to the thread history
 * @param graph     user-authored graph; supervisor mode when absent
 * @param options   model selection for the run
 * @param stepLimit overrides the mode's default step limit when positive
 */
public record OrchestrationRequest(
        String threadId,
        List<ChatMessage> messages,
        WorkflowGraph graph,
        RunOptions options,
        Integer stepLimit
) {

    public OrchestrationRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        options = options == null ? RunOptions.defaults() : options;
    }

    public boolean isDag() {
        return graph != null && !graph.isEmpty();
    }
}
