package com.agentgraph.api;

import com.agentgraph.capability.RunOptions;
import com.agentgraph.orchestration.OrchestrationRequest;
import com.agentgraph.orchestration.WorkflowGraph;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record ChatRequest(
        String threadId,
        @NotEmpty List<@Valid MessageInput> messages,
        WorkflowGraph graph,
        RunOptions options,
        @Positive Integer stepLimit
) {

    OrchestrationRequest toOrchestrationRequest() {
        return new OrchestrationRequest(
                threadId,
                messages.stream().map(MessageInput::toChatMessage).toList(),
                graph,
                options,
                stepLimit);
    }
}
