package com.agentgraph.orchestration;

public record RunHandle(
        String threadId,
        String runId
) {
}
