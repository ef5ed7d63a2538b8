package com.agentgraph.api;

public record CancelRunResponse(
        String runId,
        String status,
        String message
) {
    public static CancelRunResponse cancelled(String runId) {
        return new CancelRunResponse(runId, "cancelled", "Run cancellation requested.");
    }

    public static CancelRunResponse notFound(String runId) {
        return new CancelRunResponse(runId, "not-found", "Run not found.");
    }
}
