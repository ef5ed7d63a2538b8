package com.agentgraph.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Structured output of the supervisor's routing call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RouteDecision(
        @JsonPropertyDescription("Agent name to route to, RESPOND to answer directly, or TERMINATE when done")
        String next,
        @JsonPropertyDescription("Brief reason for this routing decision")
        String reason
) {
}
