package com.agentgraph.capability;

/**
 * Partial tool call streamed by a model. Providers send the id and name once and
 * then only argument deltas keyed by {@code index}.
 */
public record ToolCallFragment(
        Integer index,
        String id,
        String name,
        String argumentsDelta
) {
}
