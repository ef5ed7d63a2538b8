package com.agentgraph.graph;

import org.springframework.util.StringUtils;

public record GraphEdge(
        String source,
        String target,
        String condition
) {

    public static GraphEdge of(String source, String target) {
        return new GraphEdge(source, target, null);
    }

    public boolean hasCondition() {
        return StringUtils.hasText(condition);
    }
}
