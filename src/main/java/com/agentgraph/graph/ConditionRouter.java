package com.agentgraph.graph;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Edge selection for condition nodes: the first edge whose keyword occurs in the
 * content (case-insensitive), then the first edge without a keyword, then the
 * first edge. No edges means the run terminates.
 */
public final class ConditionRouter {

    private ConditionRouter() {
    }

    public static Optional<GraphEdge> select(List<GraphEdge> edges, String content) {
        if (edges == null || edges.isEmpty()) {
            return Optional.empty();
        }
        String haystack = content == null ? "" : content.toLowerCase(Locale.ROOT);
        for (GraphEdge edge : edges) {
            if (edge.hasCondition() && haystack.contains(edge.condition().toLowerCase(Locale.ROOT))) {
                return Optional.of(edge);
            }
        }
        return edges.stream()
                .filter(edge -> !edge.hasCondition())
                .findFirst()
                .or(() -> Optional.of(edges.get(0)));
    }
}
