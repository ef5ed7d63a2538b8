package com.agentgraph.orchestration;

import com.agentgraph.graph.GraphEdge;
import com.agentgraph.graph.GraphNode;

import java.util.List;

/**
 * A user-authored graph as submitted with a request.
 */
public record WorkflowGraph(
        List<GraphNode> nodes,
        List<GraphEdge> edges
) {

    public WorkflowGraph {
        nodes = nodes == null ? List.of() : nodes;
        edges = edges == null ? List.of() : edges;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
