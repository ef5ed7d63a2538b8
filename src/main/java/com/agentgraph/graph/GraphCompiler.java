package com.agentgraph.graph;

import com.agentgraph.config.OrchestratorProperties;
import com.agentgraph.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a user-authored node/edge list into an {@link ExecutableGraph}.
 * <p>
 * Only structural problems are rejected here. Cycles are allowed and bounded at
 * runtime by the step limit; fan-out from non-condition nodes is detected when
 * the node is reached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GraphCompiler {

    private final ToolRegistry toolRegistry;
    private final OrchestratorProperties properties;

    public ExecutableGraph compile(List<GraphNode> nodes, List<GraphEdge> edges) {
        if (nodes == null || nodes.isEmpty()) {
            throw new GraphException("Graph has no nodes");
        }
        Map<String, GraphNode> byId = new LinkedHashMap<>();
        String startId = null;
        for (GraphNode node : nodes) {
            if (node == null || !StringUtils.hasText(node.id())) {
                throw new GraphException("Graph contains a node without id");
            }
            if (node.type() == null) {
                throw new GraphException("Node '" + node.id() + "' has no type");
            }
            if (node.type().isSynthetic()) {
                throw new GraphException("Node type '" + node.type().wireName() + "' is reserved");
            }
            if (byId.put(node.id(), node) != null) {
                throw new GraphException("Duplicate node id '" + node.id() + "'");
            }
            if (node.type() == NodeType.START) {
                if (startId != null) {
                    throw new GraphException("Graph has more than one start node");
                }
                startId = node.id();
            }
        }
        if (startId == null) {
            throw new GraphException("Graph has no start node");
        }

        Map<String, List<GraphEdge>> outgoing = new LinkedHashMap<>();
        for (GraphEdge edge : edges == null ? List.<GraphEdge>of() : edges) {
            if (edge == null) {
                throw new GraphException("Graph contains an empty edge");
            }
            if (!byId.containsKey(edge.source()) || !byId.containsKey(edge.target())) {
                throw new GraphException("Edge " + edge.source() + " -> " + edge.target()
                        + " references an unknown node");
            }
            outgoing.computeIfAbsent(edge.source(), key -> new ArrayList<>()).add(edge);
        }
        List<GraphEdge> startEdges = outgoing.getOrDefault(startId, List.of());
        if (startEdges.isEmpty()) {
            throw new GraphException("Start node has no outgoing edge");
        }

        checkToolReferences(byId.values());
        String entry = startEdges.get(0).target();
        log.info("Compiled DAG with {} nodes and {} edges; entry node {}", byId.size(),
                edges == null ? 0 : edges.size(), entry);
        return new ExecutableGraph(GraphMode.DAG, byId, outgoing, entry, Map.of());
    }

    private void checkToolReferences(Iterable<GraphNode> nodes) {
        boolean strict = properties.getDag().isStrictToolReferences();
        for (GraphNode node : nodes) {
            List<String> referenced = switch (node.type()) {
                case AGENT -> node.toolNames();
                case TOOL -> StringUtils.hasText(node.toolName()) ? List.of(node.toolName()) : List.of();
                default -> List.of();
            };
            for (String toolName : referenced) {
                if (toolRegistry.contains(toolName)) {
                    continue;
                }
                if (strict) {
                    throw new GraphException("Node '" + node.id() + "' references unknown tool '" + toolName + "'");
                }
                log.warn("Node '{}' references unknown tool '{}'; it will be skipped at runtime", node.id(), toolName);
            }
        }
    }
}
