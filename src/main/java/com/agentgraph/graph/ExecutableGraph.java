package com.agentgraph.graph;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A validated, immutable graph ready for the execution engine.
 */
public final class ExecutableGraph {

    private final GraphMode mode;
    private final Map<String, GraphNode> nodes;
    private final Map<String, List<GraphEdge>> outgoing;
    private final String entryNodeId;
    private final Map<String, AgentDefinition> agents;

    ExecutableGraph(GraphMode mode,
                    Map<String, GraphNode> nodes,
                    Map<String, List<GraphEdge>> outgoing,
                    String entryNodeId,
                    Map<String, AgentDefinition> agents) {
        this.mode = mode;
        this.nodes = Map.copyOf(nodes);
        Map<String, List<GraphEdge>> edges = new LinkedHashMap<>();
        outgoing.forEach((source, list) -> edges.put(source, List.copyOf(list)));
        this.outgoing = edges;
        this.entryNodeId = entryNodeId;
        this.agents = new LinkedHashMap<>(agents);
    }

    public GraphMode mode() {
        return mode;
    }

    public String entryNodeId() {
        return entryNodeId;
    }

    public GraphNode node(String id) {
        GraphNode node = nodes.get(id);
        if (node == null) {
            throw new GraphException("Unknown node '" + id + "'");
        }
        return node;
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public List<GraphEdge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public Optional<AgentDefinition> agent(String nodeId) {
        return Optional.ofNullable(agents.get(nodeId));
    }

    /** Agent names a routing node may dispatch to, in roster order. */
    public Collection<String> agentNames() {
        return agents.keySet();
    }

    public Collection<AgentDefinition> agents() {
        return agents.values();
    }

    public int size() {
        return nodes.size();
    }
}
