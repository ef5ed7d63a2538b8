package com.agentgraph.graph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the star-shaped supervisor graph: a routing node, a responder and one
 * node per agent. Every agent returns to the routing node; the responder ends
 * the run.
 */
@Component
@Slf4j
public class SupervisorGraphFactory {

    public static final String ROUTER_ID = "supervisor";
    public static final String RESPONDER_ID = "responder";

    public ExecutableGraph create(List<AgentDefinition> agents) {
        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        Map<String, List<GraphEdge>> outgoing = new LinkedHashMap<>();
        Map<String, AgentDefinition> roster = new LinkedHashMap<>();

        nodes.put(ROUTER_ID, GraphNode.of(ROUTER_ID, NodeType.ROUTER, ROUTER_ID));
        nodes.put(RESPONDER_ID, GraphNode.of(RESPONDER_ID, NodeType.RESPONDER, RESPONDER_ID));
        List<GraphEdge> routerEdges = new ArrayList<>();

        for (AgentDefinition agent : agents == null ? List.<AgentDefinition>of() : agents) {
            String name = agent.name();
            if (!StringUtils.hasText(name)) {
                throw new GraphException("Agent definition without name");
            }
            if (ROUTER_ID.equals(name) || RESPONDER_ID.equals(name)) {
                throw new GraphException("Agent name '" + name + "' is reserved");
            }
            if (roster.put(name, agent) != null) {
                throw new GraphException("Duplicate agent '" + name + "'");
            }
            nodes.put(name, new GraphNode(name, NodeType.AGENT, name,
                    Map.of("prompt", agent.prompt() == null ? "" : agent.prompt(), "tools", agent.toolNames())));
            routerEdges.add(GraphEdge.of(ROUTER_ID, name));
            outgoing.put(name, List.of(GraphEdge.of(name, ROUTER_ID)));
        }
        routerEdges.add(GraphEdge.of(ROUTER_ID, RESPONDER_ID));
        outgoing.put(ROUTER_ID, routerEdges);

        log.info("Created supervisor graph with agents: {}", roster.values().stream()
                .map(agent -> agent.name() + agent.toolNames())
                .toList());
        return new ExecutableGraph(GraphMode.SUPERVISOR, nodes, outgoing, ROUTER_ID, roster);
    }
}
