package com.agentgraph.engine;

import com.agentgraph.graph.ConditionRouter;
import com.agentgraph.graph.ExecutableGraph;
import com.agentgraph.graph.GraphEdge;
import com.agentgraph.graph.GraphNode;
import com.agentgraph.graph.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Slf4j
public class ConditionNodeExecutor implements NodeExecutor {

    @Override
    public NodeType type() {
        return NodeType.CONDITION;
    }

    @Override
    public Transition execute(ExecutableGraph graph, GraphNode node, RunState state, RunContext context) {
        Optional<GraphEdge> edge = ConditionRouter.select(graph.outgoing(node.id()), state.latestContent());
        if (edge.isEmpty()) {
            log.info("Condition {} has no outgoing edges; terminating", node.id());
            return Transition.terminate();
        }
        log.info("Condition {} routed to {} (keyword={})", node.id(), edge.get().target(), edge.get().condition());
        return Transition.to(edge.get().target());
    }
}
