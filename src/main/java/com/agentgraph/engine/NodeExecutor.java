package com.agentgraph.engine;

import com.agentgraph.graph.ExecutableGraph;
import com.agentgraph.graph.GraphNode;
import com.agentgraph.graph.NodeType;

/**
 * Runs one kind of node.
 */
public interface NodeExecutor {

    NodeType type();

    Transition execute(ExecutableGraph graph, GraphNode node, RunState state, RunContext context);
}
