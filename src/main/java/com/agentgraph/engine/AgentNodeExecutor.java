package com.agentgraph.engine;

import com.agentgraph.capability.AgentTool;
import com.agentgraph.capability.ChatMessage;
import com.agentgraph.engine.signal.SignalScope;
import com.agentgraph.graph.AgentDefinition;
import com.agentgraph.graph.ExecutableGraph;
import com.agentgraph.graph.GraphNode;
import com.agentgraph.graph.NodeType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class AgentNodeExecutor implements NodeExecutor {

    private final AgentToolLoop toolLoop;

    @Override
    public NodeType type() {
        return NodeType.AGENT;
    }

    @Override
    public Transition execute(ExecutableGraph graph, GraphNode node, RunState state, RunContext context) {
        Optional<AgentDefinition> definition = graph.agent(node.id());
        List<AgentTool> tools = definition.map(AgentDefinition::tools)
                .orElseGet(() -> context.tools().resolve(node.toolNames()));
        String prompt = definition.map(AgentDefinition::prompt).orElseGet(node::prompt);
        List<ChatMessage> produced = toolLoop.run(node.displayName(), prompt, tools, state.messages(),
                SignalScope.node(node.id(), node.displayName()), context);
        state.appendAll(produced);
        return Transition.next();
    }
}
