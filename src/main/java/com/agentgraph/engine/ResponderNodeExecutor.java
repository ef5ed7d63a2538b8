package com.agentgraph.engine;

import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.MessageTag;
import com.agentgraph.capability.ModelRequest;
import com.agentgraph.capability.ModelTurn;
import com.agentgraph.engine.signal.SignalScope;
import com.agentgraph.graph.ExecutableGraph;
import com.agentgraph.graph.GraphNode;
import com.agentgraph.graph.NodeType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Answers the user directly, without tools and without the supervisor's
 * routing notes in its context.
 */
@Component
@RequiredArgsConstructor
public class ResponderNodeExecutor implements NodeExecutor {

    static final String RESPONDER_PROMPT =
            "You are a helpful AI assistant. Answer naturally. Respond in the same language as the user.";

    private final ModelTurnStreamer streamer;

    @Override
    public NodeType type() {
        return NodeType.RESPONDER;
    }

    @Override
    public Transition execute(ExecutableGraph graph, GraphNode node, RunState state, RunContext context) {
        List<ChatMessage> visible = state.messages().stream()
                .filter(message -> !message.hasTag(MessageTag.ROUTING))
                .toList();
        ModelRequest request = ModelRequest.builder()
                .systemPrompt(RESPONDER_PROMPT)
                .messages(visible)
                .build();
        ModelTurn turn = streamer.stream(request, SignalScope.node(node.id(), node.displayName()), context);
        state.append(ChatMessage.assistant(turn.content(), node.displayName(), List.of()));
        return Transition.terminate();
    }
}
