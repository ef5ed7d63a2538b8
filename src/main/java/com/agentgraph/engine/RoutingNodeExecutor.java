package com.agentgraph.engine;

import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.MessageRole;
import com.agentgraph.capability.MessageTag;
import com.agentgraph.capability.ModelRequest;
import com.agentgraph.capability.ModelTurn;
import com.agentgraph.engine.signal.RunSignal;
import com.agentgraph.engine.signal.SignalScope;
import com.agentgraph.graph.AgentDefinition;
import com.agentgraph.graph.ExecutableGraph;
import com.agentgraph.graph.GraphNode;
import com.agentgraph.graph.NodeType;
import com.agentgraph.graph.SupervisorGraphFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.stream.Collectors;

/**
 * The supervisor: asks the model for a {@link RouteDecision} and dispatches to an
 * agent, the responder, or the end of the run. Any failure to obtain a valid
 * decision is a {@link RoutingException}.
 */
@Component
@Slf4j
public class RoutingNodeExecutor implements NodeExecutor {

    private final ModelTurnStreamer streamer;
    private final JsonProcessingService jsonProcessingService;
    private final String responseFormat;

    public RoutingNodeExecutor(ModelTurnStreamer streamer, JsonProcessingService jsonProcessingService) {
        this.streamer = streamer;
        this.jsonProcessingService = jsonProcessingService;
        this.responseFormat = new BeanOutputConverter<>(RouteDecision.class).getFormat();
    }

    @Override
    public NodeType type() {
        return NodeType.ROUTER;
    }

    @Override
    public Transition execute(ExecutableGraph graph, GraphNode node, RunState state, RunContext context) {
        SignalScope scope = SignalScope.routing(node.id(), node.displayName());
        ModelRequest request = ModelRequest.builder()
                .systemPrompt(systemPrompt(graph))
                .messages(state.messages())
                .responseFormat(responseFormat)
                .build();
        ModelTurn turn;
        try {
            turn = streamer.stream(request, scope, context);
        } catch (RunCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new RoutingException("Routing call failed: " + ex.getMessage(), ex);
        }
        RouteDecision decision = jsonProcessingService.parseJsonResponse("routing decision", turn.content(),
                RouteDecision.class);
        if (decision == null || !StringUtils.hasText(decision.next())) {
            throw new RoutingException("Supervisor returned no routing decision");
        }
        RouteTarget target = RouteTarget.parse(decision.next(), graph.agentNames());
        String reason = decision.reason() == null ? "" : decision.reason();
        state.append(ChatMessage.tagged(MessageRole.ASSISTANT,
                "[Supervisor] Routing to " + decision.next().trim() + ": " + reason,
                node.displayName(), MessageTag.ROUTING));
        context.signal(new RunSignal.RoutingDecided(scope,
                target.kind() == RouteTarget.Kind.AGENT ? target.agentName() : null, reason));
        log.info("Supervisor routed to {} ({})", decision.next().trim(), reason);
        return switch (target.kind()) {
            case AGENT -> Transition.to(target.agentName());
            case RESPOND -> Transition.to(SupervisorGraphFactory.RESPONDER_ID);
            case TERMINATE -> Transition.terminate();
        };
    }

    String systemPrompt(ExecutableGraph graph) {
        String names = String.join(", ", graph.agentNames());
        String roster = graph.agents().stream()
                .map(agent -> "- " + agent.name() + ": " + describe(agent))
                .collect(Collectors.joining("\n"));
        return "You are a team supervisor managing agents: " + names + ".\n\n"
                + "Rules:\n"
                + "- Route to the appropriate agent for specialized tasks.\n"
                + "- Choose " + RouteTarget.RESPOND + " for general questions or simple conversations.\n"
                + "- Choose " + RouteTarget.TERMINATE + " when an agent has already provided a complete answer.\n\n"
                + "Agents:\n" + roster;
    }

    private String describe(AgentDefinition agent) {
        return agent.prompt() == null ? "" : agent.prompt().replace('\n', ' ');
    }
}
