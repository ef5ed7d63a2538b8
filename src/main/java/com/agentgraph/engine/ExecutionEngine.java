package com.agentgraph.engine;

import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.MessageRole;
import com.agentgraph.capability.MessageTag;
import com.agentgraph.engine.signal.RunSignal;
import com.agentgraph.engine.signal.SignalScope;
import com.agentgraph.graph.ExecutableGraph;
import com.agentgraph.graph.GraphEdge;
import com.agentgraph.graph.GraphException;
import com.agentgraph.graph.GraphNode;
import com.agentgraph.graph.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Walks an {@link ExecutableGraph} one node at a time.
 * <p>
 * A node that fails is recorded as an error message and the run continues with
 * the node's normal successor. Routing failures, graph errors and cancellation
 * end the run and propagate to the caller. Reaching the step limit ends the run
 * normally.
 */
@Component
@Slf4j
public class ExecutionEngine {

    private final Map<NodeType, NodeExecutor> executors = new EnumMap<>(NodeType.class);
    private final ExecutionMetricsService metrics;

    public ExecutionEngine(List<NodeExecutor> nodeExecutors, ExecutionMetricsService metrics) {
        nodeExecutors.forEach(executor -> executors.put(executor.type(), executor));
        this.metrics = metrics;
    }

    public RunOutcome execute(ExecutableGraph graph, List<ChatMessage> initialMessages, RunContext context) {
        RunState state = new RunState(initialMessages);
        String current = graph.entryNodeId();
        int steps = 0;
        boolean stepLimitReached = false;

        while (current != null) {
            context.checkCancelled();
            GraphNode node = graph.node(current);
            if (node.type() == NodeType.END) {
                break;
            }
            if (node.type() == NodeType.START) {
                current = follow(graph, node);
                continue;
            }
            if (steps >= context.stepLimit()) {
                log.warn("Step limit {} reached at node {}; ending run", context.stepLimit(), node.id());
                stepLimitReached = true;
                break;
            }
            steps++;
            Transition transition = runNode(graph, node, state, context);
            current = switch (transition.kind()) {
                case TERMINATE -> null;
                case GOTO -> transition.target();
                case NEXT -> follow(graph, node);
            };
        }

        RunOutcome outcome = new RunOutcome(state.messages(), state.produced(), steps, stepLimitReached);
        metrics.recordRun(outcome);
        return outcome;
    }

    private Transition runNode(ExecutableGraph graph, GraphNode node, RunState state, RunContext context) {
        NodeExecutor executor = executors.get(node.type());
        if (executor == null) {
            throw new GraphException("No executor for node type '" + node.type().wireName() + "'");
        }
        SignalScope scope = node.type() == NodeType.ROUTER
                ? SignalScope.routing(node.id(), node.displayName())
                : SignalScope.node(node.id(), node.displayName());
        log.info("Entering node {} ({})", node.id(), node.type().wireName());
        context.signal(new RunSignal.NodeEntered(scope));
        Transition transition;
        try {
            transition = executor.execute(graph, node, state, context);
        } catch (RunCancelledException | RoutingException | GraphException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            log.error("Node {} failed: {}", node.id(), message, ex);
            state.append(ChatMessage.tagged(MessageRole.ASSISTANT,
                    "[Error in " + node.displayName() + "]: " + message, node.displayName(), MessageTag.ERROR));
            context.signal(new RunSignal.NodeFailed(scope, message));
            transition = Transition.next();
        }
        context.signal(new RunSignal.NodeExited(scope));
        return transition;
    }

    private String follow(ExecutableGraph graph, GraphNode node) {
        List<GraphEdge> edges = graph.outgoing(node.id());
        if (edges.isEmpty()) {
            return null;
        }
        if (edges.size() > 1) {
            throw new GraphException("Node '" + node.id() + "' has " + edges.size()
                    + " outgoing edges; only condition nodes may branch");
        }
        return edges.get(0).target();
    }
}
