package com.agentgraph.engine;

import com.agentgraph.capability.AgentTool;
import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.MessageRole;
import com.agentgraph.capability.MessageTag;
import com.agentgraph.engine.signal.RunSignal;
import com.agentgraph.engine.signal.SignalScope;
import com.agentgraph.graph.ExecutableGraph;
import com.agentgraph.graph.GraphNode;
import com.agentgraph.graph.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Invokes a tool directly with the node's static input; no model is involved.
 * String input values may use {@code {{input}}} (latest message) and
 * {@code {{userInput}}} (latest user message).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolNodeExecutor implements NodeExecutor {

    static final String INPUT_PLACEHOLDER = "{{input}}";
    static final String USER_INPUT_PLACEHOLDER = "{{userInput}}";

    private final JsonProcessingService jsonProcessingService;
    private final ExecutionMetricsService metrics;

    @Override
    public NodeType type() {
        return NodeType.TOOL;
    }

    @Override
    public Transition execute(ExecutableGraph graph, GraphNode node, RunState state, RunContext context) {
        String toolName = node.toolName();
        Optional<AgentTool> tool = context.tools().find(toolName);
        if (tool.isEmpty()) {
            log.warn("Tool node {} references unknown tool '{}'; passing state through", node.id(), toolName);
            return Transition.next();
        }
        String arguments = jsonProcessingService.toJson(render(node.toolInput(), state));
        String callId = "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        SignalScope scope = SignalScope.node(node.id(), node.displayName()).child(toolName);
        context.signal(new RunSignal.ToolCallDelta(scope, 0, callId, toolName, arguments));

        String output;
        try {
            output = tool.get().invoke(arguments);
        } catch (RuntimeException ex) {
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            metrics.recordToolCall(toolName, true);
            context.signal(new RunSignal.ToolResult(scope, callId, toolName, "Error: " + message, true));
            throw new NodeExecutionException(node.displayName(), message, ex);
        }
        metrics.recordToolCall(toolName, false);
        context.signal(new RunSignal.ToolResult(scope, callId, toolName, output, false));
        state.append(ChatMessage.tagged(MessageRole.USER, "[Tool " + toolName + "]: " + output,
                node.displayName(), MessageTag.TOOL_OUTPUT));
        return Transition.next();
    }

    Map<String, Object> render(Map<String, Object> input, RunState state) {
        Map<String, Object> rendered = new LinkedHashMap<>();
        input.forEach((key, value) -> {
            if (value instanceof String text) {
                rendered.put(key, text
                        .replace(INPUT_PLACEHOLDER, state.latestContent())
                        .replace(USER_INPUT_PLACEHOLDER, state.latestUserContent()));
            } else {
                rendered.put(key, value);
            }
        });
        return rendered;
    }
}
