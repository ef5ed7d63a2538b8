package com.agentgraph.engine;

import com.agentgraph.capability.AgentTool;
import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.ModelRequest;
import com.agentgraph.capability.ModelTurn;
import com.agentgraph.capability.ToolCall;
import com.agentgraph.config.OrchestratorProperties;
import com.agentgraph.engine.signal.RunSignal;
import com.agentgraph.engine.signal.SignalScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The model/tool loop of an agent: call the model, run the tools it asks for,
 * feed the results back, until a turn asks for no tool or the iteration cap is hit.
 * Each turn runs in its own nested scope {@code <node>/turn-<n>}.
 */
@Component
@Slf4j
public class AgentToolLoop {

    private final ModelTurnStreamer streamer;
    private final ExecutionMetricsService metrics;
    private final OrchestratorProperties properties;

    public AgentToolLoop(ModelTurnStreamer streamer, ExecutionMetricsService metrics,
                         OrchestratorProperties properties) {
        this.streamer = streamer;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * @return the messages the agent produced, in order
     */
    public List<ChatMessage> run(String agentName, String prompt, List<AgentTool> tools,
                                 List<ChatMessage> history, SignalScope scope, RunContext context) {
        Map<String, AgentTool> toolsByName = new LinkedHashMap<>();
        tools.forEach(tool -> toolsByName.put(tool.name(), tool));
        List<ChatMessage> conversation = new ArrayList<>(history);
        List<ChatMessage> produced = new ArrayList<>();
        int maxIterations = Math.max(1, properties.getAgentLoop().getMaxIterations());

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            SignalScope turnScope = scope.child("turn-" + iteration);
            ModelRequest request = ModelRequest.builder()
                    .systemPrompt(prompt)
                    .messages(conversation)
                    .tools(tools)
                    .build();
            ModelTurn turn = streamer.stream(request, turnScope, context);
            ChatMessage reply = ChatMessage.assistant(turn.content(), agentName, turn.toolCalls());
            conversation.add(reply);
            produced.add(reply);
            if (!turn.hasToolCalls()) {
                return produced;
            }
            for (ToolCall call : turn.toolCalls()) {
                context.checkCancelled();
                ChatMessage result = invoke(agentName, toolsByName, call, turnScope, context);
                conversation.add(result);
                produced.add(result);
            }
        }
        log.warn("Agent {} stopped after {} model turns without a final answer", agentName, maxIterations);
        return produced;
    }

    private ChatMessage invoke(String agentName, Map<String, AgentTool> toolsByName, ToolCall call,
                               SignalScope scope, RunContext context) {
        AgentTool tool = toolsByName.get(call.name());
        String output;
        boolean failed = false;
        if (tool == null) {
            log.warn("Agent {} requested unavailable tool {}", agentName, call.name());
            output = "Error: tool '" + call.name() + "' is not available";
            failed = true;
        } else {
            try {
                output = tool.invoke(call.arguments());
            } catch (RuntimeException ex) {
                log.warn("Tool {} failed for agent {}: {}", call.name(), agentName, ex.getMessage());
                output = "Error: " + (ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
                failed = true;
            }
        }
        metrics.recordToolCall(call.name(), failed);
        context.signal(new RunSignal.ToolResult(scope, call.id(), call.name(), output, failed));
        return ChatMessage.toolResult(call.id(), call.name(), output);
    }
}
