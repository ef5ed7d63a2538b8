package com.agentgraph.engine;

import com.agentgraph.capability.LanguageModel;
import com.agentgraph.capability.ModelChunk;
import com.agentgraph.capability.ModelRequest;
import com.agentgraph.capability.ModelTurn;
import com.agentgraph.capability.ToolCallFragment;
import com.agentgraph.engine.signal.RunSignal;
import com.agentgraph.engine.signal.SignalScope;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Streams one model turn, translating chunks into run signals as they arrive.
 */
@Component
@RequiredArgsConstructor
public class ModelTurnStreamer {

    private final ExecutionMetricsService metrics;

    public ModelTurn stream(ModelRequest request, SignalScope scope, RunContext context) {
        context.checkCancelled();
        metrics.recordModelCall(scope.stepName(), scope.routing() ? "routing" : "turn");
        LanguageModel model = context.model();
        ModelTurn turn = model.stream(request, chunk -> onChunk(chunk, scope, context));
        context.checkCancelled();
        context.signal(new RunSignal.ModelCompleted(scope, turn.toolCalls()));
        return turn;
    }

    private void onChunk(ModelChunk chunk, SignalScope scope, RunContext context) {
        context.checkCancelled();
        if (chunk.hasContent()) {
            context.signal(new RunSignal.TextDelta(scope, chunk.contentDelta()));
        }
        for (ToolCallFragment fragment : chunk.toolCallFragments()) {
            context.signal(new RunSignal.ToolCallDelta(scope, fragment.index(), fragment.id(), fragment.name(),
                    fragment.argumentsDelta()));
        }
    }
}
