package com.agentgraph.engine.signal;

import com.agentgraph.capability.ToolCall;

import java.util.List;

/**
 * Raw, unordered-by-contract observations the engine makes while executing a
 * run. The event normalizer turns them into the client protocol.
 */
public interface RunSignal {

    SignalScope scope();

    record NodeEntered(SignalScope scope) implements RunSignal {
    }

    record NodeExited(SignalScope scope) implements RunSignal {
    }

    record TextDelta(SignalScope scope, String delta) implements RunSignal {
    }

    /**
     * A streamed piece of a tool call. Only the first fragment of a call is
     * guaranteed to carry {@code toolCallId} and {@code toolName}.
     */
    record ToolCallDelta(SignalScope scope, Integer index, String toolCallId, String toolName,
                         String argumentsDelta) implements RunSignal {
    }

    /** End of one model turn, with the tool calls that turn requested. */
    record ModelCompleted(SignalScope scope, List<ToolCall> toolCalls) implements RunSignal {

        public ModelCompleted {
            toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        }
    }

    record ToolResult(SignalScope scope, String toolCallId, String toolName, String content,
                      boolean error) implements RunSignal {
    }

    /** {@code target} is the chosen agent, or {@code null} for respond/terminate. */
    record RoutingDecided(SignalScope scope, String target, String reason) implements RunSignal {
    }

    record NodeFailed(SignalScope scope, String message) implements RunSignal {
    }
}
