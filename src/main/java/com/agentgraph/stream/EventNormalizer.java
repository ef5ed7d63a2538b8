package com.agentgraph.stream;

import com.agentgraph.capability.ToolCall;
import com.agentgraph.engine.signal.RunSignal;
import com.agentgraph.engine.signal.RunSignal.ModelCompleted;
import com.agentgraph.engine.signal.RunSignal.NodeEntered;
import com.agentgraph.engine.signal.RunSignal.NodeExited;
import com.agentgraph.engine.signal.RunSignal.NodeFailed;
import com.agentgraph.engine.signal.RunSignal.RoutingDecided;
import com.agentgraph.engine.signal.RunSignal.TextDelta;
import com.agentgraph.engine.signal.RunSignal.ToolCallDelta;
import com.agentgraph.engine.signal.RunSignal.ToolResult;
import com.agentgraph.engine.signal.SignalListener;
import com.agentgraph.engine.signal.SignalScope;
import com.agentgraph.protocol.ProtocolEvent;
import com.agentgraph.protocol.ProtocolEventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns the engine's raw signals of one run into a well-formed protocol event
 * stream.
 * <p>
 * Guarantees on the output:
 * <ul>
 *     <li>text messages are {@code START, CONTENT*, END} and never interleave;</li>
 *     <li>every tool call is {@code START, ARGS*, END, RESULT} exactly once per id;</li>
 *     <li>routing rationale never reaches the client;</li>
 *     <li>text of a turn that requested a tool is dropped;</li>
 *     <li>{@code STEP_FINISHED} follows the step's last text and is emitted once per activation.</li>
 * </ul>
 * One instance per run. Faults inside the normalizer are logged, never thrown.
 */
@Slf4j
public class EventNormalizer implements SignalListener {

    public static final String NODE_ERROR_EVENT = "node_error";

    private final ProtocolEventSink sink;
    private final NormalizerPolicy policy;
    private final InlineToolMarkupFilter markupFilter;
    private final Supplier<String> idGenerator;

    private final Set<String> activeSteps = new LinkedHashSet<>();
    private final Map<String, TurnBuffer> turns = new LinkedHashMap<>();
    private final Map<String, String> callIdsByIndex = new HashMap<>();
    private final Map<String, String> callNames = new HashMap<>();
    private final Set<String> startedCalls = new LinkedHashSet<>();
    private final Set<String> callsWithArgs = new HashSet<>();
    private final Set<String> endedCalls = new HashSet<>();
    private final Set<String> resultCalls = new HashSet<>();

    private String openMessageId;
    private String openMessagePath;

    public EventNormalizer(ProtocolEventSink sink, NormalizerPolicy policy) {
        this(sink, policy, () -> UUID.randomUUID().toString());
    }

    public EventNormalizer(ProtocolEventSink sink, NormalizerPolicy policy, Supplier<String> idGenerator) {
        this.sink = sink;
        this.policy = policy;
        this.markupFilter = new InlineToolMarkupFilter(policy.markupTags());
        this.idGenerator = idGenerator;
    }

    @Override
    public synchronized void onSignal(RunSignal signal) {
        try {
            dispatch(signal);
        } catch (RuntimeException ex) {
            log.warn("Failed to normalize {} from {}: {}", signal.getClass().getSimpleName(),
                    signal.scope() == null ? "?" : signal.scope().path(), ex.getMessage(), ex);
        }
    }

    /**
     * Closes whatever is still open: pending top-level text, the open message,
     * started tool calls and active steps.
     */
    public synchronized void finish() {
        try {
            for (Map.Entry<String, TurnBuffer> entry : new ArrayList<>(turns.entrySet())) {
                TurnBuffer turn = entry.getValue();
                if (turn.depth == 0 && !turn.toolCallSeen) {
                    emitText(entry.getKey(), markupFilter.drain(turn.pending, true));
                }
            }
            turns.clear();
            closeMessage();
            for (String callId : startedCalls) {
                if (endedCalls.add(callId)) {
                    sink.emit(ProtocolEvent.toolCallEnd(callId));
                }
            }
            for (String step : new ArrayList<>(activeSteps)) {
                sink.emit(ProtocolEvent.stepFinished(step));
            }
            activeSteps.clear();
        } catch (RuntimeException ex) {
            log.warn("Failed to close normalized stream: {}", ex.getMessage(), ex);
        }
    }

    private void dispatch(RunSignal signal) {
        if (signal instanceof TextDelta text) {
            onText(text);
        } else if (signal instanceof ToolCallDelta delta) {
            onToolCallDelta(delta);
        } else if (signal instanceof ModelCompleted completed) {
            onModelCompleted(completed);
        } else if (signal instanceof ToolResult result) {
            onToolResult(result);
        } else if (signal instanceof NodeEntered entered) {
            onNodeEntered(entered.scope());
        } else if (signal instanceof NodeExited exited) {
            onNodeExited(exited.scope());
        } else if (signal instanceof RoutingDecided decided) {
            onRoutingDecided(decided);
        } else if (signal instanceof NodeFailed failed) {
            onNodeFailed(failed);
        } else {
            log.debug("Ignoring unknown signal {}", signal);
        }
    }

    private void onNodeEntered(SignalScope scope) {
        if (scope.routing() || !scope.isOutermost()) {
            return;
        }
        startStep(scope.stepName());
    }

    private void onNodeExited(SignalScope scope) {
        if (scope.routing()) {
            discardTurns(scope.path());
            return;
        }
        if (!scope.isOutermost()) {
            return;
        }
        TurnBuffer own = turns.remove(scope.path());
        if (own != null && !own.toolCallSeen) {
            emitText(scope.path(), markupFilter.drain(own.pending, true));
        }
        discardTurns(scope.path());
        closeMessage();
        if (activeSteps.remove(scope.stepName())) {
            sink.emit(ProtocolEvent.stepFinished(scope.stepName()));
        }
    }

    private void onText(TextDelta text) {
        SignalScope scope = text.scope();
        if (scope.routing()) {
            log.debug("Dropping routing text from {}", scope.path());
            return;
        }
        if (!StringUtils.hasLength(text.delta())) {
            return;
        }
        TurnBuffer turn = turn(scope);
        if (turn.toolCallSeen && policy.suppressToolRehearsalText()) {
            return;
        }
        startStep(scope.stepName());
        turn.pending.append(text.delta());
        if (scope.isOutermost() || !policy.bufferNestedText()) {
            emitText(scope.path(), markupFilter.drain(turn.pending, false));
        }
    }

    private void onToolCallDelta(ToolCallDelta delta) {
        SignalScope scope = delta.scope();
        if (scope.routing()) {
            return;
        }
        TurnBuffer turn = turn(scope);
        turn.toolCallSeen = true;
        if (policy.suppressToolRehearsalText()) {
            turn.pending.setLength(0);
        }
        String callId = resolveCallId(scope, delta.index(), delta.toolCallId());
        if (callId == null) {
            log.debug("Dropping tool-call fragment without id at {}", scope.path());
            return;
        }
        if (endedCalls.contains(callId)) {
            log.debug("Dropping late fragment of completed tool call {}", callId);
            return;
        }
        startStep(scope.stepName());
        startToolCall(callId, StringUtils.hasText(delta.toolName()) ? delta.toolName() : callNames.get(callId));
        if (StringUtils.hasLength(delta.argumentsDelta())) {
            callsWithArgs.add(callId);
            sink.emit(ProtocolEvent.toolCallArgs(callId, delta.argumentsDelta()));
        }
    }

    private void onModelCompleted(ModelCompleted completed) {
        SignalScope scope = completed.scope();
        TurnBuffer turn = turns.remove(scope.path());
        forgetIndexes(scope.path());
        if (scope.routing()) {
            return;
        }
        if (!completed.toolCalls().isEmpty()) {
            closeMessage();
            for (ToolCall call : completed.toolCalls()) {
                if (endedCalls.contains(call.id())) {
                    log.debug("Dropping duplicate completion of tool call {}", call.id());
                    continue;
                }
                startToolCall(call.id(), call.name());
                if (!callsWithArgs.contains(call.id()) && StringUtils.hasLength(call.arguments())) {
                    callsWithArgs.add(call.id());
                    sink.emit(ProtocolEvent.toolCallArgs(call.id(), call.arguments()));
                }
                endedCalls.add(call.id());
                sink.emit(ProtocolEvent.toolCallEnd(call.id()));
            }
            return;
        }
        if (turn != null && !turn.toolCallSeen) {
            emitText(scope.path(), markupFilter.drain(turn.pending, true));
        }
        if (openMessagePath != null && openMessagePath.equals(scope.path())) {
            closeMessage();
        }
    }

    private void onToolResult(ToolResult result) {
        String callId = result.toolCallId();
        if (!StringUtils.hasText(callId)) {
            log.debug("Dropping tool result without id from {}", result.scope().path());
            return;
        }
        if (resultCalls.contains(callId)) {
            log.debug("Dropping duplicate result of tool call {}", callId);
            return;
        }
        startStep(result.scope().stepName());
        startToolCall(callId, result.toolName());
        if (endedCalls.add(callId)) {
            sink.emit(ProtocolEvent.toolCallEnd(callId));
        }
        resultCalls.add(callId);
        sink.emit(ProtocolEvent.toolCallResult(callId, idGenerator.get(), result.content()));
    }

    private void onRoutingDecided(RoutingDecided decided) {
        discardTurns(decided.scope().path());
        if (StringUtils.hasText(decided.target())) {
            startStep(decided.target());
        }
    }

    private void onNodeFailed(NodeFailed failed) {
        SignalScope scope = failed.scope();
        discardNestedTurns(scope.path());
        closeMessage();
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("stepName", scope.stepName());
        value.put("message", failed.message());
        sink.emit(ProtocolEvent.custom(NODE_ERROR_EVENT, value));
    }

    private void startStep(String stepName) {
        if (StringUtils.hasText(stepName) && activeSteps.add(stepName)) {
            sink.emit(ProtocolEvent.stepStarted(stepName));
        }
    }

    private void startToolCall(String callId, String toolName) {
        if (startedCalls.contains(callId)) {
            return;
        }
        closeMessage();
        startedCalls.add(callId);
        if (toolName != null) {
            callNames.put(callId, toolName);
        }
        sink.emit(ProtocolEvent.toolCallStart(callId, toolName, null));
    }

    private String resolveCallId(SignalScope scope, Integer index, String toolCallId) {
        String key = index == null ? null : scope.path() + "#" + index;
        if (StringUtils.hasText(toolCallId)) {
            if (key != null) {
                callIdsByIndex.put(key, toolCallId);
            }
            return toolCallId;
        }
        return key == null ? null : callIdsByIndex.get(key);
    }

    private void forgetIndexes(String path) {
        callIdsByIndex.keySet().removeIf(key -> key.startsWith(path + "#"));
    }

    private void emitText(String path, String text) {
        if (!StringUtils.hasLength(text)) {
            return;
        }
        if (openMessageId != null && !path.equals(openMessagePath)) {
            closeMessage();
        }
        if (openMessageId == null) {
            openMessageId = idGenerator.get();
            openMessagePath = path;
            sink.emit(ProtocolEvent.textMessageStart(openMessageId));
        }
        sink.emit(ProtocolEvent.textMessageContent(openMessageId, text));
    }

    private void closeMessage() {
        if (openMessageId == null) {
            return;
        }
        sink.emit(ProtocolEvent.textMessageEnd(openMessageId));
        openMessageId = null;
        openMessagePath = null;
    }

    private TurnBuffer turn(SignalScope scope) {
        return turns.computeIfAbsent(scope.path(), path -> new TurnBuffer(scope.depth()));
    }

    private void discardTurns(String path) {
        turns.keySet().removeIf(key -> key.equals(path) || key.startsWith(path + "/"));
    }

    private void discardNestedTurns(String path) {
        turns.keySet().removeIf(key -> key.startsWith(path + "/"));
    }

    private static final class TurnBuffer {
        private final int depth;
        private final StringBuilder pending = new StringBuilder();
        private boolean toolCallSeen;

        private TurnBuffer(int depth) {
            this.depth = depth;
        }
    }
}
