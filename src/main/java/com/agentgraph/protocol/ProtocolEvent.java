package com.agentgraph.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One event of the streaming protocol seen by clients.
 * <p>
 * The record is a flat envelope: {@link #type()} decides which of the optional
 * fields are populated, the rest stay {@code null} and are omitted from JSON.
 * Instances are created through the static factories only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProtocolEvent(
        EventType type,
        String threadId,
        String runId,
        String stepName,
        String messageId,
        String role,
        String delta,
        String toolCallId,
        String toolCallName,
        String parentMessageId,
        String content,
        String message,
        String code,
        String name,
        Object value,
        long timestamp
) {

    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    public static ProtocolEvent runStarted(String threadId, String runId) {
        return builder(EventType.RUN_STARTED).threadId(threadId).runId(runId).build();
    }

    public static ProtocolEvent runFinished(String threadId, String runId) {
        return builder(EventType.RUN_FINISHED).threadId(threadId).runId(runId).build();
    }

    public static ProtocolEvent runError(String message, String code) {
        return builder(EventType.RUN_ERROR).message(message).code(code).build();
    }

    public static ProtocolEvent stepStarted(String stepName) {
        return builder(EventType.STEP_STARTED).stepName(stepName).build();
    }

    public static ProtocolEvent stepFinished(String stepName) {
        return builder(EventType.STEP_FINISHED).stepName(stepName).build();
    }

    public static ProtocolEvent textMessageStart(String messageId) {
        return builder(EventType.TEXT_MESSAGE_START).messageId(messageId).role(ROLE_ASSISTANT).build();
    }

    public static ProtocolEvent textMessageContent(String messageId, String delta) {
        return builder(EventType.TEXT_MESSAGE_CONTENT).messageId(messageId).delta(delta).build();
    }

    public static ProtocolEvent textMessageEnd(String messageId) {
        return builder(EventType.TEXT_MESSAGE_END).messageId(messageId).build();
    }

    public static ProtocolEvent toolCallStart(String toolCallId, String toolCallName, String parentMessageId) {
        return builder(EventType.TOOL_CALL_START)
                .toolCallId(toolCallId)
                .toolCallName(toolCallName)
                .parentMessageId(parentMessageId)
                .build();
    }

    public static ProtocolEvent toolCallArgs(String toolCallId, String delta) {
        return builder(EventType.TOOL_CALL_ARGS).toolCallId(toolCallId).delta(delta).build();
    }

    public static ProtocolEvent toolCallEnd(String toolCallId) {
        return builder(EventType.TOOL_CALL_END).toolCallId(toolCallId).build();
    }

    public static ProtocolEvent toolCallResult(String toolCallId, String messageId, String content) {
        return builder(EventType.TOOL_CALL_RESULT)
                .toolCallId(toolCallId)
                .messageId(messageId)
                .role(ROLE_TOOL)
                .content(content)
                .build();
    }

    public static ProtocolEvent custom(String name, Object value) {
        return builder(EventType.CUSTOM).name(name).value(value).build();
    }

    private static Builder builder(EventType type) {
        return new Builder(type);
    }

    private static final class Builder {
        private final EventType type;
        private String threadId;
        private String runId;
        private String stepName;
        private String messageId;
        private String role;
        private String delta;
        private String toolCallId;
        private String toolCallName;
        private String parentMessageId;
        private String content;
        private String message;
        private String code;
        private String name;
        private Object value;

        private Builder(EventType type) {
            this.type = type;
        }

        Builder threadId(String threadId) { this.threadId = threadId; return this; }
        Builder runId(String runId) { this.runId = runId; return this; }
        Builder stepName(String stepName) { this.stepName = stepName; return this; }
        Builder messageId(String messageId) { this.messageId = messageId; return this; }
        Builder role(String role) { this.role = role; return this; }
        Builder delta(String delta) { this.delta = delta; return this; }
        Builder toolCallId(String toolCallId) { this.toolCallId = toolCallId; return this; }
        Builder toolCallName(String toolCallName) { this.toolCallName = toolCallName; return this; }
        Builder parentMessageId(String parentMessageId) { this.parentMessageId = parentMessageId; return this; }
        Builder content(String content) { this.content = content; return this; }
        Builder message(String message) { this.message = message; return this; }
        Builder code(String code) { this.code = code; return this; }
        Builder name(String name) { this.name = name; return this; }
        Builder value(Object value) { this.value = value; return this; }

        ProtocolEvent build() {
            return new ProtocolEvent(type, threadId, runId, stepName, messageId, role, delta,
                    toolCallId, toolCallName, parentMessageId, content, message, code, name, value,
                    System.currentTimeMillis());
        }
    }
}
