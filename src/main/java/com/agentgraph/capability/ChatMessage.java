package com.agentgraph.capability;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
        MessageRole role,
        String content,
        String name,
        String toolCallId,
        List<ToolCall> toolCalls,
        MessageTag tag
) {

    public ChatMessage {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        tag = tag == null ? MessageTag.NONE : tag;
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, null, null, null, MessageTag.NONE);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, null, null, null, MessageTag.NONE);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, null, null, MessageTag.NONE);
    }

    public static ChatMessage assistant(String content, String name, List<ToolCall> toolCalls) {
        return new ChatMessage(MessageRole.ASSISTANT, content, name, null, toolCalls, MessageTag.NONE);
    }

    public static ChatMessage toolResult(String toolCallId, String toolName, String content) {
        return new ChatMessage(MessageRole.TOOL, content, toolName, toolCallId, null, MessageTag.NONE);
    }

    public static ChatMessage tagged(MessageRole role, String content, String name, MessageTag tag) {
        return new ChatMessage(role, content, name, null, null, tag);
    }

    public boolean hasTag(MessageTag other) {
        return tag == other;
    }

    /**
     * Assistant prose a user should see: no tool requests, no engine bookkeeping.
     */
    @JsonIgnore
    public boolean isVisibleAssistantText() {
        return role == MessageRole.ASSISTANT
                && tag == MessageTag.NONE
                && toolCalls.isEmpty()
                && !content.isBlank();
    }
}
