package com.agentgraph.api;

import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.MessageRole;
import com.agentgraph.capability.MessageTag;
import jakarta.validation.constraints.NotNull;

public record MessageInput(
        @NotNull MessageRole role,
        @NotNull String content
) {

    ChatMessage toChatMessage() {
        return new ChatMessage(role, content, null, null, null, MessageTag.NONE);
    }
}
