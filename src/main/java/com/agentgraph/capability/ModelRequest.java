package com.agentgraph.capability;

import lombok.Builder;

import java.util.List;

/**
 * Input of a single model call.
 *
 * @param systemPrompt   optional system instruction placed before the messages
 * @param messages       conversation so far
 * @param tools          tools the model may request; empty for plain text turns
 * @param responseFormat optional structured-output instructions appended to the system prompt
 */
@Builder(toBuilder = true)
public record ModelRequest(
        String systemPrompt,
        List<ChatMessage> messages,
        List<AgentTool> tools,
        String responseFormat
) {

    public ModelRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
