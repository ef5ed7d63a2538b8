package com.agentgraph.capability;

import java.util.List;

/**
 * Source of conversation history and sink for the visible messages a run produced.
 */
public interface ConversationContextProvider {

    List<ChatMessage> load(String threadId);

    void append(String threadId, List<ChatMessage> messages);
}
