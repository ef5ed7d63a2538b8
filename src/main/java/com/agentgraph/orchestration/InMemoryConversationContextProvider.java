package com.agentgraph.orchestration;

import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.ConversationContextProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps thread histories in memory for the lifetime of the process.
 */
@Component
public class InMemoryConversationContextProvider implements ConversationContextProvider {

    private final Map<String, List<ChatMessage>> threads = new ConcurrentHashMap<>();

    @Override
    public List<ChatMessage> load(String threadId) {
        List<ChatMessage> history = threads.get(threadId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    @Override
    public void append(String threadId, List<ChatMessage> messages) {
        List<ChatMessage> history = threads.computeIfAbsent(threadId, key -> new ArrayList<>());
        synchronized (history) {
            history.addAll(messages);
        }
    }
}
