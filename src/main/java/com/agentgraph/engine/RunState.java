package com.agentgraph.engine;

import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.MessageRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The append-only message list of a run.
 */
public class RunState {

    private final List<ChatMessage> messages;
    private final int initialSize;

    public RunState(List<ChatMessage> initialMessages) {
        this.messages = new ArrayList<>(initialMessages);
        this.initialSize = initialMessages.size();
    }

    public List<ChatMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    /** Messages appended since the run started. */
    public List<ChatMessage> produced() {
        return List.copyOf(messages.subList(initialSize, messages.size()));
    }

    public void append(ChatMessage message) {
        messages.add(message);
    }

    public void appendAll(List<ChatMessage> appended) {
        messages.addAll(appended);
    }

    public String latestContent() {
        return messages.isEmpty() ? "" : messages.get(messages.size() - 1).content();
    }

    public String latestUserContent() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).role() == MessageRole.USER) {
                return messages.get(i).content();
            }
        }
        return "";
    }
}
