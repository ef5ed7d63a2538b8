package com.agentgraph.engine;

import com.agentgraph.capability.ChatMessage;

import java.util.List;

/**
 * @param messages          the full message list at the end of the run
 * @param produced          messages appended during the run
 * @param steps             node executions performed
 * @param stepLimitReached  the run stopped because it hit its step limit
 */
public record RunOutcome(
        List<ChatMessage> messages,
        List<ChatMessage> produced,
        int steps,
        boolean stepLimitReached
) {
}
