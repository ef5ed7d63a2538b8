package com.agentgraph.stream;

import java.util.List;

/**
 * Tunables of the event normalizer.
 *
 * @param bufferNestedText          hold agent-internal turn text until the turn ends without a tool call
 * @param suppressToolRehearsalText drop text of a turn once it produced a tool-call fragment
 * @param markupTags                tag names of inline textual tool-call markup to strip
 */
public record NormalizerPolicy(
        boolean bufferNestedText,
        boolean suppressToolRehearsalText,
        List<String> markupTags
) {

    public NormalizerPolicy {
        markupTags = markupTags == null ? List.of() : List.copyOf(markupTags);
    }

    public static NormalizerPolicy defaults() {
        return new NormalizerPolicy(true, true, List.of("tool_call", "function_call", "tool_use"));
    }
}
