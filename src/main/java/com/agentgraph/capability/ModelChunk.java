package com.agentgraph.capability;

import java.util.List;

public record ModelChunk(
        String contentDelta,
        List<ToolCallFragment> toolCallFragments
) {

    public ModelChunk {
        toolCallFragments = toolCallFragments == null ? List.of() : List.copyOf(toolCallFragments);
    }

    public static ModelChunk text(String delta) {
        return new ModelChunk(delta, List.of());
    }

    public static ModelChunk toolCall(ToolCallFragment fragment) {
        return new ModelChunk(null, List.of(fragment));
    }

    public boolean hasContent() {
        return contentDelta != null && !contentDelta.isEmpty();
    }
}
