package com.agentgraph.support;

import com.agentgraph.capability.LanguageModel;
import com.agentgraph.capability.ModelChunk;
import com.agentgraph.capability.ModelRequest;
import com.agentgraph.capability.ModelTurn;
import com.agentgraph.capability.ToolCall;
import com.agentgraph.capability.ToolCallFragment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Replays scripted model turns chunk by chunk and records every request.
 */
public class ScriptedLanguageModel implements LanguageModel {

    private final Deque<List<ModelChunk>> script = new ArrayDeque<>();
    private final List<ModelRequest> requests = new ArrayList<>();
    private List<ModelChunk> fallback;

    public ScriptedLanguageModel reply(String... textChunks) {
        script.add(Arrays.stream(textChunks).map(ModelChunk::text).toList());
        return this;
    }

    public ScriptedLanguageModel turn(ModelChunk... chunks) {
        script.add(List.of(chunks));
        return this;
    }

    public ScriptedLanguageModel toolCall(String id, String name, String arguments) {
        return turn(ModelChunk.toolCall(new ToolCallFragment(0, id, name, arguments)));
    }

    /** Reply used once the script is exhausted. */
    public ScriptedLanguageModel otherwise(String... textChunks) {
        fallback = Arrays.stream(textChunks).map(ModelChunk::text).toList();
        return this;
    }

    public List<ModelRequest> requests() {
        return requests;
    }

    @Override
    public ModelTurn call(ModelRequest request) {
        return stream(request, chunk -> { });
    }

    @Override
    public synchronized ModelTurn stream(ModelRequest request, Consumer<ModelChunk> chunkConsumer) {
        requests.add(request);
        List<ModelChunk> chunks = script.poll();
        if (chunks == null) {
            if (fallback == null) {
                throw new IllegalStateException("No scripted model reply left");
            }
            chunks = fallback;
        }
        StringBuilder content = new StringBuilder();
        Map<Integer, String> idsByIndex = new HashMap<>();
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, StringBuilder> arguments = new LinkedHashMap<>();
        for (ModelChunk chunk : chunks) {
            chunkConsumer.accept(chunk);
            if (chunk.hasContent()) {
                content.append(chunk.contentDelta());
            }
            for (ToolCallFragment fragment : chunk.toolCallFragments()) {
                String id = fragment.id() != null ? fragment.id() : idsByIndex.get(fragment.index());
                if (fragment.id() != null && fragment.index() != null) {
                    idsByIndex.put(fragment.index(), fragment.id());
                }
                if (fragment.name() != null) {
                    names.put(id, fragment.name());
                }
                arguments.computeIfAbsent(id, key -> new StringBuilder())
                        .append(fragment.argumentsDelta() == null ? "" : fragment.argumentsDelta());
            }
        }
        List<ToolCall> toolCalls = new ArrayList<>();
        arguments.forEach((id, args) -> toolCalls.add(new ToolCall(id, names.get(id), args.toString())));
        return new ModelTurn(content.toString(), toolCalls);
    }
}
