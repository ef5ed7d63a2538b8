package com.agentgraph.capability;

import java.util.function.Consumer;

/**
 * A chat model the engine can drive. Implementations never execute tools
 * themselves; requested calls are returned in the {@link ModelTurn}.
 */
public interface LanguageModel {

    ModelTurn call(ModelRequest request);

    /**
     * Streams a model call, handing every chunk to {@code chunkConsumer} as it
     * arrives, and returns the assembled turn once the stream completes.
     */
    ModelTurn stream(ModelRequest request, Consumer<ModelChunk> chunkConsumer);
}
