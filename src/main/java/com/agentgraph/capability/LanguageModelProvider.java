package com.agentgraph.capability;

public interface LanguageModelProvider {

    LanguageModel resolve(RunOptions options);
}
