package com.agentgraph.engine;

@FunctionalInterface
public interface RunControl {

    boolean isCancelled();

    static RunControl none() {
        return () -> false;
    }
}
