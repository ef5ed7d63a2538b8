package com.agentgraph.engine;

/**
 * Unwinds a run whose caller cancelled it. Never reported to clients.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException() {
        super("Run cancelled");
    }
}
