package com.agentgraph.engine.signal;

@FunctionalInterface
public interface SignalListener {

    void onSignal(RunSignal signal);
}
