package com.agentgraph.protocol;

@FunctionalInterface
public interface ProtocolEventSink {

    void emit(ProtocolEvent event);
}
