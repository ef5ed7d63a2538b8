package com.agentgraph.stream;

import com.agentgraph.protocol.ProtocolEvent;

/**
 * A protocol event as buffered by the hub, numbered for replay.
 */
public record RunEvent(
        long sequence,
        ProtocolEvent event
) {
}
