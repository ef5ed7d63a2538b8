package com.agentgraph.capability;

/**
 * Marks messages the engine appends for its own bookkeeping.
 */
public enum MessageTag {
    NONE,
    /** Routing rationale of the supervisor; never shown to users. */
    ROUTING,
    ERROR,
    /** Synthetic record of a tool node's output. */
    TOOL_OUTPUT
}
