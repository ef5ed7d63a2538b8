package com.agentgraph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeType {
    START,
    END,
    AGENT,
    TOOL,
    CONDITION,
    /** Supervisor routing node; synthesized, never accepted in user graphs. */
    ROUTER,
    /** Supervisor direct-answer node; synthesized, never accepted in user graphs. */
    RESPONDER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isSynthetic() {
        return this == ROUTER || this == RESPONDER;
    }
}
