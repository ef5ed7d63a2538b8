package com.agentgraph.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM,
    TOOL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageRole fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return MessageRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
