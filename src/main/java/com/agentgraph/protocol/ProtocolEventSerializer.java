package com.agentgraph.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Wire encoding of protocol events.
 * <p>
 * A record on the SSE wire is {@code event: <TYPE>\ndata: <json>\n\n}; the stream
 * of a run that ended gracefully is closed by {@link #DONE_RECORD}.
 */
@Component
@RequiredArgsConstructor
public class ProtocolEventSerializer {

    public static final String DONE_EVENT = "done";
    public static final String DONE_DATA = "[DONE]";
    public static final String DONE_RECORD = "event: " + DONE_EVENT + "\ndata: " + DONE_DATA + "\n\n";

    private final ObjectMapper objectMapper;

    public String toJson(ProtocolEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + event.type() + " event", ex);
        }
    }

    public String toSseRecord(ProtocolEvent event) {
        return "event: " + event.type().name() + "\ndata: " + toJson(event) + "\n\n";
    }
}
