package com.agentgraph.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * {@code /ws/stream?runId=...&since=...}: replays the buffered events of a run
 * after the given sequence number, then streams live.
 */
@Component
@Slf4j
public class RunStreamWebSocketHandler extends TextWebSocketHandler {

    private static final String RUN_ID_ATTRIBUTE = "runId";

    private final RunStreamHub hub;
    private final ObjectMapper objectMapper;

    public RunStreamWebSocketHandler(RunStreamHub hub, ObjectMapper objectMapper) {
        this.hub = hub;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        if (uri == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        var params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        String runId = params.getFirst("runId");
        if (runId == null || runId.isBlank()) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        long since = parseLong(params.getFirst("since"), 0L);
        session.getAttributes().put(RUN_ID_ATTRIBUTE, runId);
        if (!hub.subscribe(runId, new WebSocketRunSubscriber(session, objectMapper), since)) {
            log.debug("Stream requested for unknown run {}", runId);
            session.close(CloseStatus.POLICY_VIOLATION);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // Server push only.
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Object runId = session.getAttributes().get(RUN_ID_ATTRIBUTE);
        if (runId != null) {
            hub.unsubscribe(runId.toString(), session.getId());
        }
    }

    private long parseLong(String value, long fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            log.debug("Invalid since parameter {}", value);
            return fallback;
        }
    }
}
