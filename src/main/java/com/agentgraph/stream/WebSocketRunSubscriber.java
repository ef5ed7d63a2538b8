package com.agentgraph.stream;

import com.agentgraph.protocol.ProtocolEventSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Pushes a run's events to a WebSocket session as {@code {"sequence":n,"event":{...}}}
 * frames, followed by a {@code [DONE]} frame when the run ends normally.
 */
@Slf4j
class WebSocketRunSubscriber implements RunSubscriber {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    WebSocketRunSubscriber(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(RunEvent event) throws IOException {
        String payload = objectMapper.writeValueAsString(event);
        synchronized (session) {
            session.sendMessage(new TextMessage(payload));
        }
    }

    @Override
    public void complete(boolean graceful) {
        if (!session.isOpen()) {
            return;
        }
        try {
            synchronized (session) {
                if (graceful) {
                    session.sendMessage(new TextMessage(ProtocolEventSerializer.DONE_DATA));
                }
                session.close(CloseStatus.NORMAL);
            }
        } catch (IOException ex) {
            log.debug("Failed to close stream session {}: {}", session.getId(), ex.getMessage());
        }
    }
}
