package com.agentgraph.stream;

import com.agentgraph.protocol.ProtocolEventSerializer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;

/**
 * Writes a run's events to an HTTP server-sent-events response.
 */
@Slf4j
public class SseRunSubscriber implements RunSubscriber {

    private final String id = UUID.randomUUID().toString();
    private final SseEmitter emitter;
    private final ProtocolEventSerializer serializer;
    private volatile boolean open = true;

    public SseRunSubscriber(SseEmitter emitter, ProtocolEventSerializer serializer) {
        this.emitter = emitter;
        this.serializer = serializer;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(RunEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .id(Long.toString(event.sequence()))
                .name(event.event().type().name())
                .data(serializer.toJson(event.event())));
    }

    @Override
    public void complete(boolean graceful) {
        if (!open) {
            return;
        }
        open = false;
        try {
            if (graceful) {
                emitter.send(SseEmitter.event()
                        .name(ProtocolEventSerializer.DONE_EVENT)
                        .data(ProtocolEventSerializer.DONE_DATA));
            }
            emitter.complete();
        } catch (IOException | IllegalStateException ex) {
            log.debug("SSE subscriber {} already closed: {}", id, ex.getMessage());
            emitter.completeWithError(ex);
        }
    }

    /** Called when the client side went away. */
    public void markClosed() {
        open = false;
    }
}
