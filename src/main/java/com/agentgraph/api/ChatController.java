package com.agentgraph.api;

import com.agentgraph.config.OrchestratorProperties;
import com.agentgraph.orchestration.OrchestrationService;
import com.agentgraph.orchestration.PreparedRun;
import com.agentgraph.orchestration.RunHandle;
import com.agentgraph.protocol.ProtocolEventSerializer;
import com.agentgraph.stream.SseRunSubscriber;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/chat")
@Slf4j
public class ChatController {

    private final OrchestrationService orchestrationService;
    private final ProtocolEventSerializer serializer;
    private final OrchestratorProperties properties;

    public ChatController(OrchestrationService orchestrationService,
                          ProtocolEventSerializer serializer,
                          OrchestratorProperties properties) {
        this.orchestrationService = orchestrationService;
        this.serializer = serializer;
        this.properties = properties;
    }

    /**
     * Starts a run and streams its protocol events as server-sent events. A
     * malformed graph is rejected before the stream opens.
     */
    @PostMapping("/completions")
    public SseEmitter completions(@Valid @RequestBody ChatRequest request) {
        PreparedRun run = orchestrationService.prepare(request.toOrchestrationRequest());
        SseEmitter emitter = new SseEmitter(properties.getStream().getEmitterTimeoutMs());
        SseRunSubscriber subscriber = new SseRunSubscriber(emitter, serializer);
        emitter.onCompletion(subscriber::markClosed);
        emitter.onTimeout(subscriber::markClosed);
        emitter.onError(ex -> subscriber.markClosed());
        RunHandle handle = orchestrationService.start(run, subscriber);
        log.info("Streaming run {} for thread {}", handle.runId(), handle.threadId());
        return emitter;
    }

    @PostMapping("/cancel/{runId}")
    public ResponseEntity<CancelRunResponse> cancel(@PathVariable String runId) {
        if (orchestrationService.cancel(runId)) {
            return ResponseEntity.ok(CancelRunResponse.cancelled(runId));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(CancelRunResponse.notFound(runId));
    }
}
