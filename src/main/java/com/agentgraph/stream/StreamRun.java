package com.agentgraph.stream;

import com.agentgraph.protocol.ProtocolEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

class StreamRun {
    private final String runId;
    private final List<RunEvent> buffer = new ArrayList<>();
    private final Map<String, RunSubscriber> subscribers = new ConcurrentHashMap<>();
    private long sequence;
    private volatile boolean completed;
    private volatile boolean cancelled;
    private volatile Instant lastUpdated = Instant.now();

    StreamRun(String runId) {
        this.runId = runId;
    }

    String runId() {
        return runId;
    }

    Map<String, RunSubscriber> subscribers() {
        return subscribers;
    }

    synchronized RunEvent append(ProtocolEvent event, int maxBufferSize) {
        RunEvent runEvent = new RunEvent(++sequence, event);
        buffer.add(runEvent);
        if (buffer.size() > maxBufferSize) {
            buffer.remove(0);
        }
        lastUpdated = Instant.now();
        return runEvent;
    }

    synchronized List<RunEvent> snapshotSince(long sinceSequence) {
        return buffer.stream()
                .filter(event -> event.sequence() > sinceSequence)
                .toList();
    }

    boolean completed() {
        return completed;
    }

    boolean cancelled() {
        return cancelled;
    }

    void markCompleted() {
        completed = true;
        lastUpdated = Instant.now();
    }

    void markCancelled() {
        cancelled = true;
        lastUpdated = Instant.now();
    }

    Instant lastUpdated() {
        return lastUpdated;
    }
}
