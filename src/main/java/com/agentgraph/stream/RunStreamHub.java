package com.agentgraph.stream;

import com.agentgraph.protocol.ProtocolEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live runs: buffers each run's protocol events, fans them out to
 * subscribers and replays the buffer to late subscribers.
 * <p>
 * A cancelled run accepts no further events and its subscribers are closed
 * without the done sentinel.
 */
@Component
@Slf4j
public class RunStreamHub {
    private static final int MAX_BUFFER_SIZE = 500;
    private static final long CLEANUP_TTL_MS = 30 * 60 * 1000L;

    private final Map<String, StreamRun> runs = new ConcurrentHashMap<>();

    public String createRun() {
        cleanupExpiredRuns();
        String runId = UUID.randomUUID().toString();
        runs.put(runId, new StreamRun(runId));
        return runId;
    }

    public boolean exists(String runId) {
        return runs.containsKey(runId);
    }

    /**
     * Attaches a subscriber and replays buffered events newer than {@code sinceSequence}.
     *
     * @return {@code false} when the run is unknown
     */
    public boolean subscribe(String runId, RunSubscriber subscriber, long sinceSequence) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        synchronized (run) {
            for (RunEvent event : run.snapshotSince(sinceSequence)) {
                if (!send(run, subscriber, event)) {
                    return true;
                }
            }
            if (run.completed() || run.cancelled()) {
                subscriber.complete(!run.cancelled());
                return true;
            }
            run.subscribers().put(subscriber.id(), subscriber);
        }
        return true;
    }

    public void unsubscribe(String runId, String subscriberId) {
        StreamRun run = runs.get(runId);
        if (run != null) {
            run.subscribers().remove(subscriberId);
        }
    }

    public void emit(String runId, ProtocolEvent event) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return;
        }
        synchronized (run) {
            if (run.cancelled() || run.completed()) {
                log.debug("Dropping {} for finished run {}", event.type(), runId);
                return;
            }
            RunEvent runEvent = run.append(event, MAX_BUFFER_SIZE);
            for (RunSubscriber subscriber : new ArrayList<>(run.subscribers().values())) {
                send(run, subscriber, runEvent);
            }
        }
    }

    /**
     * Marks the run finished and closes subscribers with the done sentinel.
     * No-op for cancelled runs.
     */
    public void complete(String runId) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return;
        }
        synchronized (run) {
            if (run.cancelled() || run.completed()) {
                return;
            }
            run.markCompleted();
            closeSubscribers(run, true);
        }
    }

    public boolean cancelRun(String runId) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        synchronized (run) {
            if (run.cancelled() || run.completed()) {
                return true;
            }
            run.markCancelled();
            closeSubscribers(run, false);
        }
        log.info("Run {} cancelled", runId);
        return true;
    }

    public boolean isCancelled(String runId) {
        StreamRun run = runs.get(runId);
        return run != null && run.cancelled();
    }

    public List<RunEvent> snapshot(String runId, long sinceSequence) {
        StreamRun run = runs.get(runId);
        return run == null ? List.of() : run.snapshotSince(sinceSequence);
    }

    private boolean send(StreamRun run, RunSubscriber subscriber, RunEvent event) {
        if (!subscriber.isOpen()) {
            run.subscribers().remove(subscriber.id());
            return false;
        }
        try {
            subscriber.send(event);
            return true;
        } catch (IOException | IllegalStateException ex) {
            log.debug("Failed to send event to subscriber {}: {}", subscriber.id(), ex.getMessage());
            run.subscribers().remove(subscriber.id());
            return false;
        }
    }

    private void closeSubscribers(StreamRun run, boolean graceful) {
        for (RunSubscriber subscriber : new ArrayList<>(run.subscribers().values())) {
            subscriber.complete(graceful);
        }
        run.subscribers().clear();
    }

    private void cleanupExpiredRuns() {
        long cutoff = System.currentTimeMillis() - CLEANUP_TTL_MS;
        runs.values().removeIf(run -> (run.completed() || run.cancelled())
                && run.subscribers().isEmpty()
                && run.lastUpdated().toEpochMilli() < cutoff);
    }
}
