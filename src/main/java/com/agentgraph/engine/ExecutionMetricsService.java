package com.agentgraph.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ExecutionMetricsService {

    private final AtomicLong modelCallCount = new AtomicLong();
    private final AtomicLong toolCallCount = new AtomicLong();
    private final AtomicLong toolFailureCount = new AtomicLong();
    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong stepCount = new AtomicLong();

    public void recordModelCall(String stepName, String purpose) {
        long count = modelCallCount.incrementAndGet();
        log.info("Model call #{} (step={}, purpose={}).", count, stepName, purpose);
    }

    public void recordToolCall(String toolName, boolean failed) {
        long count = toolCallCount.incrementAndGet();
        if (failed) {
            long failures = toolFailureCount.incrementAndGet();
            log.info("Tool call #{} ({}) failed. Total failures={}.", count, toolName, failures);
        } else {
            log.debug("Tool call #{} ({}) succeeded.", count, toolName);
        }
    }

    public void recordRun(RunOutcome outcome) {
        long runs = runCount.incrementAndGet();
        long steps = stepCount.addAndGet(outcome.steps());
        log.info("Run #{} executed {} steps{}. Total steps={}.", runs, outcome.steps(),
                outcome.stepLimitReached() ? " (step limit reached)" : "", steps);
    }
}
