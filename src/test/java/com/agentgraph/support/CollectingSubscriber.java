package com.agentgraph.support;

import com.agentgraph.stream.RunEvent;
import com.agentgraph.stream.RunSubscriber;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class CollectingSubscriber implements RunSubscriber {

    private final String id;
    private final List<RunEvent> events = new ArrayList<>();
    private final CountDownLatch completed = new CountDownLatch(1);
    private volatile Boolean graceful;

    public CollectingSubscriber(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return graceful == null;
    }

    @Override
    public synchronized void send(RunEvent event) {
        events.add(event);
    }

    @Override
    public void complete(boolean graceful) {
        this.graceful = graceful;
        completed.countDown();
    }

    public synchronized List<RunEvent> events() {
        return List.copyOf(events);
    }

    public Boolean graceful() {
        return graceful;
    }

    public boolean awaitCompletion(long seconds) throws InterruptedException {
        return completed.await(seconds, TimeUnit.SECONDS);
    }
}
