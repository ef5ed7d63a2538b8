package com.agentgraph.stream;

import java.io.IOException;

/**
 * A live consumer of one run's events.
 */
public interface RunSubscriber {

    String id();

    boolean isOpen();

    void send(RunEvent event) throws IOException;

    /**
     * Ends the subscription.
     *
     * @param graceful the run ended normally (successfully or with a reported error);
     *                 {@code false} when it was cancelled
     */
    void complete(boolean graceful);
}
