package com.agentgraph.engine;

/**
 * The supervisor could not decide where to go next. Fatal for the run.
 */
public class RoutingException extends RuntimeException {

    public static final String CODE = "ROUTING_ERROR";

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
