package com.agentgraph.graph;

/**
 * A graph that cannot be built or walked.
 */
public class GraphException extends RuntimeException {

    public static final String CODE = "GRAPH_ERROR";

    public GraphException(String message) {
        super(message);
    }
}
