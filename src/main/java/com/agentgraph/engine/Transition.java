package com.agentgraph.engine;

/**
 * What a node executor decided about the next state.
 */
public record Transition(Kind kind, String target) {

    public enum Kind {
        /** Follow the node's single outgoing edge. */
        NEXT,
        GOTO,
        TERMINATE
    }

    public static Transition next() {
        return new Transition(Kind.NEXT, null);
    }

    public static Transition to(String target) {
        return new Transition(Kind.GOTO, target);
    }

    public static Transition terminate() {
        return new Transition(Kind.TERMINATE, null);
    }
}
