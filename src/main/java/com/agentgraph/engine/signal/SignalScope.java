package com.agentgraph.engine.signal;

/**
 * Where a signal originated.
 * <p>
 * {@code path} is a slash-separated key that grows with every nested call inside
 * a node (an agent's model turns are {@code node/turn-1}, {@code node/turn-2} ...).
 * Depth 0 is the node itself. Routing scopes belong to the supervisor's
 * decision-making and are never surfaced as text.
 */
public record SignalScope(
        String nodeId,
        String stepName,
        String path,
        int depth,
        boolean routing
) {

    public static SignalScope node(String nodeId, String stepName) {
        return new SignalScope(nodeId, stepName, nodeId, 0, false);
    }

    public static SignalScope routing(String nodeId, String stepName) {
        return new SignalScope(nodeId, stepName, nodeId, 0, true);
    }

    public SignalScope child(String segment) {
        return new SignalScope(nodeId, stepName, path + "/" + segment, depth + 1, routing);
    }

    public boolean isOutermost() {
        return depth == 0;
    }
}
