package com.agentgraph.capability;

public record RunOptions(
        String provider,
        String model,
        Double temperature
) {

    public static RunOptions defaults() {
        return new RunOptions(null, null, null);
    }
}
