package com.agentgraph.graph;

public enum GraphMode {
    SUPERVISOR,
    DAG
}
