package com.agentgraph.engine;

public class NodeExecutionException extends RuntimeException {

    private final String stepName;

    public NodeExecutionException(String stepName, String message, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
