package com.agentgraph.orchestration;

import com.agentgraph.capability.AgentTool;

import java.util.List;

/**
 * Supplies tools that only exist for one run, such as a retrieval tool scoped to
 * the caller's knowledge bases. Run-scoped tools shadow registry tools of the
 * same name.
 */
public interface RunToolBinder {

    List<AgentTool> bind(OrchestrationRequest request);
}
