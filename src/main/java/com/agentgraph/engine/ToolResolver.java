package com.agentgraph.engine;

import com.agentgraph.capability.AgentTool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Tool lookup for one run: the shared registry plus any run-scoped tools.
 */
@FunctionalInterface
public interface ToolResolver {

    Optional<AgentTool> find(String name);

    /** Resolves names in order, skipping unknown ones. */
    default List<AgentTool> resolve(Collection<String> names) {
        List<AgentTool> tools = new ArrayList<>();
        for (String name : names) {
            find(name).ifPresent(tools::add);
        }
        return tools;
    }
}
