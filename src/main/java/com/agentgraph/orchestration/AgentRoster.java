package com.agentgraph.orchestration;

import com.agentgraph.capability.AgentTool;
import com.agentgraph.config.OrchestratorProperties;
import com.agentgraph.graph.AgentDefinition;
import com.agentgraph.tools.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the supervisor's agent definitions for a run from the configured roster,
 * binding each agent's tool names against run-scoped tools first and the shared
 * registry second. Unknown tool names are skipped.
 */
@Component
@Slf4j
public class AgentRoster {

    private final OrchestratorProperties properties;
    private final ToolRegistry toolRegistry;

    public AgentRoster(OrchestratorProperties properties, ToolRegistry toolRegistry) {
        this.properties = properties;
        this.toolRegistry = toolRegistry;
    }

    public List<AgentDefinition> agents(List<AgentTool> runTools) {
        Map<String, AgentTool> scoped = new LinkedHashMap<>();
        runTools.forEach(tool -> scoped.put(tool.name(), tool));
        List<AgentDefinition> agents = new ArrayList<>();
        for (OrchestratorProperties.AgentConfig config : properties.getSupervisor().getAgents()) {
            List<AgentTool> tools = new ArrayList<>();
            for (String toolName : config.getTools()) {
                AgentTool tool = scoped.get(toolName);
                if (tool == null) {
                    tool = toolRegistry.find(toolName).orElse(null);
                }
                if (tool == null) {
                    log.debug("Agent {} references unavailable tool {}; skipping", config.getName(), toolName);
                    continue;
                }
                tools.add(tool);
            }
            agents.add(new AgentDefinition(config.getName(), config.getPrompt(), tools));
        }
        if (agents.isEmpty()) {
            log.warn("No supervisor agents configured; the supervisor can only respond directly");
        }
        return agents;
    }
}
