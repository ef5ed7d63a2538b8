package com.agentgraph.tools;

import com.agentgraph.capability.AgentTool;
import com.agentgraph.capability.springai.ToolCallbackAgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide tool catalogue. Built-in {@link AgentTool} beans are registered
 * first, then every callback published by a {@link ToolCallbackProvider}.
 * Later registrations under an existing name replace the earlier one.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();
    private final List<String> order = new ArrayList<>();

    public ToolRegistry(List<AgentTool> builtInTools, ObjectProvider<ToolCallbackProvider> callbackProviders) {
        builtInTools.forEach(this::register);
        callbackProviders.orderedStream().forEach(provider -> {
            for (ToolCallback callback : provider.getToolCallbacks()) {
                register(new ToolCallbackAgentTool(callback));
            }
        });
        log.info("Tool registry initialized with {} tools: {}", tools.size(), listNames());
    }

    public synchronized void register(AgentTool tool) {
        if (tool == null || !StringUtils.hasText(tool.name())) {
            return;
        }
        if (tools.put(tool.name(), tool) != null) {
            log.warn("Tool '{}' registered twice; keeping the latest registration", tool.name());
        } else {
            order.add(tool.name());
        }
    }

    public Optional<AgentTool> find(String name) {
        if (!StringUtils.hasText(name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return StringUtils.hasText(name) && tools.containsKey(name);
    }

    /**
     * Resolves tools by name in the given order, skipping unknown names.
     */
    public List<AgentTool> getByNames(Collection<String> names) {
        List<AgentTool> resolved = new ArrayList<>();
        if (names == null) {
            return resolved;
        }
        for (String name : names) {
            AgentTool tool = tools.get(name);
            if (tool == null) {
                log.debug("Tool '{}' is not registered; skipping", name);
                continue;
            }
            resolved.add(tool);
        }
        return resolved;
    }

    public synchronized List<AgentTool> getAll() {
        return order.stream().map(tools::get).toList();
    }

    public synchronized List<String> listNames() {
        return List.copyOf(order);
    }
}
