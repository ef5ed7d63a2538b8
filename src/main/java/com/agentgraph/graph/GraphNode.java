package com.agentgraph.graph;

import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of an orchestration graph. The {@code config} keys that matter depend on
 * the type: agents read {@code prompt} and {@code tools}, tool nodes read
 * {@code toolName} and {@code input}.
 */
public record GraphNode(
        String id,
        NodeType type,
        String name,
        Map<String, Object> config
) {

    public GraphNode {
        config = config == null ? Map.of() : config;
    }

    public static GraphNode of(String id, NodeType type, String name) {
        return new GraphNode(id, type, name, Map.of());
    }

    /** Step name used on the wire: the node name, or its id when unnamed. */
    public String displayName() {
        return StringUtils.hasText(name) ? name : id;
    }

    public String prompt() {
        Object prompt = config.get("prompt");
        return prompt == null ? "" : prompt.toString();
    }

    public List<String> toolNames() {
        Object tools = config.get("tools");
        if (tools instanceof List<?> list) {
            return list.stream()
                    .filter(item -> item != null && StringUtils.hasText(item.toString()))
                    .map(Object::toString)
                    .toList();
        }
        return List.of();
    }

    public String toolName() {
        Object toolName = config.get("toolName");
        return toolName == null ? null : toolName.toString();
    }

    public Map<String, Object> toolInput() {
        Object input = config.get("input");
        if (input instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
            return copy;
        }
        return Map.of();
    }
}
