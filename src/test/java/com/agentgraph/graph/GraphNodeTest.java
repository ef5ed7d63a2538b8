package com.agentgraph.graph;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphNodeTest {

    @Test
    void toolInputCopiesEntriesWithStringKeys() {
        Map<Object, Object> input = new LinkedHashMap<>();
        input.put("query", "{{input}}");
        input.put(3, "three");
        GraphNode node = new GraphNode("t", NodeType.TOOL, null, Map.of("toolName", "web_search", "input", input));

        Map<String, Object> toolInput = node.toolInput();

        assertEquals(Map.of("query", "{{input}}", "3", "three"), toolInput);
        input.put("later", "ignored");
        assertEquals(2, toolInput.size());
    }

    @Test
    void toolInputIsEmptyWhenNotAMap() {
        GraphNode node = new GraphNode("t", NodeType.TOOL, null, Map.of("input", "plain"));

        assertTrue(node.toolInput().isEmpty());
    }
}
