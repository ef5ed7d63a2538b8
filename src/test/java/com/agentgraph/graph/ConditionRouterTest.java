package com.agentgraph.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionRouterTest {

    private final List<GraphEdge> edges = List.of(
            new GraphEdge("c", "approve", "approved"),
            new GraphEdge("c", "reject", "rejected"),
            GraphEdge.of("c", "review"));

    @Test
    void picksFirstEdgeWhoseKeywordOccursIgnoringCase() {
        assertEquals("reject", ConditionRouter.select(edges, "The request was REJECTED.").orElseThrow().target());
    }

    @Test
    void fallsBackToUnconditionalEdge() {
        assertEquals("review", ConditionRouter.select(edges, "unclear").orElseThrow().target());
    }

    @Test
    void fallsBackToFirstEdgeWhenAllAreConditional() {
        List<GraphEdge> conditional = edges.subList(0, 2);

        assertEquals("approve", ConditionRouter.select(conditional, null).orElseThrow().target());
    }

    @Test
    void noEdgesSelectsNothing() {
        assertTrue(ConditionRouter.select(List.of(), "anything").isEmpty());
    }
}
