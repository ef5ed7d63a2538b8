package com.agentgraph.engine;

import com.agentgraph.capability.AgentTool;
import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.MessageRole;
import com.agentgraph.capability.MessageTag;
import com.agentgraph.config.OrchestratorProperties;
import com.agentgraph.graph.AgentDefinition;
import com.agentgraph.graph.ExecutableGraph;
import com.agentgraph.graph.GraphCompiler;
import com.agentgraph.graph.GraphEdge;
import com.agentgraph.graph.GraphException;
import com.agentgraph.graph.GraphNode;
import com.agentgraph.graph.NodeType;
import com.agentgraph.graph.SupervisorGraphFactory;
import com.agentgraph.protocol.ProtocolEvent;
import com.agentgraph.stream.EventNormalizer;
import com.agentgraph.stream.NormalizerPolicy;
import com.agentgraph.support.RecordingSink;
import com.agentgraph.support.RecordingTool;
import com.agentgraph.support.ScriptedLanguageModel;
import com.agentgraph.support.TestFixtures;
import com.agentgraph.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.agentgraph.protocol.EventType.CUSTOM;
import static com.agentgraph.protocol.EventType.STEP_FINISHED;
import static com.agentgraph.protocol.EventType.STEP_STARTED;
import static com.agentgraph.protocol.EventType.TEXT_MESSAGE_CONTENT;
import static com.agentgraph.protocol.EventType.TEXT_MESSAGE_END;
import static com.agentgraph.protocol.EventType.TEXT_MESSAGE_START;
import static com.agentgraph.protocol.EventType.TOOL_CALL_ARGS;
import static com.agentgraph.protocol.EventType.TOOL_CALL_END;
import static com.agentgraph.protocol.EventType.TOOL_CALL_RESULT;
import static com.agentgraph.protocol.EventType.TOOL_CALL_START;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionEngineTest {

    private static final List<ChatMessage> WEATHER_QUESTION = List.of(ChatMessage.user("weather in Paris"));

    private ExecutionEngine engine;
    private RecordingSink sink;
    private EventNormalizer normalizer;
    private ScriptedLanguageModel model;

    @BeforeEach
    void setUp() {
        engine = TestFixtures.engine(new OrchestratorProperties());
        sink = new RecordingSink();
        normalizer = new EventNormalizer(sink, NormalizerPolicy.defaults());
        model = new ScriptedLanguageModel();
    }

    @Test
    void dagRunsToolThenAgentInEdgeOrder() {
        RecordingTool search = RecordingTool.returning("web_search", "{\"answer\":\"sunny\"}");
        ExecutableGraph graph = dag(search,
                List.of(GraphNode.of("start", NodeType.START, null),
                        new GraphNode("fetch", NodeType.TOOL, "fetch",
                                Map.of("toolName", "web_search", "input", Map.of("query", "{{userInput}}"))),
                        new GraphNode("writer", NodeType.AGENT, "writer", Map.of("prompt", "Summarize.")),
                        GraphNode.of("end", NodeType.END, null)),
                List.of(GraphEdge.of("start", "fetch"), GraphEdge.of("fetch", "writer"), GraphEdge.of("writer", "end")));
        model.reply("It is ", "sunny.");

        RunOutcome outcome = run(graph, search, 10);

        assertEquals(List.of("{\"query\":\"weather in Paris\"}"), search.invocations());
        assertEquals(2, outcome.steps());
        assertFalse(outcome.stepLimitReached());
        ChatMessage toolOutput = outcome.produced().get(0);
        assertEquals(MessageRole.USER, toolOutput.role());
        assertTrue(toolOutput.hasTag(MessageTag.TOOL_OUTPUT));
        assertEquals("[Tool web_search]: {\"answer\":\"sunny\"}", toolOutput.content());
        assertEquals("It is sunny.", outcome.produced().get(1).content());
        assertEquals("Summarize.", model.requests().get(0).systemPrompt());
        assertEquals(toolOutput, model.requests().get(0).messages().get(1));

        assertEquals(List.of(STEP_STARTED, TOOL_CALL_START, TOOL_CALL_ARGS, TOOL_CALL_END, TOOL_CALL_RESULT,
                STEP_FINISHED, STEP_STARTED, TEXT_MESSAGE_START, TEXT_MESSAGE_CONTENT, TEXT_MESSAGE_END,
                STEP_FINISHED), sink.types());
        assertEquals(List.of("fetch", "writer"),
                sink.ofType(STEP_STARTED).stream().map(ProtocolEvent::stepName).toList());
        assertEquals("It is sunny.", sink.text());
    }

    @Test
    void supervisorRespondsDirectlyWithoutRoutingNotes() {
        ExecutableGraph graph = new SupervisorGraphFactory().create(
                List.of(new AgentDefinition("researcher", "Finds facts.", List.of())));
        model.reply("{\"next\":\"RESPOND\",\"reason\":\"greeting\"}")
                .reply("Hello", " there");

        RunOutcome outcome = run(graph, null, 25);

        assertEquals(2, outcome.steps());
        assertEquals(List.of(STEP_STARTED, TEXT_MESSAGE_START, TEXT_MESSAGE_CONTENT, TEXT_MESSAGE_CONTENT,
                TEXT_MESSAGE_END, STEP_FINISHED), sink.types());
        assertEquals("responder", sink.events().get(0).stepName());
        assertEquals("Hello there", sink.text());

        assertNotNull(model.requests().get(0).responseFormat());
        assertTrue(model.requests().get(0).systemPrompt().contains("researcher"));
        assertEquals(WEATHER_QUESTION, model.requests().get(1).messages());
        assertTrue(outcome.produced().get(0).hasTag(MessageTag.ROUTING));
        assertEquals("[Supervisor] Routing to RESPOND: greeting", outcome.produced().get(0).content());
    }

    @Test
    void supervisorDispatchesToAgentWithToolsAndTerminates() {
        RecordingTool search = RecordingTool.returning("web_search", "22C and clear");
        ExecutableGraph graph = new SupervisorGraphFactory().create(
                List.of(new AgentDefinition("researcher", "Finds facts.", List.of(search))));
        model.reply("```json\n{\"next\":\"researcher\",\"reason\":\"needs data\"}\n```")
                .toolCall("c1", "web_search", "{\"query\":\"paris\"}")
                .reply("It is 22C in Paris.")
                .reply("{\"next\":\"TERMINATE\",\"reason\":\"answered\"}");

        RunOutcome outcome = run(graph, search, 25);

        assertEquals(3, outcome.steps());
        assertEquals(List.of("{\"query\":\"paris\"}"), search.invocations());
        assertEquals(List.of(STEP_STARTED, TOOL_CALL_START, TOOL_CALL_ARGS, TOOL_CALL_END, TOOL_CALL_RESULT,
                TEXT_MESSAGE_START, TEXT_MESSAGE_CONTENT, TEXT_MESSAGE_END, STEP_FINISHED), sink.types());
        assertEquals("researcher", sink.events().get(0).stepName());
        assertEquals("It is 22C in Paris.", sink.text());
        assertEquals("22C and clear", sink.ofType(TOOL_CALL_RESULT).get(0).content());

        List<ChatMessage> agentTurn = model.requests().get(2).messages();
        ChatMessage toolResult = agentTurn.get(agentTurn.size() - 1);
        assertEquals(MessageRole.TOOL, toolResult.role());
        assertEquals("c1", toolResult.toolCallId());
        assertEquals(1, model.requests().get(1).tools().size());
    }

    @Test
    void agentReportsUnavailableToolBackToModel() {
        ExecutableGraph graph = new SupervisorGraphFactory().create(
                List.of(new AgentDefinition("researcher", "Finds facts.", List.of())));
        model.reply("{\"next\":\"researcher\"}")
                .toolCall("c1", "web_search", "{}")
                .reply("I could not search.")
                .reply("{\"next\":\"TERMINATE\"}");

        RunOutcome outcome = run(graph, null, 25);

        ChatMessage toolResult = outcome.produced().stream()
                .filter(message -> message.role() == MessageRole.TOOL)
                .findFirst()
                .orElseThrow();
        assertEquals("Error: tool 'web_search' is not available", toolResult.content());
        assertEquals("I could not search.", sink.text());
    }

    @Test
    void cycleIsBoundedByStepLimit() {
        ExecutableGraph graph = dag(null,
                List.of(GraphNode.of("start", NodeType.START, null),
                        GraphNode.of("a", NodeType.AGENT, null),
                        GraphNode.of("b", NodeType.AGENT, null)),
                List.of(GraphEdge.of("start", "a"), GraphEdge.of("a", "b"), GraphEdge.of("b", "a")));
        model.otherwise("again");

        RunOutcome outcome = run(graph, null, 5);

        assertEquals(5, outcome.steps());
        assertTrue(outcome.stepLimitReached());
        assertEquals(5, model.requests().size());
        assertEquals(sink.ofType(STEP_STARTED).size(), sink.ofType(STEP_FINISHED).size());
    }

    @Test
    void missingToolPassesStateThrough() {
        ExecutableGraph graph = dag(null,
                List.of(GraphNode.of("start", NodeType.START, null),
                        new GraphNode("fetch", NodeType.TOOL, null, Map.of("toolName", "rag_retrieval")),
                        GraphNode.of("writer", NodeType.AGENT, null)),
                List.of(GraphEdge.of("start", "fetch"), GraphEdge.of("fetch", "writer")));
        model.reply("No documents, but here is an answer.");

        RunOutcome outcome = run(graph, null, 10);

        assertEquals(2, outcome.steps());
        assertEquals(1, outcome.produced().size());
        assertTrue(sink.ofType(TOOL_CALL_START).isEmpty());
        assertEquals(WEATHER_QUESTION, model.requests().get(0).messages());
    }

    @Test
    void failingNodeIsRecordedAndRunContinues() {
        RecordingTool broken = RecordingTool.failing("web_search", "quota exceeded");
        ExecutableGraph graph = dag(broken,
                List.of(GraphNode.of("start", NodeType.START, null),
                        new GraphNode("fetch", NodeType.TOOL, null, Map.of("toolName", "web_search")),
                        GraphNode.of("writer", NodeType.AGENT, null)),
                List.of(GraphEdge.of("start", "fetch"), GraphEdge.of("fetch", "writer")));
        model.reply("Search is down.");

        RunOutcome outcome = run(graph, broken, 10);

        ChatMessage error = outcome.produced().get(0);
        assertTrue(error.hasTag(MessageTag.ERROR));
        assertEquals("[Error in fetch]: quota exceeded", error.content());
        assertEquals("Search is down.", outcome.produced().get(1).content());

        ProtocolEvent custom = sink.ofType(CUSTOM).get(0);
        assertEquals(EventNormalizer.NODE_ERROR_EVENT, custom.name());
        assertEquals(Map.of("stepName", "fetch", "message", "quota exceeded"), custom.value());
        assertEquals("Error: quota exceeded", sink.ofType(TOOL_CALL_RESULT).get(0).content());
    }

    @Test
    void conditionNodeFollowsKeywordEdge() {
        ExecutableGraph graph = dag(null,
                List.of(GraphNode.of("start", NodeType.START, null),
                        GraphNode.of("review", NodeType.AGENT, null),
                        GraphNode.of("check", NodeType.CONDITION, null),
                        GraphNode.of("ship", NodeType.AGENT, null),
                        GraphNode.of("fix", NodeType.AGENT, null)),
                List.of(GraphEdge.of("start", "review"), GraphEdge.of("review", "check"),
                        new GraphEdge("check", "ship", "approved"),
                        new GraphEdge("check", "fix", "rejected")));
        model.reply("Verdict: APPROVED").reply("Shipped.");

        RunOutcome outcome = run(graph, null, 10);

        assertEquals(3, outcome.steps());
        assertEquals("Shipped.", outcome.messages().get(outcome.messages().size() - 1).content());
        assertEquals(List.of("review", "check", "ship"),
                sink.ofType(STEP_STARTED).stream().map(ProtocolEvent::stepName).toList());
    }

    @Test
    void fanOutFromNonConditionNodeIsGraphError() {
        ExecutableGraph graph = dag(null,
                List.of(GraphNode.of("start", NodeType.START, null),
                        GraphNode.of("a", NodeType.AGENT, null),
                        GraphNode.of("b", NodeType.AGENT, null),
                        GraphNode.of("c", NodeType.AGENT, null)),
                List.of(GraphEdge.of("start", "a"), GraphEdge.of("a", "b"), GraphEdge.of("a", "c")));
        model.otherwise("done");

        assertThrows(GraphException.class, () -> run(graph, null, 10));
    }

    @Test
    void unknownRoutingTargetIsFatal() {
        ExecutableGraph graph = new SupervisorGraphFactory().create(
                List.of(new AgentDefinition("researcher", "", List.of())));
        model.reply("{\"next\":\"astrologer\",\"reason\":\"stars\"}");

        RoutingException ex = assertThrows(RoutingException.class, () -> run(graph, null, 25));

        assertTrue(ex.getMessage().contains("astrologer"));
    }

    @Test
    void unparsableRoutingDecisionIsFatal() {
        ExecutableGraph graph = new SupervisorGraphFactory().create(List.of());
        model.reply("I think we should respond.");

        assertThrows(RoutingException.class, () -> run(graph, null, 25));
    }

    @Test
    void cancelledRunStopsBeforeFirstNode() {
        ExecutableGraph graph = new SupervisorGraphFactory().create(List.of());
        RunContext context = new RunContext(model, name -> Optional.empty(), normalizer, () -> true, 25);

        assertThrows(RunCancelledException.class, () -> engine.execute(graph, WEATHER_QUESTION, context));
        assertTrue(model.requests().isEmpty());
    }

    private ExecutableGraph dag(AgentTool tool, List<GraphNode> nodes, List<GraphEdge> edges) {
        ToolRegistry registry = tool == null ? TestFixtures.registry() : TestFixtures.registry(tool);
        return new GraphCompiler(registry, new OrchestratorProperties()).compile(nodes, edges);
    }

    private RunOutcome run(ExecutableGraph graph, AgentTool tool, int stepLimit) {
        ToolRegistry registry = tool == null ? TestFixtures.registry() : TestFixtures.registry(tool);
        RunContext context = new RunContext(model, registry::find, normalizer, RunControl.none(), stepLimit);
        RunOutcome outcome = engine.execute(graph, WEATHER_QUESTION, context);
        normalizer.finish();
        return outcome;
    }
}
