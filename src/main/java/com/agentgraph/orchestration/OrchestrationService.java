package com.agentgraph.orchestration;

import com.agentgraph.capability.AgentTool;
import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.ConversationContextProvider;
import com.agentgraph.capability.LanguageModel;
import com.agentgraph.capability.LanguageModelProvider;
import com.agentgraph.config.OrchestratorProperties;
import com.agentgraph.engine.ExecutionEngine;
import com.agentgraph.engine.RoutingException;
import com.agentgraph.engine.RunCancelledException;
import com.agentgraph.engine.RunContext;
import com.agentgraph.engine.RunControl;
import com.agentgraph.engine.RunOutcome;
import com.agentgraph.engine.ToolResolver;
import com.agentgraph.graph.ExecutableGraph;
import com.agentgraph.graph.GraphCompiler;
import com.agentgraph.graph.GraphException;
import com.agentgraph.graph.SupervisorGraphFactory;
import com.agentgraph.protocol.ProtocolEvent;
import com.agentgraph.protocol.ProtocolEventSink;
import com.agentgraph.stream.EventNormalizer;
import com.agentgraph.stream.NormalizerPolicy;
import com.agentgraph.stream.RunStreamHub;
import com.agentgraph.stream.RunSubscriber;
import com.agentgraph.tools.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Run lifecycle: builds the graph for a request, executes it on the
 * orchestration pool and frames the normalized events with
 * {@code RUN_STARTED} and {@code RUN_FINISHED}/{@code RUN_ERROR}.
 */
@Service
@Slf4j
public class OrchestrationService {

    public static final String RUN_FAILED = "RUN_FAILED";

    private final GraphCompiler graphCompiler;
    private final SupervisorGraphFactory supervisorGraphFactory;
    private final AgentRoster agentRoster;
    private final ExecutionEngine executionEngine;
    private final LanguageModelProvider languageModelProvider;
    private final ToolRegistry toolRegistry;
    private final ObjectProvider<RunToolBinder> runToolBinders;
    private final ConversationContextProvider conversationContextProvider;
    private final RunStreamHub streamHub;
    private final NormalizerPolicy normalizerPolicy;
    private final OrchestratorProperties properties;
    private final ExecutorService orchestrationExecutor;

    public OrchestrationService(GraphCompiler graphCompiler,
                                SupervisorGraphFactory supervisorGraphFactory,
                                AgentRoster agentRoster,
                                ExecutionEngine executionEngine,
                                LanguageModelProvider languageModelProvider,
                                ToolRegistry toolRegistry,
                                ObjectProvider<RunToolBinder> runToolBinders,
                                ConversationContextProvider conversationContextProvider,
                                RunStreamHub streamHub,
                                NormalizerPolicy normalizerPolicy,
                                OrchestratorProperties properties,
                                @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor) {
        this.graphCompiler = graphCompiler;
        this.supervisorGraphFactory = supervisorGraphFactory;
        this.agentRoster = agentRoster;
        this.executionEngine = executionEngine;
        this.languageModelProvider = languageModelProvider;
        this.toolRegistry = toolRegistry;
        this.runToolBinders = runToolBinders;
        this.conversationContextProvider = conversationContextProvider;
        this.streamHub = streamHub;
        this.normalizerPolicy = normalizerPolicy;
        this.properties = properties;
        this.orchestrationExecutor = orchestrationExecutor;
    }

    /**
     * Resolves the graph, tools and messages of a request.
     *
     * @throws GraphException when the submitted graph is malformed
     */
    public PreparedRun prepare(OrchestrationRequest request) {
        String threadId = StringUtils.hasText(request.threadId()) ? request.threadId() : UUID.randomUUID().toString();
        List<AgentTool> runTools = new ArrayList<>();
        runToolBinders.orderedStream().forEach(binder -> runTools.addAll(binder.bind(request)));
        ToolResolver tools = resolver(runTools);

        ExecutableGraph graph;
        int defaultStepLimit;
        if (request.isDag()) {
            graph = graphCompiler.compile(request.graph().nodes(), request.graph().edges());
            defaultStepLimit = properties.getDag().getStepLimit();
        } else {
            graph = supervisorGraphFactory.create(agentRoster.agents(runTools));
            defaultStepLimit = properties.getSupervisor().getStepLimit();
        }
        int stepLimit = request.stepLimit() != null && request.stepLimit() > 0 ? request.stepLimit() : defaultStepLimit;

        List<ChatMessage> messages = new ArrayList<>(conversationContextProvider.load(threadId));
        messages.addAll(request.messages());
        return new PreparedRun(threadId, graph, messages, request.messages(), tools, request.options(), stepLimit);
    }

    /**
     * Registers a run with the stream hub, attaches {@code subscriber} and
     * executes the run asynchronously.
     */
    public RunHandle start(PreparedRun run, RunSubscriber subscriber) {
        String runId = streamHub.createRun();
        streamHub.subscribe(runId, subscriber, 0L);
        log.info("Starting {} run {} on thread {}", run.graph().mode(), runId, run.threadId());
        CompletableFuture
                .runAsync(() -> execute(run, runId, event -> streamHub.emit(runId, event),
                        () -> streamHub.isCancelled(runId)), orchestrationExecutor)
                .whenComplete((ignored, ex) -> {
                    if (ex != null) {
                        log.error("Run {} terminated abnormally", runId, ex);
                    }
                    streamHub.complete(runId);
                });
        return new RunHandle(run.threadId(), runId);
    }

    public boolean cancel(String runId) {
        return streamHub.cancelRun(runId);
    }

    /**
     * Executes a prepared run synchronously, emitting its protocol events to
     * {@code sink}.
     *
     * @return the outcome, or {@code null} when the run did not complete
     */
    @Nullable
    public RunOutcome execute(PreparedRun run, String runId, ProtocolEventSink sink, RunControl control) {
        EventNormalizer normalizer = new EventNormalizer(sink, normalizerPolicy);
        sink.emit(ProtocolEvent.runStarted(run.threadId(), runId));
        try {
            LanguageModel model = languageModelProvider.resolve(run.options());
            RunContext context = new RunContext(model, run.tools(), normalizer, control, run.stepLimit());
            RunOutcome outcome = executionEngine.execute(run.graph(), run.messages(), context);
            normalizer.finish();
            remember(run, outcome);
            sink.emit(ProtocolEvent.runFinished(run.threadId(), runId));
            log.info("Run {} finished after {} steps", runId, outcome.steps());
            return outcome;
        } catch (RunCancelledException ex) {
            log.info("Run {} stopped after cancellation", runId);
        } catch (RoutingException ex) {
            log.warn("Run {} failed to route: {}", runId, ex.getMessage());
            fail(normalizer, sink, ex.getMessage(), RoutingException.CODE);
        } catch (GraphException ex) {
            log.warn("Run {} hit a graph error: {}", runId, ex.getMessage());
            fail(normalizer, sink, ex.getMessage(), GraphException.CODE);
        } catch (RuntimeException ex) {
            log.error("Run {} failed", runId, ex);
            fail(normalizer, sink, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(),
                    RUN_FAILED);
        }
        return null;
    }

    private void fail(EventNormalizer normalizer, ProtocolEventSink sink, String message, String code) {
        normalizer.finish();
        sink.emit(ProtocolEvent.runError(message, code));
    }

    private void remember(PreparedRun run, RunOutcome outcome) {
        List<ChatMessage> toStore = new ArrayList<>(run.newMessages());
        outcome.produced().stream()
                .filter(ChatMessage::isVisibleAssistantText)
                .forEach(toStore::add);
        conversationContextProvider.append(run.threadId(), toStore);
    }

    private ToolResolver resolver(List<AgentTool> runTools) {
        if (runTools.isEmpty()) {
            return toolRegistry::find;
        }
        Map<String, AgentTool> scoped = new LinkedHashMap<>();
        runTools.forEach(tool -> scoped.put(tool.name(), tool));
        return name -> Optional.ofNullable(scoped.get(name)).or(() -> toolRegistry.find(name));
    }
}
