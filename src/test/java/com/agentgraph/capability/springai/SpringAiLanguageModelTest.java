package com.agentgraph.capability.springai;

import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.ModelChunk;
import com.agentgraph.capability.ModelRequest;
import com.agentgraph.capability.ModelTurn;
import com.agentgraph.capability.ToolCall;
import com.agentgraph.support.RecordingTool;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpringAiLanguageModelTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final SpringAiLanguageModel model = new SpringAiLanguageModel(chatModel, "gpt-4o", 0.2);

    @Test
    void streamForwardsTextAndAnnouncesEachToolCallOnce() {
        AssistantMessage.ToolCall search = new AssistantMessage.ToolCall("c1", "function", "web_search",
                "{\"query\":\"paris\"}");
        when(chatModel.stream(any(Prompt.class))).thenReturn(Flux.just(
                response(AssistantMessage.builder().content("Let me ").build()),
                response(AssistantMessage.builder().content("check.").build()),
                response(toolCallMessage(search)),
                response(toolCallMessage(search))));
        List<ModelChunk> chunks = new ArrayList<>();

        ModelTurn turn = model.stream(request(), chunks::add);

        assertEquals("Let me check.", turn.content());
        assertEquals(List.of(new ToolCall("c1", "web_search", "{\"query\":\"paris\"}")), turn.toolCalls());
        assertEquals(3, chunks.size());
        assertEquals("Let me ", chunks.get(0).contentDelta());
        assertEquals(0, chunks.get(2).toolCallFragments().get(0).index());
        assertEquals("c1", chunks.get(2).toolCallFragments().get(0).id());
    }

    @Test
    void callAssignsIdsToToolCallsWithoutOne() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response(toolCallMessage(
                new AssistantMessage.ToolCall("", "function", "web_search", "{}"))));

        ModelTurn turn = model.call(request());

        assertTrue(turn.hasToolCalls());
        assertTrue(turn.toolCalls().get(0).id().startsWith("call_"));
    }

    @Test
    void promptCarriesSystemTextHistoryAndExternallyExecutedTools() {
        ModelRequest request = ModelRequest.builder()
                .systemPrompt("You route.")
                .responseFormat("Reply with JSON.")
                .messages(List.of(
                        ChatMessage.user("weather?"),
                        ChatMessage.assistant("", "researcher", List.of(new ToolCall("c1", "web_search", "{}"))),
                        ChatMessage.toolResult("c1", "web_search", "sunny")))
                .tools(List.of(RecordingTool.returning("web_search", "")))
                .build();

        Prompt prompt = model.toPrompt(request);

        List<Message> messages = prompt.getInstructions();
        assertEquals(4, messages.size());
        assertEquals(MessageType.SYSTEM, messages.get(0).getMessageType());
        assertEquals("You route.\n\nReply with JSON.", messages.get(0).getText());
        assertEquals("c1", ((AssistantMessage) messages.get(2)).getToolCalls().get(0).id());
        ToolResponseMessage.ToolResponse toolResponse = ((ToolResponseMessage) messages.get(3)).getResponses().get(0);
        assertEquals("sunny", toolResponse.responseData());
        assertEquals("c1", toolResponse.id());
        assertEquals("web_search", toolResponse.name());

        ToolCallingChatOptions options = (ToolCallingChatOptions) prompt.getOptions();
        assertFalse(options.getInternalToolExecutionEnabled());
        assertEquals("gpt-4o", options.getModel());
        List<ToolCallback> callbacks = options.getToolCallbacks();
        assertEquals("web_search", callbacks.get(0).getToolDefinition().name());
        assertEquals("Test tool web_search", callbacks.get(0).getToolDefinition().description());
    }

    private static ModelRequest request() {
        return ModelRequest.builder().messages(List.of(ChatMessage.user("hi"))).build();
    }

    private static AssistantMessage toolCallMessage(AssistantMessage.ToolCall call) {
        return AssistantMessage.builder().content("").toolCalls(List.of(call)).build();
    }

    private static ChatResponse response(AssistantMessage message) {
        return new ChatResponse(List.of(new Generation(message)));
    }
}
