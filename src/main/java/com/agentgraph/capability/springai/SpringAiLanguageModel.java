package com.agentgraph.capability.springai;

import com.agentgraph.capability.ChatMessage;
import com.agentgraph.capability.LanguageModel;
import com.agentgraph.capability.ModelChunk;
import com.agentgraph.capability.ModelRequest;
import com.agentgraph.capability.ModelTurn;
import com.agentgraph.capability.ToolCall;
import com.agentgraph.capability.ToolCallFragment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * {@link LanguageModel} over a Spring AI {@link ChatModel}.
 * <p>
 * Internal tool execution is disabled on every prompt: tool calls requested by
 * the model are handed back to the engine, which runs them and feeds the results
 * into the next turn.
 */
@Slf4j
public class SpringAiLanguageModel implements LanguageModel {

    private final ChatModel chatModel;
    private final String model;
    private final Double temperature;

    public SpringAiLanguageModel(ChatModel chatModel, @Nullable String model, @Nullable Double temperature) {
        this.chatModel = chatModel;
        this.model = model;
        this.temperature = temperature;
    }

    @Override
    public ModelTurn call(ModelRequest request) {
        ChatResponse response = chatModel.call(toPrompt(request));
        AssistantMessage output = output(response);
        if (output == null) {
            return ModelTurn.text("");
        }
        List<ToolCall> toolCalls = new ArrayList<>();
        for (AssistantMessage.ToolCall toolCall : output.getToolCalls()) {
            toolCalls.add(new ToolCall(resolveId(toolCall.id()), toolCall.name(), toolCall.arguments()));
        }
        return new ModelTurn(output.getText(), toolCalls);
    }

    @Override
    public ModelTurn stream(ModelRequest request, Consumer<ModelChunk> chunkConsumer) {
        StringBuilder content = new StringBuilder();
        Map<String, ToolCall> toolCalls = new LinkedHashMap<>();
        chatModel.stream(toPrompt(request))
                .doOnNext(response -> {
                    AssistantMessage output = output(response);
                    if (output == null) {
                        return;
                    }
                    String text = output.getText();
                    if (StringUtils.hasLength(text)) {
                        content.append(text);
                        chunkConsumer.accept(ModelChunk.text(text));
                    }
                    for (AssistantMessage.ToolCall toolCall : output.getToolCalls()) {
                        String id = resolveId(toolCall.id());
                        if (toolCalls.containsKey(id)) {
                            continue;
                        }
                        int index = toolCalls.size();
                        toolCalls.put(id, new ToolCall(id, toolCall.name(), toolCall.arguments()));
                        chunkConsumer.accept(ModelChunk.toolCall(
                                new ToolCallFragment(index, id, toolCall.name(), toolCall.arguments())));
                    }
                })
                .blockLast();
        return new ModelTurn(content.toString(), new ArrayList<>(toolCalls.values()));
    }

    Prompt toPrompt(ModelRequest request) {
        List<Message> messages = new ArrayList<>();
        String system = systemText(request);
        if (StringUtils.hasText(system)) {
            messages.add(new SystemMessage(system));
        }
        for (ChatMessage message : request.messages()) {
            messages.add(toSpringMessage(message));
        }
        List<ToolCallback> callbacks = request.tools().stream()
                .map(AgentToolCallback::new)
                .map(ToolCallback.class::cast)
                .toList();
        ToolCallingChatOptions.Builder options = ToolCallingChatOptions.builder()
                .toolCallbacks(callbacks)
                .internalToolExecutionEnabled(false);
        if (StringUtils.hasText(model)) {
            options.model(model);
        }
        if (temperature != null) {
            options.temperature(temperature);
        }
        return new Prompt(messages, options.build());
    }

    private String systemText(ModelRequest request) {
        if (!StringUtils.hasText(request.responseFormat())) {
            return request.systemPrompt();
        }
        if (!StringUtils.hasText(request.systemPrompt())) {
            return request.responseFormat();
        }
        return request.systemPrompt() + "\n\n" + request.responseFormat();
    }

    private Message toSpringMessage(ChatMessage message) {
        return switch (message.role()) {
            case SYSTEM -> new SystemMessage(message.content());
            case USER -> new UserMessage(message.content());
            case TOOL -> ToolResponseMessage.builder()
                    .responses(List.of(new ToolResponseMessage.ToolResponse(
                            message.toolCallId(), message.name(), message.content())))
                    .build();
            case ASSISTANT -> {
                if (message.toolCalls().isEmpty()) {
                    yield AssistantMessage.builder().content(message.content()).build();
                }
                List<AssistantMessage.ToolCall> calls = message.toolCalls().stream()
                        .map(call -> new AssistantMessage.ToolCall(call.id(), "function", call.name(), call.arguments()))
                        .toList();
                yield AssistantMessage.builder()
                        .content(message.content())
                        .toolCalls(calls)
                        .build();
            }
        };
    }

    @Nullable
    private AssistantMessage output(@Nullable ChatResponse response) {
        if (response == null || response.getResult() == null) {
            return null;
        }
        return response.getResult().getOutput();
    }

    private String resolveId(@Nullable String id) {
        if (StringUtils.hasText(id)) {
            return id;
        }
        String generated = "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        log.debug("Model returned a tool call without id; assigned {}", generated);
        return generated;
    }
}
