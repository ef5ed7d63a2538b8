package com.agentgraph.capability.springai;

import com.agentgraph.capability.LanguageModel;
import com.agentgraph.capability.LanguageModelProvider;
import com.agentgraph.capability.RunOptions;
import com.agentgraph.config.OrchestratorProperties;
import com.agentgraph.config.OrchestratorProperties.AiProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Picks the Spring AI chat model for a run from its options, falling back to the
 * configured defaults.
 */
@Component
@Slf4j
public class SpringAiLanguageModelProvider implements LanguageModelProvider {

    private final ObjectProvider<OpenAiChatModel> openAiChatModel;
    private final ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModel;
    private final OrchestratorProperties properties;

    public SpringAiLanguageModelProvider(ObjectProvider<OpenAiChatModel> openAiChatModel,
                                         ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModel,
                                         OrchestratorProperties properties) {
        this.openAiChatModel = openAiChatModel;
        this.googleGenAiChatModel = googleGenAiChatModel;
        this.properties = properties;
    }

    @Override
    public LanguageModel resolve(RunOptions options) {
        RunOptions effective = options == null ? RunOptions.defaults() : options;
        AiProvider provider = resolveProvider(effective.provider());
        OrchestratorProperties.ModelConfig config = properties.getModel();
        String model = StringUtils.hasText(effective.model())
                ? effective.model()
                : (provider == AiProvider.GOOGLE ? config.getGoogleModel() : config.getOpenaiModel());
        Double temperature = effective.temperature() != null ? effective.temperature() : config.getTemperature();
        ChatModel chatModel = provider == AiProvider.GOOGLE
                ? googleGenAiChatModel.getIfAvailable()
                : openAiChatModel.getIfAvailable();
        if (chatModel == null) {
            throw new IllegalStateException("No chat model configured for provider " + provider);
        }
        log.debug("Resolved language model {}/{} (temperature={})", provider, model, temperature);
        return new SpringAiLanguageModel(chatModel, model, temperature);
    }

    private AiProvider resolveProvider(String requested) {
        if (!StringUtils.hasText(requested)) {
            return properties.getModel().getProvider();
        }
        try {
            return AiProvider.valueOf(requested.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown model provider '{}', using {}", requested, properties.getModel().getProvider());
            return properties.getModel().getProvider();
        }
    }
}
