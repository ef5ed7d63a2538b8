package com.agentgraph.config;

import com.agentgraph.stream.NormalizerPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService orchestrationExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public NormalizerPolicy normalizerPolicy(OrchestratorProperties properties) {
        OrchestratorProperties.NormalizerConfig config = properties.getNormalizer();
        return new NormalizerPolicy(config.isBufferNestedText(), config.isSuppressToolRehearsalText(),
                config.getMarkupTags());
    }
}
