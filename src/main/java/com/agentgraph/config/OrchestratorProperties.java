package com.agentgraph.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agentgraph")
public class OrchestratorProperties {

    private ModelConfig model = new ModelConfig();
    private SupervisorConfig supervisor = new SupervisorConfig();
    private DagConfig dag = new DagConfig();
    private AgentLoopConfig agentLoop = new AgentLoopConfig();
    private NormalizerConfig normalizer = new NormalizerConfig();
    private WebSearchConfig webSearch = new WebSearchConfig();
    private StreamConfig stream = new StreamConfig();

    public enum AiProvider {
        OPENAI, GOOGLE
    }

    public static class ModelConfig {
        private AiProvider provider = AiProvider.OPENAI;
        private String openaiModel = "gpt-4o";
        private String googleModel = "gemini-2.0-flash";
        private double temperature = 0.7;

        public AiProvider getProvider() { return provider; }
        public void setProvider(AiProvider provider) { this.provider = provider; }
        public String getOpenaiModel() { return openaiModel; }
        public void setOpenaiModel(String openaiModel) { this.openaiModel = openaiModel; }
        public String getGoogleModel() { return googleModel; }
        public void setGoogleModel(String googleModel) { this.googleModel = googleModel; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
    }

    public static class SupervisorConfig {
        private int stepLimit = 25;
        private List<AgentConfig> agents = new ArrayList<>();

        public int getStepLimit() { return stepLimit; }
        public void setStepLimit(int stepLimit) { this.stepLimit = stepLimit; }
        public List<AgentConfig> getAgents() { return agents; }
        public void setAgents(List<AgentConfig> agents) { this.agents = agents; }
    }

    public static class AgentConfig {
        private String name;
        private String prompt;
        private List<String> tools = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getPrompt() { return prompt; }
        public void setPrompt(String prompt) { this.prompt = prompt; }
        public List<String> getTools() { return tools; }
        public void setTools(List<String> tools) { this.tools = tools; }
    }

    public static class DagConfig {
        private int stepLimit = 50;
        private boolean strictToolReferences = false;

        public int getStepLimit() { return stepLimit; }
        public void setStepLimit(int stepLimit) { this.stepLimit = stepLimit; }
        public boolean isStrictToolReferences() { return strictToolReferences; }
        public void setStrictToolReferences(boolean strictToolReferences) { this.strictToolReferences = strictToolReferences; }
    }

    public static class AgentLoopConfig {
        private int maxIterations = 10;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    }

    public static class NormalizerConfig {
        private boolean bufferNestedText = true;
        private boolean suppressToolRehearsalText = true;
        private List<String> markupTags = new ArrayList<>(List.of("tool_call", "function_call", "tool_use"));

        public boolean isBufferNestedText() { return bufferNestedText; }
        public void setBufferNestedText(boolean bufferNestedText) { this.bufferNestedText = bufferNestedText; }
        public boolean isSuppressToolRehearsalText() { return suppressToolRehearsalText; }
        public void setSuppressToolRehearsalText(boolean suppressToolRehearsalText) { this.suppressToolRehearsalText = suppressToolRehearsalText; }
        public List<String> getMarkupTags() { return markupTags; }
        public void setMarkupTags(List<String> markupTags) { this.markupTags = markupTags; }
    }

    public static class WebSearchConfig {
        private String apiKey;
        private String baseUrl = "https://api.tavily.com";
        private int defaultMaxResults = 5;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public int getDefaultMaxResults() { return defaultMaxResults; }
        public void setDefaultMaxResults(int defaultMaxResults) { this.defaultMaxResults = defaultMaxResults; }
    }

    public static class StreamConfig {
        private long emitterTimeoutMs = 10 * 60 * 1000L;

        public long getEmitterTimeoutMs() { return emitterTimeoutMs; }
        public void setEmitterTimeoutMs(long emitterTimeoutMs) { this.emitterTimeoutMs = emitterTimeoutMs; }
    }

    public ModelConfig getModel() {
        return model;
    }

    public void setModel(ModelConfig model) {
        this.model = model;
    }

    public SupervisorConfig getSupervisor() {
        return supervisor;
    }

    public void setSupervisor(SupervisorConfig supervisor) {
        this.supervisor = supervisor;
    }

    public DagConfig getDag() {
        return dag;
    }

    public void setDag(DagConfig dag) {
        this.dag = dag;
    }

    public AgentLoopConfig getAgentLoop() {
        return agentLoop;
    }

    public void setAgentLoop(AgentLoopConfig agentLoop) {
        this.agentLoop = agentLoop;
    }

    public NormalizerConfig getNormalizer() {
        return normalizer;
    }

    public void setNormalizer(NormalizerConfig normalizer) {
        this.normalizer = normalizer;
    }

    public WebSearchConfig getWebSearch() {
        return webSearch;
    }

    public void setWebSearch(WebSearchConfig webSearch) {
        this.webSearch = webSearch;
    }

    public StreamConfig getStream() {
        return stream;
    }

    public void setStream(StreamConfig stream) {
        this.stream = stream;
    }
}
