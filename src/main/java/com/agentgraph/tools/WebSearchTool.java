package com.agentgraph.tools;

import com.agentgraph.capability.AgentTool;
import com.agentgraph.config.OrchestratorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code web_search}: queries the Tavily search API and returns a compact JSON
 * document with the answer and the top results. Failures are reported inside the
 * JSON payload so the calling agent can react to them.
 */
@Component
@Slf4j
public class WebSearchTool implements AgentTool {

    public static final String NAME = "web_search";

    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "query": {"type": "string", "description": "The search query"},
                "maxResults": {"type": "integer", "description": "Maximum number of results"}
              },
              "required": ["query"]
            }""";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final OrchestratorProperties.WebSearchConfig config;

    public WebSearchTool(RestClient.Builder restClientBuilder, ObjectMapper objectMapper,
                         OrchestratorProperties properties) {
        this.config = properties.getWebSearch();
        this.restClient = restClientBuilder.baseUrl(config.getBaseUrl()).build();
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Search the web for current information. Use this when you need up-to-date information "
                + "or facts you are not sure about.";
    }

    @Override
    public String inputSchema() {
        return SCHEMA;
    }

    @Override
    public String invoke(String argumentsJson) {
        if (!StringUtils.hasText(config.getApiKey())) {
            return error("Web search API key not configured");
        }
        String query;
        int maxResults;
        try {
            JsonNode args = objectMapper.readTree(StringUtils.hasText(argumentsJson) ? argumentsJson : "{}");
            query = args.path("query").asText("");
            maxResults = args.path("maxResults").asInt(config.getDefaultMaxResults());
        } catch (Exception ex) {
            return error("Invalid arguments: " + ex.getMessage());
        }
        if (!StringUtils.hasText(query)) {
            return error("Missing query");
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("query", query);
            body.put("max_results", maxResults);
            body.put("search_depth", "basic");
            body.put("include_answer", true);
            JsonNode response = restClient.post()
                    .uri("/search")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("Authorization", "Bearer " + config.getApiKey())
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            return summarize(response);
        } catch (RestClientException ex) {
            log.warn("Web search failed for query '{}': {}", query, ex.getMessage());
            return error(ex.getMessage() == null ? "Search failed" : ex.getMessage());
        }
    }

    private String summarize(JsonNode response) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("answer", response == null ? "" : response.path("answer").asText(""));
        ArrayNode results = root.putArray("results");
        if (response != null) {
            for (JsonNode item : response.path("results")) {
                ObjectNode result = results.addObject();
                result.put("title", item.path("title").asText(""));
                result.put("url", item.path("url").asText(""));
                result.put("content", item.path("content").asText(""));
                result.put("score", item.path("score").asDouble(0));
            }
        }
        return root.toString();
    }

    private String error(String message) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("error", message);
        root.putArray("results");
        return root.toString();
    }
}
