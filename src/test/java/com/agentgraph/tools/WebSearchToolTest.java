package com.agentgraph.tools;

import com.agentgraph.config.OrchestratorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebSearchToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OrchestratorProperties properties;
    private MockRestServiceServer server;
    private WebSearchTool tool;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.getWebSearch().setApiKey("test-key");
        properties.getWebSearch().setBaseUrl("https://search.example");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        tool = new WebSearchTool(builder, objectMapper, properties);
    }

    @Test
    void returnsAnswerAndResults() throws Exception {
        server.expect(requestTo("https://search.example/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.query").value("weather in Paris"))
                .andExpect(jsonPath("$.max_results").value(3))
                .andRespond(withSuccess("""
                        {"answer":"Sunny, 22C","results":[
                          {"title":"Forecast","url":"https://weather.example/paris","content":"Clear skies","score":0.91}
                        ]}""", MediaType.APPLICATION_JSON));

        JsonNode result = objectMapper.readTree(tool.invoke("{\"query\":\"weather in Paris\",\"maxResults\":3}"));

        server.verify();
        assertEquals("Sunny, 22C", result.get("answer").asText());
        assertEquals(1, result.get("results").size());
        assertEquals("https://weather.example/paris", result.get("results").get(0).get("url").asText());
        assertEquals(0.91, result.get("results").get(0).get("score").asDouble());
    }

    @Test
    void reportsHttpFailureInPayload() throws Exception {
        server.expect(requestTo("https://search.example/search")).andRespond(withServerError());

        JsonNode result = objectMapper.readTree(tool.invoke("{\"query\":\"anything\"}"));

        assertTrue(result.has("error"));
        assertTrue(result.get("results").isEmpty());
    }

    @Test
    void requiresQuery() throws Exception {
        JsonNode result = objectMapper.readTree(tool.invoke("{}"));

        assertEquals("Missing query", result.get("error").asText());
    }

    @Test
    void requiresApiKey() throws Exception {
        properties.getWebSearch().setApiKey(null);

        JsonNode result = objectMapper.readTree(tool.invoke("{\"query\":\"x\"}"));

        assertEquals("Web search API key not configured", result.get("error").asText());
    }
}
