package com.agentgraph.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProtocolEventSerializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProtocolEventSerializer serializer = new ProtocolEventSerializer(objectMapper);

    @Test
    void omitsFieldsThatDoNotBelongToTheEventType() throws Exception {
        JsonNode json = objectMapper.readTree(serializer.toJson(ProtocolEvent.textMessageContent("m1", "Hi")));

        assertEquals("TEXT_MESSAGE_CONTENT", json.get("type").asText());
        assertEquals("m1", json.get("messageId").asText());
        assertEquals("Hi", json.get("delta").asText());
        assertTrue(json.has("timestamp"));
        assertFalse(json.has("toolCallId"));
        assertFalse(json.has("runId"));
    }

    @Test
    void toolResultCarriesToolRole() throws Exception {
        JsonNode json = objectMapper.readTree(serializer.toJson(ProtocolEvent.toolCallResult("c1", "m2", "42")));

        assertEquals("tool", json.get("role").asText());
        assertEquals("c1", json.get("toolCallId").asText());
        assertEquals("42", json.get("content").asText());
    }

    @Test
    void customEventValueIsNestedJson() throws Exception {
        JsonNode json = objectMapper.readTree(serializer.toJson(
                ProtocolEvent.custom("node_error", Map.of("stepName", "fetch", "message", "boom"))));

        assertEquals("node_error", json.get("name").asText());
        assertEquals("fetch", json.get("value").get("stepName").asText());
    }

    @Test
    void sseRecordNamesTheEventType() {
        String record = serializer.toSseRecord(ProtocolEvent.runError("bad graph", "GRAPH_ERROR"));

        assertTrue(record.startsWith("event: RUN_ERROR\ndata: {"));
        assertTrue(record.endsWith("}\n\n"));
        assertTrue(record.contains("\"code\":\"GRAPH_ERROR\""));
    }

    @Test
    void doneRecordIsFixed() {
        assertEquals("event: done\ndata: [DONE]\n\n", ProtocolEventSerializer.DONE_RECORD);
    }
}
