package com.agentgraph.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Lenient JSON handling for model output, which often wraps the requested JSON
 * object in prose or code fences.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private final ObjectMapper objectMapper;

    @Nullable
    public <T> T parseJsonResponse(String label, @Nullable String raw, Class<T> type) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty {} from model; nothing to parse", label);
            return null;
        }
        String json = extractJsonObject(raw);
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception ex) {
            log.warn("Failed to parse {} as JSON. Snippet: {}", label, truncate(raw, 240));
            return null;
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Value is not serializable as JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    private String extractJsonObject(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed;
        }
        int firstBrace = trimmed.indexOf('{');
        int lastBrace = trimmed.lastIndexOf('}');
        if (firstBrace >= 0 && lastBrace > firstBrace) {
            return trimmed.substring(firstBrace, lastBrace + 1);
        }
        return trimmed;
    }

    private String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }
}
