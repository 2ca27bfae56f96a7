package com.chatraw.assistant.service.orchestration.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns server-sent event payloads into {@link CompletionFrame}s. Never throws: payloads that do not decode come
 * back as {@link CompletionFrame.Kind#SKIP}.
 */
@Component
public class CompletionFrameParser {

    private static final Logger log = LoggerFactory.getLogger(CompletionFrameParser.class);

    // checked in this order
    public static final List<String> REASONING_FIELDS = List.of("reasoning_content", "reasoning", "thinking");

    static final String DONE_SENTINEL = "[DONE]";

    private final ObjectMapper objectMapper;

    public CompletionFrameParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CompletionFrame parse(String eventData) {
        String data = eventData == null ? "" : eventData.trim();
        if (DONE_SENTINEL.equals(data)) {
            return CompletionFrame.done();
        }
        if (data.isEmpty()) {
            return CompletionFrame.skip("empty payload");
        }
        JsonNode frame;
        try {
            frame = objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed stream frame: {}", e.getOriginalMessage());
            return CompletionFrame.skip("malformed frame");
        }
        JsonNode delta = frame == null ? null : frame.path("choices").path(0).path("delta");
        if (delta == null || !delta.isObject()) {
            return CompletionFrame.skip("no delta");
        }
        return CompletionFrame.delta(textOf(delta.get("content")), firstPresent(delta, REASONING_FIELDS));
    }

    public static String firstPresent(JsonNode node, List<String> fields) {
        for (String field : fields) {
            String value = textOf(node.get(field));
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static String textOf(JsonNode value) {
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
