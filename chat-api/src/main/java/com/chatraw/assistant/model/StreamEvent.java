package com.chatraw.assistant.model;

import com.chatraw.assistant.service.retrieval.Candidate;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEvent(
        @JsonProperty("chat_id") String chatId,
        String content,
        String thinking,
        List<Candidate> references,
        String error,
        @JsonProperty("done") Boolean doneFlag
) {

    public static StreamEvent chatId(String chatId) {
        return new StreamEvent(Objects.requireNonNull(chatId, "chatId"), null, null, null, null, null);
    }

    public static StreamEvent content(String text) {
        return new StreamEvent(null, Objects.requireNonNull(text, "text"), null, null, null, null);
    }

    public static StreamEvent thinking(String text) {
        return new StreamEvent(null, null, Objects.requireNonNull(text, "text"), null, null, null);
    }

    public static StreamEvent references(List<Candidate> references) {
        return new StreamEvent(null, null, null, List.copyOf(references), null, null);
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(null, null, null, null, message == null ? "Unknown error" : message, null);
    }

    public static StreamEvent done() {
        return new StreamEvent(null, null, null, null, null, Boolean.TRUE);
    }
}
