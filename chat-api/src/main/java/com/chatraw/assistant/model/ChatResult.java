package com.chatraw.assistant.model;

import com.chatraw.assistant.service.retrieval.Candidate;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatResult(
        @JsonProperty("chat_id") String chatId,
        String content,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String thinking,
        List<Candidate> references
) {
}
