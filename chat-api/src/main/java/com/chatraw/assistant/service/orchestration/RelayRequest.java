package com.chatraw.assistant.service.orchestration;

import com.chatraw.assistant.model.ChatTurn;
import com.chatraw.assistant.service.retrieval.Candidate;

import java.util.List;
import java.util.Objects;

public record RelayRequest(String chatId,
                           String userMessage,
                           List<ChatTurn> messages,
                           boolean thinking,
                           List<Candidate> references) {

    public RelayRequest {
        Objects.requireNonNull(chatId, "chatId");
        messages = messages == null ? List.of() : List.copyOf(messages);
        references = references == null ? List.of() : List.copyOf(references);
    }
}
