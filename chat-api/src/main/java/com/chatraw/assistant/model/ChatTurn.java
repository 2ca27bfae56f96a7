package com.chatraw.assistant.model;

import jakarta.validation.constraints.NotNull;

public record ChatTurn(
        @NotNull ChatMessageRole role,
        String content,
        String imageBase64
) {

    public ChatTurn(ChatMessageRole role, String content) {
        this(role, content, null);
    }

    public boolean hasImage() {
        return imageBase64 != null && !imageBase64.isBlank();
    }
}
