package com.chatraw.assistant.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ChatSubmission(
        @JsonProperty("chat_id") String chatId,
        @NotBlank(message = "Message is required") String message,
        @JsonProperty("use_rag") Boolean useRag,
        @JsonProperty("web_content") String webContent,
        @JsonProperty("web_url") String webUrl,
        Boolean thinking,
        @JsonProperty("image_base64") String imageBase64
) {

    public boolean ragRequested() {
        return Boolean.TRUE.equals(useRag);
    }

    public boolean hasWebContent() {
        return webContent != null && !webContent.isBlank();
    }
}
