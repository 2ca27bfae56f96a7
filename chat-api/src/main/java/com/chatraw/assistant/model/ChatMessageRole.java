package com.chatraw.assistant.model;

import java.util.Locale;

public enum ChatMessageRole {
    SYSTEM,
    USER,
    ASSISTANT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
