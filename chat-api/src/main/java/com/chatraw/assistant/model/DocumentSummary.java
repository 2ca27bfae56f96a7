package com.chatraw.assistant.model;

import java.time.OffsetDateTime;

public record DocumentSummary(String id,
                              String filename,
                              long chunks,
                              OffsetDateTime createdAt) {
}
