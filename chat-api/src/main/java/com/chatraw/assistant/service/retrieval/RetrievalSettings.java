package com.chatraw.assistant.service.retrieval;

public record RetrievalSettings(int chunkSize,
                                int chunkOverlap,
                                int topK,
                                double scoreThreshold) {

    public RetrievalSettings {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        chunkOverlap = Math.max(0, chunkOverlap);
        topK = Math.max(1, topK);
    }
}
