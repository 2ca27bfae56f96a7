package com.chatraw.assistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionProgress(
        String status,
        Integer progress,
        Integer current,
        Integer total,
        String filename
) {

    public static IngestionProgress chunking(int total) {
        return new IngestionProgress("chunking", null, null, total, null);
    }

    public static IngestionProgress embedding(int current, int total) {
        int progress = total == 0 ? 100 : (int) ((long) current * 100 / total);
        return new IngestionProgress("embedding", progress, current, total, null);
    }

    public static IngestionProgress done(String filename) {
        return new IngestionProgress("done", null, null, null, filename);
    }
}
