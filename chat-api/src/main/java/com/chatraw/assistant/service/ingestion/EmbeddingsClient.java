package com.chatraw.assistant.service.ingestion;

import reactor.core.publisher.Mono;

import java.util.List;

public interface EmbeddingsClient {

    Mono<List<float[]>> embedBatch(List<String> texts, int batchSize);

    default Mono<float[]> embedOne(String text) {
        return embedBatch(List.of(text), 1).map(vectors -> vectors.isEmpty() ? new float[0] : vectors.get(0));
    }
}
