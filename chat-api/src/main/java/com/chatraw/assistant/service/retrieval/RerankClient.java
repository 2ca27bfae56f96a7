package com.chatraw.assistant.service.retrieval;

import reactor.core.publisher.Mono;

import java.util.List;

public interface RerankClient {

    boolean isConfigured();

    Mono<List<RerankScore>> rerank(String query, List<String> documents);

    record RerankScore(int index, double score) {}
}
