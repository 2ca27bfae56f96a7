package com.chatraw.assistant.service.retrieval;

import reactor.core.publisher.Mono;

import java.util.List;

public interface RagService {

    Mono<RetrievedContext> retrieve(String query, RetrievalSettings settings);

    record RetrievedContext(String promptBlock, List<Candidate> references) {

        public static RetrievedContext empty() {
            return new RetrievedContext("", List.of());
        }

        public boolean isEmpty() {
            return references == null || references.isEmpty();
        }
    }
}
