package com.chatraw.assistant.service.ingestion;

import com.chatraw.assistant.model.DocumentSummary;
import com.chatraw.assistant.model.IngestionProgress;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

public interface IngestionService {

    Flux<IngestionProgress> ingest(String filename, String text);

    Mono<List<DocumentSummary>> listDocuments();

    Mono<Boolean> deleteDocument(String documentId);
}
