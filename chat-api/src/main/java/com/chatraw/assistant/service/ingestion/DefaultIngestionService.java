package com.chatraw.assistant.service.ingestion;

import com.chatraw.assistant.model.DocumentSummary;
import com.chatraw.assistant.model.IngestionProgress;
import com.chatraw.assistant.service.retrieval.RetrievalSettings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class DefaultIngestionService implements IngestionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionService.class);
    private static final String DEFAULT_FILENAME = "document.txt";

    private final TextChunker textChunker;
    private final EmbeddingsClient embeddingsClient;
    private final DocumentStore documentStore;
    private final RetrievalSettings retrievalSettings;
    private final int embeddingBatchSize;
    private final Counter ingestionCounter;
    private final Counter rejectedCounter;

    public DefaultIngestionService(TextChunker textChunker,
                                   EmbeddingsClient embeddingsClient,
                                   DocumentStore documentStore,
                                   RetrievalSettings retrievalSettings,
                                   MeterRegistry meterRegistry,
                                   @Value("${chat.rag.embedding-batch-size:16}") int embeddingBatchSize) {
        this.textChunker = textChunker;
        this.embeddingsClient = embeddingsClient;
        this.documentStore = documentStore;
        this.retrievalSettings = retrievalSettings;
        this.embeddingBatchSize = Math.max(1, embeddingBatchSize);
        this.ingestionCounter = meterRegistry.counter("chat.ingest.events", "outcome", "accepted");
        this.rejectedCounter = meterRegistry.counter("chat.ingest.events", "outcome", "rejected");
    }

    @Override
    public Flux<IngestionProgress> ingest(String filename, String text) {
        if (text == null || text.isBlank()) {
            rejectedCounter.increment();
            return Flux.error(new IngestionException(HttpStatus.BAD_REQUEST, "Uploaded file is empty"));
        }
        String name = filename == null || filename.isBlank() ? DEFAULT_FILENAME : filename;
        List<String> chunks = textChunker.chunk(text, retrievalSettings.chunkSize(), retrievalSettings.chunkOverlap());
        int total = chunks.size();
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger embedded = new AtomicInteger();

        return Mono.fromCallable(() -> documentStore.saveDocument(name, text))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(documentId -> Flux.concat(
                        Flux.just(IngestionProgress.chunking(total)),
                        Flux.fromIterable(partition(chunks))
                                .concatMap(group -> embeddingsClient.embedBatch(group, embeddingBatchSize)
                                        .publishOn(Schedulers.boundedElastic())
                                        .flatMapIterable(vectors -> storeGroup(documentId, group, vectors, completed, embedded, total))),
                        Mono.fromSupplier(() -> IngestionProgress.done(name))))
                .doOnComplete(() -> {
                    ingestionCounter.increment();
                    log.info("Ingested {} into {} chunks ({} embedded)", name, total, embedded.get());
                });
    }

    @Override
    public Mono<List<DocumentSummary>> listDocuments() {
        return Mono.fromCallable(documentStore::listDocuments)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> deleteDocument(String documentId) {
        return Mono.fromCallable(() -> documentStore.deleteDocument(documentId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private List<IngestionProgress> storeGroup(String documentId,
                                               List<String> group,
                                               List<float[]> vectors,
                                               AtomicInteger completed,
                                               AtomicInteger embedded,
                                               int total) {
        List<IngestionProgress> events = new ArrayList<>(group.size());
        for (int i = 0; i < group.size(); i++) {
            float[] vector = i < vectors.size() ? vectors.get(i) : null;
            documentStore.saveChunk(documentId, group.get(i), vector);
            if (vector != null && vector.length > 0) {
                embedded.incrementAndGet();
            }
            events.add(IngestionProgress.embedding(completed.incrementAndGet(), total));
        }
        return events;
    }

    private List<List<String>> partition(List<String> chunks) {
        List<List<String>> groups = new ArrayList<>();
        for (int start = 0; start < chunks.size(); start += embeddingBatchSize) {
            groups.add(chunks.subList(start, Math.min(chunks.size(), start + embeddingBatchSize)));
        }
        return groups;
    }
}
