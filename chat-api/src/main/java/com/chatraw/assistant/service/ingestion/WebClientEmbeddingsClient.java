package com.chatraw.assistant.service.ingestion;

import com.chatraw.assistant.config.ProviderProperties;
import com.chatraw.assistant.service.orchestration.openai.ProviderException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Component
public class WebClientEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientEmbeddingsClient.class);
    private static final float[] NO_EMBEDDING = new float[0];

    private final WebClient providerWebClient;
    private final ProviderProperties providerProperties;
    private final Counter failedItems;

    public WebClientEmbeddingsClient(WebClient providerWebClient,
                                     ProviderProperties providerProperties,
                                     MeterRegistry meterRegistry) {
        this.providerWebClient = providerWebClient;
        this.providerProperties = providerProperties;
        this.failedItems = meterRegistry.counter("rag.embedding.failures");
    }

    @Override
    public Mono<List<float[]>> embedBatch(List<String> texts, int batchSize) {
        if (texts == null || texts.isEmpty()) {
            return Mono.just(List.of());
        }
        ProviderProperties.Endpoint endpoint = providerProperties.getEmbedding();
        if (!endpoint.isConfigured()) {
            log.warn("No embedding model configured; {} texts left without embeddings", texts.size());
            return Mono.just(emptyVectors(texts.size()));
        }
        int groupSize = Math.max(1, batchSize);
        List<List<String>> groups = new ArrayList<>();
        for (int start = 0; start < texts.size(); start += groupSize) {
            groups.add(texts.subList(start, Math.min(texts.size(), start + groupSize)));
        }
        return Flux.fromIterable(groups)
                .concatMap(group -> embedGroup(endpoint, group))
                .collectList()
                .map(results -> {
                    List<float[]> vectors = new ArrayList<>(texts.size());
                    results.forEach(vectors::addAll);
                    return List.copyOf(vectors);
                });
    }

    private Mono<List<float[]>> embedGroup(ProviderProperties.Endpoint endpoint, List<String> group) {
        return providerWebClient.post()
                .uri(endpoint.resolve("/embeddings"))
                .contentType(MediaType.APPLICATION_JSON)
                .headers(endpoint::applyAuthorization)
                .bodyValue(new EmbeddingRequest(endpoint.getModel(), List.copyOf(group)))
                .retrieve()
                .bodyToMono(EmbeddingResponse.class)
                .timeout(Duration.ofSeconds(Math.max(1, endpoint.getTimeoutSeconds())))
                .map(response -> align(response, group.size()))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Embeddings service returned an empty body for {} texts", group.size());
                    failedItems.increment(group.size());
                    return emptyVectors(group.size());
                }))
                .onErrorResume(throwable -> {
                    ProviderException failure = ProviderException.from(throwable);
                    log.warn("Embeddings call failed for a group of {} texts: {}", group.size(), failure.getMessage());
                    failedItems.increment(group.size());
                    return Mono.just(emptyVectors(group.size()));
                });
    }

    private List<float[]> align(EmbeddingResponse response, int expected) {
        float[][] aligned = new float[expected][];
        Arrays.fill(aligned, NO_EMBEDDING);
        List<EmbeddingData> data = response.data() == null ? List.of() : response.data();
        for (int position = 0; position < data.size(); position++) {
            EmbeddingData item = data.get(position);
            if (item == null || item.embedding() == null) {
                continue;
            }
            int index = item.index() == null ? position : item.index();
            if (index < 0 || index >= expected) {
                log.debug("Dropping embedding with out-of-range index {}", index);
                continue;
            }
            aligned[index] = item.embedding();
        }
        long missing = Arrays.stream(aligned).filter(vector -> vector.length == 0).count();
        if (missing > 0) {
            log.warn("Embeddings service left {} of {} texts without a vector", missing, expected);
            failedItems.increment(missing);
        }
        return Arrays.asList(aligned);
    }

    private static List<float[]> emptyVectors(int count) {
        List<float[]> vectors = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            vectors.add(NO_EMBEDDING);
        }
        return vectors;
    }

    private record EmbeddingRequest(String model, List<String> input) {}

    private record EmbeddingResponse(List<EmbeddingData> data) {}

    private record EmbeddingData(float[] embedding, Integer index) {}
}
