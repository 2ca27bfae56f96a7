package com.chatraw.assistant.service.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear cosine-similarity scan over the stored chunks. The store is read page by page and the scan stops as
 * soon as {@code candidateLimit} chunks pass the threshold, so the result is an approximation of the true top-k
 * that depends on store order.
 */
@Component
public class SimilarityRanker {

    private static final Logger log = LoggerFactory.getLogger(SimilarityRanker.class);

    private final ChunkStore chunkStore;
    private final int pageSize;
    private final int candidateLimit;

    public SimilarityRanker(ChunkStore chunkStore,
                            @Value("${chat.rag.scan-page-size:200}") int pageSize,
                            @Value("${chat.rag.scan-candidate-limit:50}") int candidateLimit) {
        this.chunkStore = chunkStore;
        this.pageSize = Math.max(1, pageSize);
        this.candidateLimit = Math.max(1, candidateLimit);
    }

    /**
     * Candidate pool handed to reranking: twice the final result count, never fewer than ten.
     */
    public static int poolSize(int topK) {
        return Math.max(topK * 2, 10);
    }

    public Mono<List<Candidate>> search(float[] queryVector, double threshold, int poolSize) {
        if (queryVector == null || queryVector.length == 0 || poolSize <= 0) {
            return Mono.just(List.of());
        }
        return scan(queryVector, threshold, 0, new ArrayList<>())
                .map(qualifying -> {
                    qualifying.sort(Candidate.BY_SCORE_DESC);
                    List<Candidate> pool = qualifying.size() > poolSize ? qualifying.subList(0, poolSize) : qualifying;
                    return List.copyOf(pool);
                });
    }

    private Mono<List<Candidate>> scan(float[] queryVector, double threshold, int page, List<Candidate> qualifying) {
        return readPage(page).flatMap(chunkPage -> {
            for (ChunkStore.StoredChunk chunk : chunkPage.chunks()) {
                if (!chunk.hasEmbedding()) {
                    continue;
                }
                double score = VectorMath.cosineSimilarity(queryVector, chunk.embedding());
                if (score >= threshold) {
                    qualifying.add(new Candidate(chunk.content(), score));
                    if (qualifying.size() >= candidateLimit) {
                        log.debug("Similarity scan stopped early on page {} with {} candidates", page, qualifying.size());
                        return Mono.just(qualifying);
                    }
                }
            }
            if (chunkPage.last() || chunkPage.chunks().isEmpty()) {
                return Mono.just(qualifying);
            }
            return scan(queryVector, threshold, page + 1, qualifying);
        });
    }

    private Mono<ChunkStore.ChunkPage> readPage(int page) {
        return Mono.fromCallable(() -> chunkStore.findEmbedded(page, pageSize))
                .subscribeOn(Schedulers.boundedElastic())
                .defaultIfEmpty(ChunkStore.ChunkPage.empty());
    }
}
