package com.chatraw.assistant.service.retrieval;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Second retrieval stage. With a rerank provider the candidates are rescored by it and the cosine scores are
 * discarded; without one, or when the call fails or returns nothing usable, the embedding ranking is kept.
 * Both paths return at most {@code topK} candidates sorted by descending score.
 */
@Component
public class RerankFusion {

    private static final Logger log = LoggerFactory.getLogger(RerankFusion.class);

    private final RerankClient rerankClient;
    private final Counter fallbacks;

    public RerankFusion(RerankClient rerankClient, MeterRegistry meterRegistry) {
        this.rerankClient = rerankClient;
        this.fallbacks = meterRegistry.counter("rag.rerank.fallbacks");
    }

    public Mono<List<Candidate>> fuse(String query, List<Candidate> candidates, int topK) {
        List<Candidate> embeddingRanked = truncate(candidates, topK);
        if (candidates == null || candidates.isEmpty() || !rerankClient.isConfigured()) {
            return Mono.just(embeddingRanked);
        }
        List<String> documents = candidates.stream().map(Candidate::content).toList();
        return Mono.defer(() -> rerankClient.rerank(query, documents))
                .map(scores -> rescore(candidates, scores, topK))
                .defaultIfEmpty(List.of())
                .map(reranked -> {
                    if (reranked.isEmpty()) {
                        log.warn("Rerank returned no usable results; keeping embedding ranking");
                        fallbacks.increment();
                        return embeddingRanked;
                    }
                    return reranked;
                })
                .onErrorResume(throwable -> {
                    log.warn("Rerank unavailable, keeping embedding ranking: {}", throwable.getMessage());
                    fallbacks.increment();
                    return Mono.just(embeddingRanked);
                });
    }

    private List<Candidate> rescore(List<Candidate> candidates, List<RerankClient.RerankScore> scores, int topK) {
        List<Candidate> rescored = new ArrayList<>();
        for (RerankClient.RerankScore score : scores) {
            if (score.index() < 0 || score.index() >= candidates.size()) {
                log.debug("Ignoring rerank result with out-of-range index {}", score.index());
                continue;
            }
            rescored.add(candidates.get(score.index()).withScore(score.score()));
        }
        rescored.sort(Candidate.BY_SCORE_DESC);
        return truncate(rescored, topK);
    }

    private static List<Candidate> truncate(List<Candidate> candidates, int topK) {
        if (candidates == null || candidates.isEmpty() || topK <= 0) {
            return List.of();
        }
        return List.copyOf(candidates.size() > topK ? candidates.subList(0, topK) : candidates);
    }
}
