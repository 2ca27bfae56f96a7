package com.chatraw.assistant.service.retrieval;

import com.chatraw.assistant.service.ingestion.EmbeddingsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

@Service
public class DefaultRagService implements RagService {

    private static final Logger log = LoggerFactory.getLogger(DefaultRagService.class);

    private final EmbeddingsClient embeddingsClient;
    private final SimilarityRanker similarityRanker;
    private final RerankFusion rerankFusion;

    public DefaultRagService(EmbeddingsClient embeddingsClient,
                             SimilarityRanker similarityRanker,
                             RerankFusion rerankFusion) {
        this.embeddingsClient = embeddingsClient;
        this.similarityRanker = similarityRanker;
        this.rerankFusion = rerankFusion;
    }

    @Override
    public Mono<RetrievedContext> retrieve(String query, RetrievalSettings settings) {
        if (query == null || query.isBlank()) {
            return Mono.just(RetrievedContext.empty());
        }
        return embeddingsClient.embedOne(query)
                .flatMap(queryVector -> {
                    if (queryVector.length == 0) {
                        log.warn("No query embedding available; answering without retrieval context");
                        return Mono.just(List.<Candidate>of());
                    }
                    return similarityRanker.search(queryVector, settings.scoreThreshold(), SimilarityRanker.poolSize(settings.topK()));
                })
                .flatMap(candidates -> candidates.isEmpty()
                        ? Mono.just(candidates)
                        : rerankFusion.fuse(query, candidates, settings.topK()))
                .map(this::render)
                .defaultIfEmpty(RetrievedContext.empty());
    }

    private RetrievedContext render(List<Candidate> ranked) {
        if (ranked.isEmpty()) {
            return RetrievedContext.empty();
        }
        List<Candidate> references = ranked.stream()
                .map(candidate -> candidate.withScore(Math.round(candidate.score() * 100) / 100.0))
                .toList();
        StringBuilder builder = new StringBuilder("Here are relevant references:\n\n");
        for (int i = 0; i < references.size(); i++) {
            Candidate reference = references.get(i);
            builder.append(String.format(Locale.ROOT, "[Reference %d] (Relevance: %.2f)\n", i + 1, reference.score()))
                    .append(reference.content())
                    .append("\n\n");
        }
        builder.append("Please answer based on the above references. If there's no relevant information, answer based on your knowledge.\n\n");
        return new RetrievedContext(builder.toString(), references);
    }
}
