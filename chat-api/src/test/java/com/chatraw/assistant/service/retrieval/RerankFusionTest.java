package com.chatraw.assistant.service.retrieval;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RerankFusionTest {

    private static final List<Candidate> CANDIDATES = List.of(
            new Candidate("alpha", 0.91),
            new Candidate("beta", 0.82),
            new Candidate("gamma", 0.73),
            new Candidate("delta", 0.64));

    private final RerankClient rerankClient = mock(RerankClient.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final RerankFusion fusion = new RerankFusion(rerankClient, meterRegistry);

    @Test
    void withoutRerankProviderKeepsFirstTopK() {
        when(rerankClient.isConfigured()).thenReturn(false);

        StepVerifier.create(fusion.fuse("query", CANDIDATES, 2))
                .assertNext(result -> assertThat(result).containsExactly(CANDIDATES.get(0), CANDIDATES.get(1)))
                .verifyComplete();
        verify(rerankClient, never()).rerank(any(), anyList());
    }

    @Test
    void rerankScoresReplaceCosineScoresAndInvalidIndicesAreDropped() {
        when(rerankClient.isConfigured()).thenReturn(true);
        when(rerankClient.rerank(eq("query"), eq(List.of("alpha", "beta", "gamma", "delta"))))
                .thenReturn(Mono.just(List.of(
                        new RerankClient.RerankScore(2, 0.97),
                        new RerankClient.RerankScore(9, 0.99),
                        new RerankClient.RerankScore(-1, 0.98),
                        new RerankClient.RerankScore(0, 0.15),
                        new RerankClient.RerankScore(3, 0.40))));

        List<Candidate> result = fusion.fuse("query", CANDIDATES, 2).block();

        assertThat(result).containsExactly(new Candidate("gamma", 0.97), new Candidate("delta", 0.40));
        assertThat(meterRegistry.counter("rag.rerank.fallbacks").count()).isZero();
    }

    @Test
    void failingRerankFallsBackToEmbeddingRanking() {
        when(rerankClient.isConfigured()).thenReturn(true);
        when(rerankClient.rerank(any(), anyList())).thenReturn(Mono.error(new IllegalStateException("503")));

        List<Candidate> result = fusion.fuse("query", CANDIDATES, 3).block();

        assertThat(result).containsExactlyElementsOf(CANDIDATES.subList(0, 3));
        assertThat(meterRegistry.counter("rag.rerank.fallbacks").count()).isEqualTo(1.0);
    }

    @Test
    void rerankClientThrowingSynchronouslyAlsoFallsBack() {
        when(rerankClient.isConfigured()).thenReturn(true);
        when(rerankClient.rerank(any(), anyList())).thenThrow(new IllegalStateException("boom"));

        List<Candidate> result = fusion.fuse("query", CANDIDATES, 2).block();

        assertThat(result).containsExactlyElementsOf(CANDIDATES.subList(0, 2));
    }

    @Test
    void emptyRerankResultFallsBack() {
        when(rerankClient.isConfigured()).thenReturn(true);
        when(rerankClient.rerank(any(), anyList())).thenReturn(Mono.just(List.of()));

        List<Candidate> result = fusion.fuse("query", CANDIDATES, 2).block();

        assertThat(result).containsExactlyElementsOf(CANDIDATES.subList(0, 2));
        assertThat(meterRegistry.counter("rag.rerank.fallbacks").count()).isEqualTo(1.0);
    }

    @Test
    void onlyOutOfRangeIndicesFallsBack() {
        when(rerankClient.isConfigured()).thenReturn(true);
        when(rerankClient.rerank(any(), anyList()))
                .thenReturn(Mono.just(List.of(new RerankClient.RerankScore(42, 0.9))));

        List<Candidate> result = fusion.fuse("query", CANDIDATES, 2).block();

        assertThat(result).containsExactlyElementsOf(CANDIDATES.subList(0, 2));
    }

    @Test
    void noCandidatesSkipsRerank() {
        when(rerankClient.isConfigured()).thenReturn(true);

        assertThat(fusion.fuse("query", List.of(), 3).block()).isEmpty();
        verify(rerankClient, never()).rerank(any(), anyList());
    }
}
