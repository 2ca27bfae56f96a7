package com.chatraw.assistant.service.retrieval;

import com.chatraw.assistant.service.ingestion.EmbeddingsClient;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultRagServiceTest {

    private static final RetrievalSettings SETTINGS = new RetrievalSettings(500, 50, 2, 0.5);

    private final EmbeddingsClient embeddingsClient = mock(EmbeddingsClient.class);
    private final SimilarityRanker similarityRanker = mock(SimilarityRanker.class);
    private final RerankFusion rerankFusion = mock(RerankFusion.class);
    private final DefaultRagService ragService = new DefaultRagService(embeddingsClient, similarityRanker, rerankFusion);

    @Test
    void rendersNumberedReferenceBlockWithScoresRoundedToTwoDecimals() {
        float[] queryVector = {0.1f, 0.2f};
        List<Candidate> pool = List.of(new Candidate("Paris is in France.", 0.876452), new Candidate("Rome is in Italy.", 0.5));
        when(embeddingsClient.embedOne("Where is Paris?")).thenReturn(Mono.just(queryVector));
        when(similarityRanker.search(queryVector, 0.5, 10)).thenReturn(Mono.just(pool));
        when(rerankFusion.fuse("Where is Paris?", pool, 2)).thenReturn(Mono.just(pool));

        StepVerifier.create(ragService.retrieve("Where is Paris?", SETTINGS))
                .assertNext(context -> {
                    assertThat(context.references()).containsExactly(
                            new Candidate("Paris is in France.", 0.88), new Candidate("Rome is in Italy.", 0.5));
                    assertThat(context.promptBlock()).isEqualTo("Here are relevant references:\n\n"
                            + "[Reference 1] (Relevance: 0.88)\nParis is in France.\n\n"
                            + "[Reference 2] (Relevance: 0.50)\nRome is in Italy.\n\n"
                            + "Please answer based on the above references. If there's no relevant information, "
                            + "answer based on your knowledge.\n\n");
                })
                .verifyComplete();
    }

    @Test
    void missingQueryEmbeddingSkipsRanking() {
        when(embeddingsClient.embedOne(anyString())).thenReturn(Mono.just(new float[0]));

        RagService.RetrievedContext context = ragService.retrieve("anything", SETTINGS).block();

        assertThat(context).isNotNull();
        assertThat(context.isEmpty()).isTrue();
        assertThat(context.promptBlock()).isEmpty();
        verify(similarityRanker, never()).search(any(), anyDouble(), anyInt());
    }

    @Test
    void noQualifyingChunksSkipsRerank() {
        float[] queryVector = {1f};
        when(embeddingsClient.embedOne("q")).thenReturn(Mono.just(queryVector));
        when(similarityRanker.search(eq(queryVector), anyDouble(), anyInt())).thenReturn(Mono.just(List.of()));

        RagService.RetrievedContext context = ragService.retrieve("q", SETTINGS).block();

        assertThat(context.isEmpty()).isTrue();
        verify(rerankFusion, never()).fuse(anyString(), anyList(), anyInt());
    }
}
