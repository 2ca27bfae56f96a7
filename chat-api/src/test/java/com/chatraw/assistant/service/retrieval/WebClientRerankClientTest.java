package com.chatraw.assistant.service.retrieval;

import com.chatraw.assistant.config.ProviderProperties;
import com.chatraw.assistant.service.orchestration.openai.ProviderException;
import com.chatraw.assistant.support.StubExchangeFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientRerankClientTest {

    private final StubExchangeFunction exchange = new StubExchangeFunction();
    private ProviderProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ProviderProperties();
        properties.getRerank().setBaseUrl("http://rerank.local/v1");
        properties.getRerank().setModel("rerank-base");
    }

    @Test
    void readsResultsArrayWithScore() {
        exchange.json(HttpStatus.OK, "{\"results\":[{\"index\":1,\"score\":0.8},{\"index\":0,\"score\":0.1}]}");

        List<RerankClient.RerankScore> scores = client().rerank("q", List.of("a", "b")).block();

        assertThat(scores).containsExactly(new RerankClient.RerankScore(1, 0.8), new RerankClient.RerankScore(0, 0.1));
        assertThat(exchange.requests().get(0).url().toString()).isEqualTo("http://rerank.local/v1/rerank");
        assertThat(StubExchangeFunction.bodyOf(exchange.requests().get(0)))
                .contains("\"query\":\"q\"")
                .contains("\"documents\":[\"a\",\"b\"]")
                .contains("\"return_documents\":false");
    }

    @Test
    void readsDataArrayWithRelevanceScore() {
        exchange.json(HttpStatus.OK, "{\"data\":[{\"index\":0,\"relevance_score\":0.66},{\"index\":\"x\"}]}");

        List<RerankClient.RerankScore> scores = client().rerank("q", List.of("a")).block();

        assertThat(scores).containsExactly(new RerankClient.RerankScore(0, 0.66));
    }

    @Test
    void fractionalIndexIsDroppedNotTruncated() {
        exchange.json(HttpStatus.OK, "{\"results\":[{\"index\":1.7,\"score\":0.9},{\"index\":0,\"score\":0.4}]}");

        List<RerankClient.RerankScore> scores = client().rerank("q", List.of("a", "b")).block();

        assertThat(scores).containsExactly(new RerankClient.RerankScore(0, 0.4));
    }

    @Test
    void nonSuccessStatusBecomesProviderException() {
        exchange.json(HttpStatus.SERVICE_UNAVAILABLE, "busy");

        StepVerifier.create(client().rerank("q", List.of("a")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ProviderException.class);
                    ProviderException failure = (ProviderException) error;
                    assertThat(failure.kind()).isEqualTo(ProviderException.Kind.HTTP_ERROR);
                    assertThat(failure.upstreamStatus()).isEqualTo(503);
                    assertThat(failure.getMessage()).isEqualTo("API error (503): busy");
                })
                .verify();
    }

    @Test
    void unconfiguredProviderFailsWithoutCall() {
        properties.getRerank().setBaseUrl("");

        assertThat(client().isConfigured()).isFalse();
        StepVerifier.create(client().rerank("q", List.of("a")))
                .expectError(ProviderException.class)
                .verify();
        assertThat(exchange.requests()).isEmpty();
    }

    private WebClientRerankClient client() {
        return new WebClientRerankClient(exchange.webClient(), properties);
    }
}
