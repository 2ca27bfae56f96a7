package com.chatraw.assistant.service.retrieval;

import com.chatraw.assistant.config.ProviderProperties;
import com.chatraw.assistant.service.orchestration.openai.ProviderException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
public class WebClientRerankClient implements RerankClient {

    private final WebClient providerWebClient;
    private final ProviderProperties providerProperties;

    public WebClientRerankClient(WebClient providerWebClient, ProviderProperties providerProperties) {
        this.providerWebClient = providerWebClient;
        this.providerProperties = providerProperties;
    }

    @Override
    public boolean isConfigured() {
        return providerProperties.getRerank().isConfigured();
    }

    @Override
    public Mono<List<RerankScore>> rerank(String query, List<String> documents) {
        ProviderProperties.Endpoint endpoint = providerProperties.getRerank();
        if (!endpoint.isConfigured()) {
            return Mono.error(ProviderException.unconfigured("Rerank"));
        }
        return providerWebClient.post()
                .uri(endpoint.resolve("/rerank"))
                .contentType(MediaType.APPLICATION_JSON)
                .headers(endpoint::applyAuthorization)
                .bodyValue(new RerankRequest(endpoint.getModel(), query, List.copyOf(documents), false))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(Math.max(1, endpoint.getTimeoutSeconds())))
                .map(WebClientRerankClient::parseScores)
                .defaultIfEmpty(List.of())
                .onErrorMap(ProviderException::from);
    }

    static List<RerankScore> parseScores(JsonNode body) {
        JsonNode results = body.has("results") ? body.get("results") : body.path("data");
        if (!results.isArray()) {
            return List.of();
        }
        List<RerankScore> scores = new ArrayList<>();
        for (JsonNode result : results) {
            JsonNode index = result.get("index");
            JsonNode score = result.has("score") ? result.get("score") : result.get("relevance_score");
            if (index == null || !index.isIntegralNumber() || !index.canConvertToInt() || score == null || !score.isNumber()) {
                continue;
            }
            scores.add(new RerankScore(index.asInt(), score.asDouble()));
        }
        return List.copyOf(scores);
    }

    private record RerankRequest(String model,
                                 String query,
                                 List<String> documents,
                                 @JsonProperty("return_documents") boolean returnDocuments) {}
}
