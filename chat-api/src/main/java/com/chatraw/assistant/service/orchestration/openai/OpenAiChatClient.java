package com.chatraw.assistant.service.orchestration.openai;

import com.chatraw.assistant.config.ProviderProperties;
import com.chatraw.assistant.model.ChatTurn;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
public class OpenAiChatClient {

    private final WebClient providerWebClient;
    private final ProviderProperties providerProperties;
    private final double temperature;
    private final double topP;

    public OpenAiChatClient(WebClient providerWebClient,
                            ProviderProperties providerProperties,
                            @Value("${chat.settings.temperature:0.7}") double temperature,
                            @Value("${chat.settings.top-p:0.9}") double topP) {
        this.providerWebClient = providerWebClient;
        this.providerProperties = providerProperties;
        this.temperature = temperature;
        this.topP = topP;
    }

    public Flux<String> streamData(List<ChatTurn> messages, boolean thinking) {
        ProviderProperties.Endpoint endpoint = providerProperties.getChat();
        if (!endpoint.isConfigured()) {
            return Flux.error(ProviderException.unconfigured("Chat"));
        }
        Flux<String> data = providerWebClient.post()
                .uri(endpoint.resolve("/chat/completions"))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM, MediaType.APPLICATION_JSON)
                .headers(endpoint::applyAuthorization)
                .bodyValue(payload(endpoint, messages, true, thinking))
                .retrieve()
                .bodyToFlux(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                })
                .filter(event -> event.data() != null)
                .map(ServerSentEvent::data);
        return withDeadline(data, timeout(endpoint))
                .onErrorMap(ProviderException::from);
    }

    public Mono<CompletionMessage> complete(List<ChatTurn> messages, boolean thinking) {
        ProviderProperties.Endpoint endpoint = providerProperties.getChat();
        if (!endpoint.isConfigured()) {
            return Mono.error(ProviderException.unconfigured("Chat"));
        }
        return providerWebClient.post()
                .uri(endpoint.resolve("/chat/completions"))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(endpoint::applyAuthorization)
                .bodyValue(payload(endpoint, messages, false, thinking))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout(endpoint))
                .map(OpenAiChatClient::toMessage)
                .switchIfEmpty(Mono.error(() -> ProviderException.invalidResponse("Chat completion returned an empty body")))
                .onErrorMap(ProviderException::from);
    }

    private Map<String, Object> payload(ProviderProperties.Endpoint endpoint,
                                        List<ChatTurn> messages,
                                        boolean stream,
                                        boolean thinking) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", endpoint.getModel());
        payload.put("messages", messages.stream()
                .map(turn -> new Message(turn.role().wireName(), content(endpoint, turn)))
                .toList());
        payload.put("temperature", temperature);
        payload.put("top_p", topP);
        payload.put("max_tokens", endpoint.getMaxOutput());
        payload.put("stream", stream);
        if (thinking) {
            payload.put("enable_thinking", Boolean.TRUE);
            if (stream) {
                payload.put("stream_options", Map.of("include_reasoning", Boolean.TRUE));
            }
        }
        return payload;
    }

    private static Object content(ProviderProperties.Endpoint endpoint, ChatTurn turn) {
        if (!endpoint.isVision() || !turn.hasImage()) {
            return turn.content();
        }
        return List.of(ContentPart.text(turn.content()),
                ContentPart.image("data:image/jpeg;base64," + turn.imageBase64()));
    }

    private static CompletionMessage toMessage(JsonNode body) {
        JsonNode message = body.path("choices").path(0).path("message");
        if (!message.isObject()) {
            throw ProviderException.invalidResponse("Chat completion returned no choices");
        }
        JsonNode content = message.get("content");
        String text = content != null && content.isTextual() ? content.asText() : "";
        return new CompletionMessage(text, CompletionFrameParser.firstPresent(message, CompletionFrameParser.REASONING_FIELDS));
    }

    // bounds the whole exchange, not the gap between reads
    static <T> Flux<T> withDeadline(Flux<T> source, Duration deadline) {
        return Flux.defer(() -> {
            AtomicBoolean expired = new AtomicBoolean();
            return source.takeUntilOther(Mono.delay(deadline).doOnNext(tick -> expired.set(true)))
                    .concatWith(Flux.defer(() -> expired.get()
                            ? Flux.error(new TimeoutException("No completion within " + deadline))
                            : Flux.empty()));
        });
    }

    private static Duration timeout(ProviderProperties.Endpoint endpoint) {
        return Duration.ofSeconds(Math.max(1, endpoint.getTimeoutSeconds()));
    }

    public record Message(String role, Object content) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ContentPart(String type, String text, @JsonProperty("image_url") ImageUrl imageUrl) {

        static ContentPart text(String text) {
            return new ContentPart("text", text, null);
        }

        static ContentPart image(String url) {
            return new ContentPart("image_url", null, new ImageUrl(url));
        }
    }

    public record ImageUrl(String url) {
    }

    public record CompletionMessage(String content, String reasoning) {
    }
}
