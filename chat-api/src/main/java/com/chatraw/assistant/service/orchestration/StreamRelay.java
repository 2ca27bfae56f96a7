package com.chatraw.assistant.service.orchestration;

import com.chatraw.assistant.model.ChatMessageRole;
import com.chatraw.assistant.model.StreamEvent;
import com.chatraw.assistant.service.memory.ConversationStore;
import com.chatraw.assistant.service.orchestration.openai.CompletionFrame;
import com.chatraw.assistant.service.orchestration.openai.CompletionFrameParser;
import com.chatraw.assistant.service.orchestration.openai.OpenAiChatClient;
import com.chatraw.assistant.service.orchestration.openai.ProviderException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Relays a chat completion from the provider to the caller as {@link StreamEvent}s and stores the assistant
 * reply once the provider has finished.
 *
 * <p>A stream ends with the references event (when there are any) followed by {@code done}, or with a single
 * {@code error} event. Nothing is stored on failure, on cancellation, or when the provider produced no answer
 * text.
 */
@Component
public class StreamRelay {

    private static final Logger log = LoggerFactory.getLogger(StreamRelay.class);
    private static final String OUTCOME_METRIC = "chat.relay.outcomes";
    private static final String TTFT_METRIC = "chat.relay.ttft";
    private static final int TITLE_LENGTH = 30;

    private final OpenAiChatClient chatClient;
    private final CompletionFrameParser frameParser;
    private final ConversationStore conversationStore;
    private final MeterRegistry meterRegistry;

    public StreamRelay(OpenAiChatClient chatClient,
                       CompletionFrameParser frameParser,
                       ConversationStore conversationStore,
                       MeterRegistry meterRegistry) {
        this.chatClient = chatClient;
        this.frameParser = frameParser;
        this.conversationStore = conversationStore;
        this.meterRegistry = meterRegistry;
    }

    public Flux<StreamEvent> stream(RelayRequest request) {
        return Flux.defer(() -> {
            RelaySession session = new RelaySession(request.thinking());
            Timer.Sample ttft = Timer.start(meterRegistry);
            AtomicBoolean firstToken = new AtomicBoolean();

            Flux<StreamEvent> deltas = chatClient.streamData(request.messages(), request.thinking())
                    .map(frameParser::parse)
                    .takeUntil(CompletionFrame::isDone)
                    .concatMapIterable(session::accept)
                    .doOnNext(event -> {
                        if (firstToken.compareAndSet(false, true)) {
                            ttft.stop(meterRegistry.timer(TTFT_METRIC));
                        }
                    });

            return deltas
                    .concatWith(Flux.defer(() -> finish(request, session)))
                    .onErrorResume(throwable -> fail(request, session, throwable))
                    .doOnCancel(() -> {
                        if (session.transition(RelayState.FAILED)) {
                            log.info("Relay for chat {} cancelled by the caller; reply not stored", request.chatId());
                            outcome("cancelled");
                        }
                    });
        });
    }

    /**
     * Non-streaming variant. Provider failures surface as {@link ProviderException}.
     */
    public Mono<RelayResult> complete(RelayRequest request) {
        return chatClient.complete(request.messages(), request.thinking())
                .flatMap(message -> {
                    String content = message.content() == null ? "" : message.content();
                    String thinking = request.thinking() && message.reasoning() != null ? message.reasoning() : "";
                    RelayResult result = new RelayResult(content, thinking, request.references());
                    if (content.isEmpty()) {
                        log.warn("Provider returned an empty answer for chat {}; nothing stored", request.chatId());
                        return Mono.just(result);
                    }
                    return Mono.fromRunnable(() -> storeReply(request, RelaySession.wrap(content, thinking)))
                            .subscribeOn(Schedulers.boundedElastic())
                            .thenReturn(result);
                })
                .onErrorMap(ProviderException::from)
                .doOnSuccess(result -> outcome("done"))
                .doOnError(throwable -> {
                    log.warn("Completion for chat {} failed: {}", request.chatId(), throwable.getMessage());
                    outcome("error");
                });
    }

    private Flux<StreamEvent> finish(RelayRequest request, RelaySession session) {
        if (!session.transition(RelayState.COMPLETING)) {
            return Flux.empty();
        }
        Mono<Void> store;
        if (session.hasAnswer()) {
            store = Mono.fromRunnable(() -> storeReply(request, session.persistedMessage()))
                    .subscribeOn(Schedulers.boundedElastic())
                    .then();
        } else {
            log.warn("Stream for chat {} ended without answer text; nothing stored", request.chatId());
            store = Mono.empty();
        }
        Flux<StreamEvent> tail = request.references().isEmpty()
                ? Flux.just(StreamEvent.done())
                : Flux.just(StreamEvent.references(request.references()), StreamEvent.done());
        return store.thenMany(tail)
                .doOnComplete(() -> outcome("done"));
    }

    private Flux<StreamEvent> fail(RelayRequest request, RelaySession session, Throwable throwable) {
        RelayState previous = session.state();
        session.transition(RelayState.FAILED);
        ProviderException failure = ProviderException.from(throwable);
        if (previous == RelayState.COMPLETING) {
            log.error("Storing the reply for chat {} failed", request.chatId(), throwable);
        } else {
            log.warn("Relay for chat {} failed in state {}: {}", request.chatId(), previous, failure.getMessage());
        }
        outcome("error");
        return Flux.just(StreamEvent.error(failure.getMessage()));
    }

    private void storeReply(RelayRequest request, String message) {
        conversationStore.appendMessage(request.chatId(), ChatMessageRole.ASSISTANT, message);
        if (conversationStore.countMessages(request.chatId()) <= 2) {
            conversationStore.updateTitle(request.chatId(), titleFrom(request.userMessage()));
        }
    }

    static String titleFrom(String userMessage) {
        if (userMessage == null) {
            return "";
        }
        return userMessage.length() > TITLE_LENGTH ? userMessage.substring(0, TITLE_LENGTH) + "..." : userMessage;
    }

    private void outcome(String outcome) {
        meterRegistry.counter(OUTCOME_METRIC, "outcome", outcome).increment();
    }
}
