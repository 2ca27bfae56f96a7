package com.chatraw.assistant.service.orchestration;

import com.chatraw.assistant.config.ProviderProperties;
import com.chatraw.assistant.model.ChatMessageRole;
import com.chatraw.assistant.model.ChatTurn;
import com.chatraw.assistant.model.StreamEvent;
import com.chatraw.assistant.service.memory.ConversationStore;
import com.chatraw.assistant.service.orchestration.openai.CompletionFrameParser;
import com.chatraw.assistant.service.orchestration.openai.OpenAiChatClient;
import com.chatraw.assistant.service.orchestration.openai.ProviderException;
import com.chatraw.assistant.service.retrieval.Candidate;
import com.chatraw.assistant.support.StubExchangeFunction;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class StreamRelayTest {

    private static final String CHAT_ID = "chat-1";

    private final StubExchangeFunction exchange = new StubExchangeFunction();
    private final ConversationStore conversationStore = mock(ConversationStore.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private StreamRelay relay;

    @BeforeEach
    void setUp() {
        ProviderProperties properties = new ProviderProperties();
        properties.getChat().setBaseUrl("http://llm.local/v1");
        properties.getChat().setModel("chat-large");
        OpenAiChatClient chatClient = new OpenAiChatClient(exchange.webClient(), properties, 0.7, 0.9);
        relay = new StreamRelay(chatClient, new CompletionFrameParser(new ObjectMapper()), conversationStore, meterRegistry);
        when(conversationStore.countMessages(CHAT_ID)).thenReturn(2L);
    }

    @Test
    void relaysContentThenDoneAndStoresAnswer() {
        exchange.stream(
                "data: {\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}\n\n",
                "data: {\"choices\":[{\"delta\":{\"content\":\" there\"}}]}\n\n",
                "data: [DONE]\n\n");

        StepVerifier.create(relay.stream(request(false, List.of())))
                .expectNext(StreamEvent.content("Hi"), StreamEvent.content(" there"), StreamEvent.done())
                .verifyComplete();

        verify(conversationStore).appendMessage(CHAT_ID, ChatMessageRole.ASSISTANT, "Hi there");
        verify(conversationStore).updateTitle(CHAT_ID, "What is the answer to everythi...");
        assertThat(meterRegistry.counter("chat.relay.outcomes", "outcome", "done").count()).isEqualTo(1.0);
    }

    @Test
    void thinkingIsRelayedAndStoredInWrappedBlock() {
        exchange.stream(
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"step1\"}}]}\n\n",
                "data: {\"choices\":[{\"delta\":{\"content\":\"42\"}}]}\n\n",
                "data: [DONE]\n\n");

        StepVerifier.create(relay.stream(request(true, List.of())))
                .expectNext(StreamEvent.thinking("step1"), StreamEvent.content("42"), StreamEvent.done())
                .verifyComplete();

        verify(conversationStore).appendMessage(CHAT_ID, ChatMessageRole.ASSISTANT, "<think>\nstep1\n</think>\n\n42");
    }

    @Test
    void reasoningIsIgnoredWhenThinkingWasNotRequested() {
        exchange.stream(
                "data: {\"choices\":[{\"delta\":{\"reasoning\":\"hidden\",\"content\":\"ok\"}}]}\n\n",
                "data: [DONE]\n\n");

        StepVerifier.create(relay.stream(request(false, List.of())))
                .expectNext(StreamEvent.content("ok"), StreamEvent.done())
                .verifyComplete();

        verify(conversationStore).appendMessage(CHAT_ID, ChatMessageRole.ASSISTANT, "ok");
    }

    @Test
    void referencesPrecedeDone() {
        List<Candidate> references = List.of(new Candidate("Paris is in France.", 0.88));
        exchange.stream("data: {\"choices\":[{\"delta\":{\"content\":\"Paris\"}}]}\n\n", "data: [DONE]\n\n");

        StepVerifier.create(relay.stream(request(false, references)))
                .expectNext(StreamEvent.content("Paris"), StreamEvent.references(references), StreamEvent.done())
                .verifyComplete();
    }

    @Test
    void malformedFrameBetweenGoodFramesIsSkipped() {
        exchange.stream(
                "data: {\"choices\":[{\"delta\":{\"content\":\"A\"}}]}\n\n",
                "data: {broken\n\n",
                "data: {\"choices\":[{\"delta\":{\"content\":\"B\"}}]}\n\n",
                "data: [DONE]\n\n");

        StepVerifier.create(relay.stream(request(false, List.of())))
                .expectNext(StreamEvent.content("A"), StreamEvent.content("B"), StreamEvent.done())
                .verifyComplete();
    }

    @Test
    void frameSplitInsideMultiByteCharacterIsReassembled() {
        byte[] frame = "data: {\"choices\":[{\"delta\":{\"content\":\"café\"}}]}\n\n".getBytes(StandardCharsets.UTF_8);
        int split = indexOf(frame, (byte) 0xC3) + 1;
        exchange.stream(Flux.just(
                DefaultDataBufferFactory.sharedInstance.wrap(Arrays.copyOfRange(frame, 0, split)),
                DefaultDataBufferFactory.sharedInstance.wrap(Arrays.copyOfRange(frame, split, frame.length)),
                StubExchangeFunction.buffer(": keep-alive\n\ndata: [DONE]\n\n")));

        StepVerifier.create(relay.stream(request(false, List.of())))
                .expectNext(StreamEvent.content("café"), StreamEvent.done())
                .verifyComplete();

        verify(conversationStore).appendMessage(CHAT_ID, ChatMessageRole.ASSISTANT, "café");
    }

    @Test
    void endOfBodyWithoutSentinelCompletes() {
        exchange.stream("data: {\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}");

        StepVerifier.create(relay.stream(request(false, List.of())))
                .expectNext(StreamEvent.content("partial"), StreamEvent.done())
                .verifyComplete();

        verify(conversationStore).appendMessage(CHAT_ID, ChatMessageRole.ASSISTANT, "partial");
    }

    @Test
    void nonSuccessStatusYieldsSingleErrorAndNothingStored() {
        exchange.json(HttpStatus.TOO_MANY_REQUESTS, "slow down");

        StepVerifier.create(relay.stream(request(false, List.of(new Candidate("ref", 0.9)))))
                .expectNext(StreamEvent.error("API error (429): slow down"))
                .verifyComplete();

        verifyNoInteractions(conversationStore);
        assertThat(meterRegistry.counter("chat.relay.outcomes", "outcome", "error").count()).isEqualTo(1.0);
    }

    @Test
    void emptyAnswerIsNotStored() {
        exchange.stream("data: {\"choices\":[{\"delta\":{}}]}\n\n", "data: [DONE]\n\n");

        StepVerifier.create(relay.stream(request(false, List.of())))
                .expectNext(StreamEvent.done())
                .verifyComplete();

        verify(conversationStore, never()).appendMessage(anyString(), any(), anyString());
    }

    @Test
    void transportFailureMidStreamYieldsErrorAfterContent() {
        exchange.stream(Flux.concat(
                Flux.just(StubExchangeFunction.buffer("data: {\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}\n\n")),
                Flux.error(new IllegalStateException("connection reset"))));

        StepVerifier.create(relay.stream(request(false, List.of())))
                .expectNext(StreamEvent.content("Hel"))
                .expectNext(StreamEvent.error("connection reset"))
                .verifyComplete();

        verify(conversationStore, never()).appendMessage(anyString(), any(), anyString());
    }

    @Test
    void cancellationStopsUpstreamAndStoresNothing() {
        AtomicBoolean upstreamCancelled = new AtomicBoolean();
        exchange.stream(Flux.concat(
                        Flux.just(StubExchangeFunction.buffer("data: {\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}\n\n")),
                        Flux.never())
                .doOnCancel(() -> upstreamCancelled.set(true)));

        StepVerifier.create(relay.stream(request(false, List.of())))
                .expectNext(StreamEvent.content("Hi"))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertThat(upstreamCancelled).isTrue();
        verify(conversationStore, never()).appendMessage(anyString(), any(), anyString());
        assertThat(meterRegistry.counter("chat.relay.outcomes", "outcome", "cancelled").count()).isEqualTo(1.0);
    }

    @Test
    void completeReturnsAnswerAndStoresIt() {
        exchange.json(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"content\":\"42\",\"reasoning_content\":\"thought\"}}]}");
        List<Candidate> references = List.of(new Candidate("ref", 0.7));

        RelayResult result = relay.complete(request(true, references)).block();

        assertThat(result).isEqualTo(new RelayResult("42", "thought", references));
        verify(conversationStore).appendMessage(CHAT_ID, ChatMessageRole.ASSISTANT, "<think>\nthought\n</think>\n\n42");
    }

    @Test
    void completeRaisesProviderExceptionOnFailure() {
        exchange.json(HttpStatus.BAD_GATEWAY, "upstream down");

        StepVerifier.create(relay.complete(request(false, List.of())))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ProviderException.class);
                    assertThat(((ProviderException) error).upstreamStatus()).isEqualTo(502);
                })
                .verify();

        verifyNoInteractions(conversationStore);
    }

    @Test
    void titleIsShortMessageUnchanged() {
        assertThat(StreamRelay.titleFrom("Short question")).isEqualTo("Short question");
        assertThat(StreamRelay.titleFrom("x".repeat(31))).isEqualTo("x".repeat(30) + "...");
    }

    private static int indexOf(byte[] bytes, byte value) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == value) {
                return i;
            }
        }
        throw new IllegalArgumentException("byte not found");
    }

    private static RelayRequest request(boolean thinking, List<Candidate> references) {
        String userMessage = "What is the answer to everything?";
        return new RelayRequest(CHAT_ID, userMessage, List.of(new ChatTurn(ChatMessageRole.USER, userMessage)), thinking, references);
    }
}
