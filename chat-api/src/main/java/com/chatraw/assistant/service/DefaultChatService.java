package com.chatraw.assistant.service;

import com.chatraw.assistant.model.ChatMessageRole;
import com.chatraw.assistant.model.ChatResult;
import com.chatraw.assistant.model.ChatSubmission;
import com.chatraw.assistant.model.ChatTurn;
import com.chatraw.assistant.model.StreamEvent;
import com.chatraw.assistant.service.memory.ConversationStore;
import com.chatraw.assistant.service.orchestration.RelayRequest;
import com.chatraw.assistant.service.orchestration.StreamRelay;
import com.chatraw.assistant.service.orchestration.openai.ProviderException;
import com.chatraw.assistant.service.retrieval.RagService;
import com.chatraw.assistant.service.retrieval.RetrievalSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

@Service
public class DefaultChatService implements ChatService {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatService.class);

    private final ConversationStore conversationStore;
    private final RagService ragService;
    private final StreamRelay streamRelay;
    private final RetrievalSettings retrievalSettings;
    private final boolean thinkingByDefault;

    public DefaultChatService(ConversationStore conversationStore,
                              RagService ragService,
                              StreamRelay streamRelay,
                              RetrievalSettings retrievalSettings,
                              @Value("${chat.settings.thinking:false}") boolean thinkingByDefault) {
        this.conversationStore = conversationStore;
        this.ragService = ragService;
        this.streamRelay = streamRelay;
        this.retrievalSettings = retrievalSettings;
        this.thinkingByDefault = thinkingByDefault;
    }

    @Override
    public Flux<StreamEvent> streamChat(ChatSubmission submission) {
        return prepare(submission)
                .flatMapMany(prepared -> Flux.concat(
                        Flux.just(StreamEvent.chatId(prepared.chatId())),
                        relayRequest(submission, prepared).flatMapMany(streamRelay::stream)))
                .onErrorResume(throwable -> {
                    log.error("Chat stream failed before the provider answered", throwable);
                    return Flux.just(StreamEvent.error(ProviderException.from(throwable).getMessage()));
                });
    }

    @Override
    public Mono<ChatResult> completeChat(ChatSubmission submission) {
        return prepare(submission)
                .flatMap(prepared -> relayRequest(submission, prepared)
                        .flatMap(streamRelay::complete)
                        .map(result -> new ChatResult(prepared.chatId(), result.content(), result.thinking(), result.references())));
    }

    // history is read before the user message is stored so the prompt carries it once
    private Mono<PreparedChat> prepare(ChatSubmission submission) {
        return Mono.fromCallable(() -> {
                    String chatId = conversationStore.ensureChat(submission.chatId());
                    List<ChatTurn> history = conversationStore.history(chatId);
                    conversationStore.appendMessage(chatId, ChatMessageRole.USER, submission.message());
                    return new PreparedChat(chatId, history);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<RelayRequest> relayRequest(ChatSubmission submission, PreparedChat prepared) {
        Mono<RagService.RetrievedContext> context = submission.ragRequested()
                ? ragService.retrieve(submission.message(), retrievalSettings)
                : Mono.just(RagService.RetrievedContext.empty());
        boolean thinking = submission.thinking() == null ? thinkingByDefault : submission.thinking();
        return context.map(retrieved -> {
            List<ChatTurn> messages = new ArrayList<>(prepared.history());
            messages.add(new ChatTurn(ChatMessageRole.USER, finalMessage(submission, retrieved), submission.imageBase64()));
            return new RelayRequest(prepared.chatId(), submission.message(), messages, thinking, retrieved.references());
        });
    }

    static String finalMessage(ChatSubmission submission, RagService.RetrievedContext retrieved) {
        String message = submission.message();
        if (!retrieved.isEmpty()) {
            message = retrieved.promptBlock() + "User question: " + message;
        }
        if (submission.hasWebContent()) {
            String source = submission.webUrl() == null ? "" : submission.webUrl();
            message = "The user provided this web page content as a reference (source: " + source + "):\n---\n"
                    + submission.webContent() + "\n---\n\n" + message;
        }
        return message;
    }

    private record PreparedChat(String chatId, List<ChatTurn> history) {
    }
}
