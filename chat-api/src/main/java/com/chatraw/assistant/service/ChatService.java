package com.chatraw.assistant.service;

import com.chatraw.assistant.model.ChatResult;
import com.chatraw.assistant.model.ChatSubmission;
import com.chatraw.assistant.model.StreamEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ChatService {

    Flux<StreamEvent> streamChat(ChatSubmission submission);

    Mono<ChatResult> completeChat(ChatSubmission submission);
}
