package com.chatraw.assistant.controller;

import com.chatraw.assistant.model.ChatResult;
import com.chatraw.assistant.model.ChatSubmission;
import com.chatraw.assistant.model.StreamEvent;
import com.chatraw.assistant.service.ChatService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping(path = "/stream", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_NDJSON_VALUE)
    public Flux<StreamEvent> stream(@Valid @RequestBody ChatSubmission submission) {
        return chatService.streamChat(submission);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatResult> chat(@Valid @RequestBody ChatSubmission submission) {
        return chatService.completeChat(submission);
    }
}
