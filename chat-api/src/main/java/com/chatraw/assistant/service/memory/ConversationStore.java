package com.chatraw.assistant.service.memory;

import com.chatraw.assistant.model.ChatMessageRole;
import com.chatraw.assistant.model.ChatTurn;

import java.util.List;

public interface ConversationStore {

    String ensureChat(String chatId);

    List<ChatTurn> history(String chatId);

    void appendMessage(String chatId, ChatMessageRole role, String content);

    long countMessages(String chatId);

    void updateTitle(String chatId, String title);
}
