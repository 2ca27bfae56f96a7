package com.chatraw.assistant.service.memory;

import com.chatraw.assistant.model.ChatMessageRole;
import com.chatraw.assistant.model.ChatTurn;
import com.chatraw.assistant.persistence.entity.ChatEntity;
import com.chatraw.assistant.persistence.entity.MessageEntity;
import com.chatraw.assistant.persistence.repository.ChatRepository;
import com.chatraw.assistant.persistence.repository.MessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@Transactional
public class JpaConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaConversationStore.class);
    private static final String DEFAULT_TITLE = "New Chat";

    private final ChatRepository chatRepository;
    private final MessageRepository messageRepository;

    public JpaConversationStore(ChatRepository chatRepository, MessageRepository messageRepository) {
        this.chatRepository = chatRepository;
        this.messageRepository = messageRepository;
    }

    @Override
    public String ensureChat(String chatId) {
        if (chatId != null && !chatId.isBlank() && chatRepository.existsById(chatId)) {
            return chatId;
        }
        String id = chatId == null || chatId.isBlank() ? UUID.randomUUID().toString() : chatId;
        chatRepository.save(new ChatEntity(id, DEFAULT_TITLE));
        log.debug("Created chat {}", id);
        return id;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatTurn> history(String chatId) {
        return messageRepository.findByChatIdOrderBySequenceAsc(chatId).stream()
                .map(message -> new ChatTurn(message.getRole(), message.getContent()))
                .toList();
    }

    @Override
    public void appendMessage(String chatId, ChatMessageRole role, String content) {
        int sequence = messageRepository.findMaxSequence(chatId) + 1;
        messageRepository.save(new MessageEntity(UUID.randomUUID().toString(), chatId, role, content, sequence));
    }

    @Override
    @Transactional(readOnly = true)
    public long countMessages(String chatId) {
        return messageRepository.countByChatId(chatId);
    }

    @Override
    public void updateTitle(String chatId, String title) {
        chatRepository.findById(chatId).ifPresent(chat -> {
            chat.setTitle(title);
            chatRepository.save(chat);
        });
    }
}
