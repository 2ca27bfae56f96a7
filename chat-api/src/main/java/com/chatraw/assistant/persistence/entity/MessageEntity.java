package com.chatraw.assistant.persistence.entity;

import com.chatraw.assistant.model.ChatMessageRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "messages")
public class MessageEntity {

    @Id
    @Column(name = "message_id", nullable = false, updatable = false, length = 64)
    private String messageId;

    @Column(name = "chat_id", nullable = false, length = 64)
    private String chatId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private ChatMessageRole role;

    @Column(name = "content", length = 1_000_000)
    private String content;

    @Column(name = "sequence_number", nullable = false)
    private int sequence;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected MessageEntity() {
    }

    public MessageEntity(String messageId,
                         String chatId,
                         ChatMessageRole role,
                         String content,
                         int sequence) {
        this.messageId = messageId;
        this.chatId = chatId;
        this.role = role;
        this.content = content;
        this.sequence = sequence;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public String getMessageId() {
        return messageId;
    }

    public String getChatId() {
        return chatId;
    }

    public ChatMessageRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    public int getSequence() {
        return sequence;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
