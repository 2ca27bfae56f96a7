package com.chatraw.assistant.persistence.repository;

import com.chatraw.assistant.persistence.entity.ChatEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChatRepository extends JpaRepository<ChatEntity, String> {
}
