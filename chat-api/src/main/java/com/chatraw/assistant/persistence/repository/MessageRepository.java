package com.chatraw.assistant.persistence.repository;

import com.chatraw.assistant.persistence.entity.MessageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MessageRepository extends JpaRepository<MessageEntity, String> {

    @Query("select coalesce(max(m.sequence), -1) from MessageEntity m where m.chatId = :chatId")
    int findMaxSequence(@Param("chatId") String chatId);

    List<MessageEntity> findByChatIdOrderBySequenceAsc(String chatId);

    long countByChatId(String chatId);
}
