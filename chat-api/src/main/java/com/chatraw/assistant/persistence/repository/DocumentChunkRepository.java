package com.chatraw.assistant.persistence.repository;

import com.chatraw.assistant.persistence.entity.DocumentChunkEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DocumentChunkRepository extends JpaRepository<DocumentChunkEntity, String> {

    Slice<DocumentChunkEntity> findByEmbeddingIsNotNull(Pageable pageable);

    long countByDocumentId(String documentId);

    @Modifying
    @Query("delete from DocumentChunkEntity c where c.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
