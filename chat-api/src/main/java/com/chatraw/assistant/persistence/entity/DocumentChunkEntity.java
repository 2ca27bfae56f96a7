package com.chatraw.assistant.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "document_chunks")
public class DocumentChunkEntity {

    @Id
    @Column(name = "chunk_id", nullable = false, updatable = false, length = 64)
    private String chunkId;

    @Column(name = "document_id", nullable = false, length = 64)
    private String documentId;

    @Column(name = "content", length = 1_000_000)
    private String content;

    @Convert(converter = EmbeddingConverter.class)
    @Column(name = "embedding", length = 1_000_000)
    private float[] embedding;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected DocumentChunkEntity() {
    }

    public DocumentChunkEntity(String chunkId, String documentId, String content, float[] embedding) {
        this.chunkId = chunkId;
        this.documentId = documentId;
        this.content = content;
        this.embedding = embedding;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public String getChunkId() {
        return chunkId;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getContent() {
        return content;
    }

    public float[] getEmbedding() {
        return embedding;
    }

    public void setEmbedding(float[] embedding) {
        this.embedding = embedding;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
