package com.chatraw.assistant.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "documents")
public class DocumentEntity {

    @Id
    @Column(name = "document_id", nullable = false, updatable = false, length = 64)
    private String documentId;

    @Column(name = "filename", nullable = false, length = 512)
    private String filename;

    @Lob
    @Column(name = "content")
    private String content;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected DocumentEntity() {
    }

    public DocumentEntity(String documentId, String filename, String content) {
        this.documentId = documentId;
        this.filename = filename;
        this.content = content;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getFilename() {
        return filename;
    }

    public String getContent() {
        return content;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
