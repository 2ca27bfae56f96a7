package com.chatraw.assistant.service.ingestion;

import com.chatraw.assistant.model.DocumentSummary;
import com.chatraw.assistant.persistence.entity.DocumentChunkEntity;
import com.chatraw.assistant.persistence.entity.DocumentEntity;
import com.chatraw.assistant.persistence.repository.DocumentChunkRepository;
import com.chatraw.assistant.persistence.repository.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@Transactional
public class JpaDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(JpaDocumentStore.class);

    private final DocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;

    public JpaDocumentStore(DocumentRepository documentRepository, DocumentChunkRepository chunkRepository) {
        this.documentRepository = documentRepository;
        this.chunkRepository = chunkRepository;
    }

    @Override
    public String saveDocument(String filename, String content) {
        String documentId = UUID.randomUUID().toString();
        documentRepository.save(new DocumentEntity(documentId, filename, content));
        return documentId;
    }

    @Override
    public void saveChunk(String documentId, String content, float[] embedding) {
        float[] stored = embedding == null || embedding.length == 0 ? null : embedding;
        chunkRepository.save(new DocumentChunkEntity(UUID.randomUUID().toString(), documentId, content, stored));
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentSummary> listDocuments() {
        return documentRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(document -> new DocumentSummary(
                        document.getDocumentId(),
                        document.getFilename(),
                        chunkRepository.countByDocumentId(document.getDocumentId()),
                        document.getCreatedAt()))
                .toList();
    }

    @Override
    public boolean deleteDocument(String documentId) {
        int chunks = chunkRepository.deleteByDocumentId(documentId);
        if (!documentRepository.existsById(documentId)) {
            return false;
        }
        documentRepository.deleteById(documentId);
        log.info("Deleted document {} with {} chunks", documentId, chunks);
        return true;
    }
}
