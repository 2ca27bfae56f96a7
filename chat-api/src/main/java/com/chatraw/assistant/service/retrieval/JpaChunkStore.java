package com.chatraw.assistant.service.retrieval;

import com.chatraw.assistant.persistence.entity.DocumentChunkEntity;
import com.chatraw.assistant.persistence.repository.DocumentChunkRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaChunkStore implements ChunkStore {

    private static final Sort CREATION_ORDER = Sort.by("createdAt").ascending().and(Sort.by("chunkId").ascending());

    private final DocumentChunkRepository chunkRepository;

    public JpaChunkStore(DocumentChunkRepository chunkRepository) {
        this.chunkRepository = chunkRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public ChunkPage findEmbedded(int page, int pageSize) {
        Slice<DocumentChunkEntity> slice = chunkRepository.findByEmbeddingIsNotNull(PageRequest.of(page, pageSize, CREATION_ORDER));
        return new ChunkPage(slice.getContent().stream().map(this::toStoredChunk).toList(), !slice.hasNext());
    }

    private StoredChunk toStoredChunk(DocumentChunkEntity entity) {
        return new StoredChunk(entity.getChunkId(), entity.getDocumentId(), entity.getContent(), entity.getEmbedding());
    }
}
