package com.chatraw.assistant.service.retrieval;

import java.util.List;

public interface ChunkStore {

    ChunkPage findEmbedded(int page, int pageSize);

    record StoredChunk(String id, String documentId, String content, float[] embedding) {

        public boolean hasEmbedding() {
            return embedding != null && embedding.length > 0;
        }
    }

    record ChunkPage(List<StoredChunk> chunks, boolean last) {

        public static ChunkPage empty() {
            return new ChunkPage(List.of(), true);
        }
    }
}
