package com.chatraw.assistant.service.ingestion;

import com.chatraw.assistant.model.DocumentSummary;

import java.util.List;

public interface DocumentStore {

    String saveDocument(String filename, String content);

    void saveChunk(String documentId, String content, float[] embedding);

    List<DocumentSummary> listDocuments();

    boolean deleteDocument(String documentId);
}
