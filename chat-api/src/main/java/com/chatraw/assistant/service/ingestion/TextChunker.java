package com.chatraw.assistant.service.ingestion;

import java.util.List;

public interface TextChunker {

    List<String> chunk(String text, int chunkSize, int overlap);
}
