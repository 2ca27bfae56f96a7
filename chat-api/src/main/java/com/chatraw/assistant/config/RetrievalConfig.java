package com.chatraw.assistant.config;

import com.chatraw.assistant.service.retrieval.RetrievalSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetrievalConfig {

    @Bean
    public RetrievalSettings retrievalSettings(@Value("${chat.rag.chunk-size:500}") int chunkSize,
                                               @Value("${chat.rag.chunk-overlap:50}") int chunkOverlap,
                                               @Value("${chat.rag.top-k:3}") int topK,
                                               @Value("${chat.rag.score-threshold:0.5}") double scoreThreshold) {
        return new RetrievalSettings(chunkSize, chunkOverlap, topK, scoreThreshold);
    }
}
