package com.chatraw.assistant.service.ingestion;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs blank-line separated paragraphs into chunks of at most {@code chunkSize} characters. Paragraphs longer
 * than that are cut into fixed slices; consecutive packed chunks share {@code overlap} trailing characters.
 */
@Component
public class ParagraphTextChunker implements TextChunker {

    private static final String PARAGRAPH_BREAK = "\n\n";

    @Override
    public List<String> chunk(String text, int chunkSize, int overlap) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive, was " + chunkSize);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }
        // overlap >= chunkSize would never advance
        int effectiveOverlap = Math.min(Math.max(0, overlap), chunkSize - 1);
        int stride = chunkSize - effectiveOverlap;

        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String raw : text.split(PARAGRAPH_BREAK)) {
            String paragraph = raw.trim();
            if (paragraph.isEmpty()) {
                continue;
            }
            if (paragraph.length() > chunkSize) {
                if (!current.toString().isBlank()) {
                    chunks.add(current.toString().trim());
                }
                current.setLength(0);
                forceSplit(paragraph, chunkSize, stride, chunks);
                continue;
            }
            if (current.length() + paragraph.length() > chunkSize && !current.toString().isBlank()) {
                chunks.add(current.toString().trim());
                String seed = effectiveOverlap > 0 && current.length() > effectiveOverlap
                        ? current.substring(current.length() - effectiveOverlap) + " "
                        : "";
                current.setLength(0);
                current.append(seed);
            }
            current.append(paragraph).append(PARAGRAPH_BREAK);
        }
        if (!current.toString().isBlank()) {
            chunks.add(current.toString().trim());
        }
        if (chunks.isEmpty()) {
            forceSplit(text, chunkSize, stride, chunks);
        }
        return chunks;
    }

    private static void forceSplit(String text, int chunkSize, int stride, List<String> target) {
        for (int start = 0; start < text.length(); start += stride) {
            target.add(text.substring(start, Math.min(text.length(), start + chunkSize)));
        }
    }
}
