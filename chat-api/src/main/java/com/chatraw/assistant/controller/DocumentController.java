package com.chatraw.assistant.controller;

import com.chatraw.assistant.model.DocumentSummary;
import com.chatraw.assistant.model.IngestionProgress;
import com.chatraw.assistant.service.ingestion.IngestionException;
import com.chatraw.assistant.service.ingestion.IngestionService;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final IngestionService ingestionService;

    public DocumentController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_NDJSON_VALUE)
    public Flux<IngestionProgress> upload(@RequestPart("file") FilePart file) {
        return DataBufferUtils.join(file.content())
                .map(DocumentController::drain)
                .filter(bytes -> bytes.length > 0)
                .switchIfEmpty(Mono.error(() -> new IngestionException(HttpStatus.BAD_REQUEST, "File payload is required")))
                .flatMapMany(bytes -> ingestionService.ingest(file.filename(), decode(bytes)));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<DocumentSummary>> list() {
        return ingestionService.listDocuments();
    }

    @DeleteMapping(path = "/{documentId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> delete(@PathVariable String documentId) {
        return ingestionService.deleteDocument(documentId)
                .map(deleted -> Map.<String, Object>of("success", Boolean.TRUE, "deleted", deleted));
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
