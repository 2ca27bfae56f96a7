package com.chatraw.assistant.controller;

import com.chatraw.assistant.service.ingestion.IngestionException;
import com.chatraw.assistant.service.orchestration.openai.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestionException(IngestionException exception) {
        return ResponseEntity.status(exception.status())
                .body(Map.of(
                        "error", exception.getMessage()
                ));
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<Map<String, Object>> handleProviderException(ProviderException exception) {
        log.warn("Provider call failed ({}): {}", exception.kind(), exception.getMessage());
        return ResponseEntity.status(exception.status())
                .body(Map.of(
                        "error", exception.getMessage()
                ));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException exception) {
        FieldError fieldError = exception.getFieldError();
        String message = fieldError != null && fieldError.getDefaultMessage() != null
                ? fieldError.getDefaultMessage()
                : "Invalid request";
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", message
                ));
    }
}
