package com.chatraw.assistant.service.orchestration.openai;

import io.netty.channel.ConnectTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

public class ProviderException extends RuntimeException {

    public enum Kind {
        UNCONFIGURED,
        HTTP_ERROR,
        TIMEOUT,
        TRANSPORT,
        INVALID_RESPONSE
    }

    private final Kind kind;
    private final HttpStatus status;
    private final Integer upstreamStatus;

    public ProviderException(Kind kind, HttpStatus status, String message) {
        this(kind, status, null, message, null);
    }

    public ProviderException(Kind kind, HttpStatus status, Integer upstreamStatus, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.upstreamStatus = upstreamStatus;
    }

    public static ProviderException unconfigured(String providerName) {
        return new ProviderException(Kind.UNCONFIGURED, HttpStatus.INTERNAL_SERVER_ERROR, providerName + " model not configured");
    }

    public static ProviderException invalidResponse(String message) {
        return new ProviderException(Kind.INVALID_RESPONSE, HttpStatus.BAD_GATEWAY, message);
    }

    public static ProviderException from(Throwable throwable) {
        if (throwable instanceof ProviderException providerException) {
            return providerException;
        }
        if (throwable instanceof WebClientResponseException responseException) {
            int code = responseException.getStatusCode().value();
            String body = responseException.getResponseBodyAsString();
            return new ProviderException(Kind.HTTP_ERROR, HttpStatus.BAD_GATEWAY, code,
                    "API error (" + code + "): " + body, responseException);
        }
        if (isTimeout(throwable)) {
            return new ProviderException(Kind.TIMEOUT, HttpStatus.GATEWAY_TIMEOUT, null, "Request timeout", throwable);
        }
        if (throwable instanceof WebClientRequestException requestException) {
            return new ProviderException(Kind.TRANSPORT, HttpStatus.BAD_GATEWAY, null,
                    "Transport error: " + messageOf(requestException), requestException);
        }
        return new ProviderException(Kind.TRANSPORT, HttpStatus.BAD_GATEWAY, null, messageOf(throwable), throwable);
    }

    private static boolean isTimeout(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException
                    || current instanceof ConnectTimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                return false;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String messageOf(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root && root.getMessage() == null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    public Kind kind() {
        return kind;
    }

    public HttpStatus status() {
        return status;
    }

    public Integer upstreamStatus() {
        return upstreamStatus;
    }
}
