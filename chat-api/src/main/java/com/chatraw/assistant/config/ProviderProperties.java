package com.chatraw.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.http.HttpHeaders;

/**
 * OpenAI-compatible endpoints used by the assistant. Each endpoint is considered configured once it has
 * both a base URL and a model id; calls against an unconfigured endpoint fail fast without touching the network.
 */
@ConfigurationProperties(prefix = "chat.providers")
public class ProviderProperties {

    private final Endpoint chat = new Endpoint(300);
    private final Endpoint embedding = new Endpoint(60);
    private final Endpoint rerank = new Endpoint(30);

    public Endpoint getChat() {
        return chat;
    }

    public Endpoint getEmbedding() {
        return embedding;
    }

    public Endpoint getRerank() {
        return rerank;
    }

    public static class Endpoint {

        // up to and including the version segment, e.g. http://localhost:1234/v1
        private String baseUrl;

        private String apiKey;

        private String model;

        private int maxOutput = 4096;

        private long timeoutSeconds;

        // chat only; images are dropped from the prompt when false
        private boolean vision;

        public Endpoint() {
            this(60);
        }

        Endpoint(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank() && model != null && !model.isBlank();
        }

        public String resolve(String path) {
            String base = baseUrl == null ? "" : baseUrl.trim();
            while (base.endsWith("/")) {
                base = base.substring(0, base.length() - 1);
            }
            return base + path;
        }

        public void applyAuthorization(HttpHeaders headers) {
            if (apiKey != null && !apiKey.isBlank()) {
                headers.setBearerAuth(apiKey);
            }
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxOutput() {
            return maxOutput;
        }

        public void setMaxOutput(int maxOutput) {
            this.maxOutput = maxOutput;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean isVision() {
            return vision;
        }

        public void setVision(boolean vision) {
            this.vision = vision;
        }
    }
}
