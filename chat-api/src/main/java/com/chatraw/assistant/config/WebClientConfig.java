package com.chatraw.assistant.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class WebClientConfig {

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider providerConnectionProvider(@Value("${chat.http.max-connections:64}") int maxConnections,
                                                         @Value("${chat.http.max-idle-seconds:60}") long maxIdleSeconds) {
        return ConnectionProvider.builder("chat-providers")
                .maxConnections(Math.max(1, maxConnections))
                .maxIdleTime(Duration.ofSeconds(Math.max(1, maxIdleSeconds)))
                .build();
    }

    @Bean
    public WebClient providerWebClient(ConnectionProvider providerConnectionProvider,
                                       @Value("${chat.http.connect-timeout-ms:10000}") int connectTimeoutMillis,
                                       @Value("${chat.http.response-timeout-seconds:300}") long responseTimeoutSeconds) {
        HttpClient httpClient = HttpClient.create(providerConnectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(1, connectTimeoutMillis));
        if (responseTimeoutSeconds > 0) {
            httpClient = httpClient.responseTimeout(Duration.ofSeconds(responseTimeoutSeconds));
        }
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(exchangeStrategies())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }
}
