package com.agenttracker.discovery.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared WebClient for search providers and the LLM endpoint.
 * The response timeout is an upper bound; each client applies its own shorter
 * per-call timeout.
 */
@Configuration
public class WebClientConfig {

    @Value("${discovery.http.user-agent:AgentTracker-Discovery/1.0}")
    private String userAgent;

    @Value("${discovery.http.timeout.connect:10000}")
    private int connectTimeoutMillis;

    @Value("${discovery.http.timeout.response:90s}")
    private Duration responseTimeout;

    @Value("${discovery.http.max-in-memory-size:10MB}")
    private DataSize maxInMemorySize;

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(responseTimeout)
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize((int) maxInMemorySize.toBytes()))
                .build();
    }
}
