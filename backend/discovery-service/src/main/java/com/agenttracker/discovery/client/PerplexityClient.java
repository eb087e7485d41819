package com.agenttracker.discovery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Perplexity online-search client. Returns the answer text together with
 * the citation URLs the model searched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PerplexityClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${PERPLEXITY_API_KEY:}")
    private String apiKey;

    @Value("${PERPLEXITY_BASE_URL:https://api.perplexity.ai}")
    private String baseUrl;

    @Value("${PERPLEXITY_MODEL:sonar}")
    private String model;

    @Value("${discovery.perplexity.timeout-seconds:30}")
    private int timeoutSeconds;

    /**
     * Check if Perplexity API is enabled (API key is configured)
     */
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Mono<OnlineSearchResponse> search(String systemPrompt, String userPrompt) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("Perplexity API key is not configured"));
        }
        String url = baseUrl.endsWith("/") ? baseUrl + "chat/completions" : baseUrl + "/chat/completions";

        Map<String, Object> body = Map.of(
                "model", model,
                "stream", false,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)
                ),
                "return_citations", true
        );

        log.debug("Calling Perplexity API: {} with timeout {}s", url, timeoutSeconds);

        return webClient.post()
                .uri(url)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .flatMap(this::parseResponse)
                .doOnError(e -> log.warn("Perplexity API error: {}", e.getMessage()));
    }

    private Mono<OnlineSearchResponse> parseResponse(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            String content = "";
            JsonNode choices = root.path("choices");
            if (choices.isArray() && !choices.isEmpty()) {
                content = choices.get(0).path("message").path("content").asText("");
            }
            List<String> citations = new ArrayList<>();
            for (JsonNode citation : root.path("citations")) {
                if (citation.isTextual()) {
                    citations.add(citation.asText());
                } else if (citation.hasNonNull("url")) {
                    citations.add(citation.get("url").asText());
                }
            }
            return Mono.just(new OnlineSearchResponse(content, citations));
        } catch (Exception e) {
            return Mono.error(new IllegalStateException("Unreadable Perplexity response: " + e.getMessage(), e));
        }
    }

    public record OnlineSearchResponse(String content, List<String> citations) {
    }
}
