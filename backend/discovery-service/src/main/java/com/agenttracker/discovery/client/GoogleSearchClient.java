package com.agenttracker.discovery.client;

import com.agenttracker.discovery.dto.pipeline.SearchHit;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Custom Search JSON API client.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GoogleSearchClient {

    private final WebClient webClient;

    @Value("${GOOGLE_SEARCH_API_KEY:}")
    private String apiKey;

    @Value("${GOOGLE_SEARCH_CX:}")
    private String searchEngineId;

    @Value("${GOOGLE_SEARCH_BASE_URL:https://www.googleapis.com/customsearch/v1}")
    private String baseUrl;

    @Value("${discovery.google-search.timeout-seconds:10}")
    private int timeoutSeconds;

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank() && searchEngineId != null && !searchEngineId.isBlank();
    }

    public Mono<List<SearchHit>> search(String query, int num) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("Google search API key or cx is not configured"));
        }
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("key", apiKey)
                .queryParam("cx", searchEngineId)
                .queryParam("q", query)
                .queryParam("num", Math.max(1, Math.min(10, num)))
                .build()
                .toUriString();

        return webClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .map(this::toHits)
                .doOnError(e -> log.warn("Google search failed for query '{}': {}", query, e.getMessage()));
    }

    private List<SearchHit> toHits(JsonNode root) {
        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            hits.add(new SearchHit(
                    item.path("title").asText(null),
                    item.path("snippet").asText(null),
                    item.path("link").asText(null)
            ));
        }
        return hits;
    }
}
