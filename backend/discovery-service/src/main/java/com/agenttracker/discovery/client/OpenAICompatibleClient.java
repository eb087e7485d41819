package com.agenttracker.discovery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completion client for any endpoint speaking the OpenAI wire format.
 * OpenAI itself is used when a key is configured; otherwise a self-hosted
 * endpoint (Ollama, vLLM, a gateway) if its base URL is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAICompatibleClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${LLM_OPENAI_API_KEY:${OPENAI_API_KEY:}}")
    private String openaiApiKey;

    @Value("${LLM_OPENAI_BASE_URL:https://api.openai.com/v1}")
    private String openaiBaseUrl;

    @Value("${LLM_OPENAI_MODEL:gpt-4o-mini}")
    private String openaiModel;

    @Value("${LLM_CUSTOM_BASE_URL:}")
    private String customBaseUrl;

    @Value("${LLM_CUSTOM_API_KEY:}")
    private String customApiKey;

    @Value("${LLM_CUSTOM_MODEL:llama3.2}")
    private String customModel;

    @Value("${discovery.llm.timeout-seconds:60}")
    private int timeoutSeconds;

    private Endpoint endpoint;

    @PostConstruct
    public void init() {
        if (hasText(openaiApiKey)) {
            endpoint = new Endpoint("OpenAI", completionsUrl(openaiBaseUrl), openaiApiKey, openaiModel);
        } else if (hasText(customBaseUrl)) {
            endpoint = new Endpoint("Custom", completionsUrl(customBaseUrl), customApiKey, customModel);
        }
        if (endpoint != null) {
            log.info("LLM endpoint selected: {} ({}, model {})", endpoint.name(), endpoint.url(), endpoint.model());
        } else {
            log.warn("No LLM endpoint configured; classification and query generation use fallbacks");
        }
    }

    public boolean isEnabled() {
        return endpoint != null;
    }

    /**
     * Single non-streaming completion.
     *
     * @param jsonMode ask the model for a JSON object response
     * @return message content of the first choice
     */
    public Mono<String> complete(String systemPrompt, String userPrompt, boolean jsonMode) {
        Endpoint target = endpoint;
        if (target == null) {
            return Mono.error(new IllegalStateException("No OpenAI-compatible provider is configured"));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", target.model());
        body.put("stream", false);
        body.put("temperature", 0.2);
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)));
        if (jsonMode) {
            body.put("response_format", Map.of("type", "json_object"));
        }

        WebClient.RequestBodySpec request = webClient.post()
                .uri(target.url())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON);
        if (hasText(target.apiKey())) {
            request = request.header(HttpHeaders.AUTHORIZATION, "Bearer " + target.apiKey());
        }

        log.debug("Completion request to {} with model {}", target.name(), target.model());
        return request
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .flatMap(this::firstChoiceContent)
                .doOnError(e -> log.warn("{} completion failed: {}", target.name(), e.getMessage()));
    }

    private Mono<String> firstChoiceContent(String response) {
        JsonNode content;
        try {
            content = objectMapper.readTree(response).path("choices").path(0).path("message").path("content");
        } catch (Exception e) {
            return Mono.error(new IllegalStateException("Unreadable completion response: " + e.getMessage(), e));
        }
        if (!content.isTextual()) {
            return Mono.error(new IllegalStateException("Completion response has no message content"));
        }
        return Mono.just(content.asText());
    }

    private static String completionsUrl(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl + "chat/completions" : baseUrl + "/chat/completions";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private record Endpoint(String name, String url, String apiKey, String model) {
    }
}
