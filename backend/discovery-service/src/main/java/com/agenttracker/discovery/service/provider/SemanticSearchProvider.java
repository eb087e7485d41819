package com.agenttracker.discovery.service.provider;

import com.agenttracker.discovery.client.PerplexityClient;
import com.agenttracker.discovery.client.PerplexityClient.OnlineSearchResponse;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Online semantic search (Perplexity). Works from the query alone; the project
 * domain is added to the prompt when known.
 */
@Component
@Order(2)
@Slf4j
public class SemanticSearchProvider implements SearchProvider {

    private static final String SYSTEM_PROMPT = """
            You search the web and report distinct, citable resources.
            Respond only with a JSON array: [{"title": "...", "description": "...", \
            "source": "https://...", "publicationDate": "YYYY-MM-DD or null"}]
            """;

    private final PerplexityClient client;
    private final ResultListParser parser;

    public SemanticSearchProvider(PerplexityClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.parser = new ResultListParser(objectMapper);
    }

    @Override
    public String getName() {
        return "semantic-search";
    }

    @Override
    public ProviderCapability getCapability() {
        return ProviderCapability.CONTEXT_FREE;
    }

    @Override
    public boolean isAvailable() {
        return client.isEnabled();
    }

    @Override
    public Mono<List<CandidateItem>> search(String query, @Nullable ProjectContext context) {
        String prompt = context != null && context.domain() != null
                ? "Find resources about \"" + query + "\" for a project in " + context.domain() + "."
                : "Find resources about \"" + query + "\".";
        return client.search(SYSTEM_PROMPT, prompt)
                .map(response -> toCandidates(response, query));
    }

    /**
     * Structured answer first; bare citations when the answer is not a result list.
     */
    List<CandidateItem> toCandidates(OnlineSearchResponse response, String query) {
        try {
            List<CandidateItem> parsed = parser.parse(response.content(), query, getName());
            if (!parsed.isEmpty()) {
                return parsed;
            }
        } catch (MalformedProviderOutputException e) {
            log.debug("Semantic search answer is not a result list, using citations: {}", e.getMessage());
        }

        if (response.citations().isEmpty()) {
            throw new MalformedProviderOutputException("Semantic search returned neither results nor citations");
        }
        Set<String> unique = new LinkedHashSet<>(response.citations());
        List<CandidateItem> items = new ArrayList<>();
        for (String url : unique) {
            items.add(CandidateItem.builder()
                    .title(titleFromUrl(url))
                    .description(summary(response.content()))
                    .source(url)
                    .searchQuery(query)
                    .origin(getName())
                    .build());
        }
        return items;
    }

    private static String titleFromUrl(String url) {
        String trimmed = url.replaceFirst("^https?://(www\\.)?", "").replaceAll("/+$", "");
        return trimmed.isEmpty() ? ResultListParser.UNTITLED : trimmed;
    }

    private static String summary(String content) {
        if (content == null || content.isBlank()) {
            return ResultListParser.NO_DESCRIPTION;
        }
        String single = content.replaceAll("\\s+", " ").trim();
        return single.length() > 300 ? single.substring(0, 300) + "..." : single;
    }
}
