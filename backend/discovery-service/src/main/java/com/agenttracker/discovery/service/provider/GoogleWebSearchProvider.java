package com.agenttracker.discovery.service.provider;

import com.agenttracker.discovery.client.GoogleSearchClient;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.service.extract.ContentExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Raw web search through Google Custom Search. Last resort only.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class GoogleWebSearchProvider implements SearchProvider {

    private static final int RESULTS_PER_QUERY = 10;

    private final GoogleSearchClient client;
    private final ContentExtractor contentExtractor;

    @Override
    public String getName() {
        return "google-web-search";
    }

    @Override
    public ProviderCapability getCapability() {
        return ProviderCapability.LAST_RESORT;
    }

    @Override
    public boolean isAvailable() {
        return client.isEnabled();
    }

    @Override
    public Mono<List<CandidateItem>> search(String query, @Nullable ProjectContext context) {
        return client.search(query, RESULTS_PER_QUERY)
                .map(hits -> contentExtractor.fromSearchHits(hits, query, getName()));
    }
}
