package com.agenttracker.discovery.service.provider;

import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Content acquisition capability tried by {@link SearchProviderChain}.
 *
 * Implementations signal failure with an error; the chain falls through to the
 * next provider. Results are always candidate items, never provider-specific shapes.
 */
public interface SearchProvider {

    /**
     * Provider name used in logs and attempt records
     */
    String getName();

    ProviderCapability getCapability();

    /**
     * Whether the provider is usable right now (API key configured etc.)
     */
    boolean isAvailable();

    /**
     * Search for candidates. Must tolerate a null context.
     */
    Mono<List<CandidateItem>> search(String query, @Nullable ProjectContext context);
}
