package com.agenttracker.discovery.service.provider;

import com.agenttracker.discovery.config.PipelineProperties;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Search Provider Fallback Chain.
 * Acquires candidates for a query by trying providers one after another
 * until one succeeds.
 *
 * Chain order:
 * 1. Context-aware providers (only with a project context, if enabled)
 * 2. Context-free semantic search (if enabled)
 * 3. Raw web search - last resort, only when explicitly enabled
 *
 * A provider fails when it errors, times out, completes empty or returns
 * nothing usable. The chain itself never errors.
 */
@Service
@Slf4j
public class SearchProviderChain {

    private final List<SearchProvider> providers;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;

    public SearchProviderChain(List<SearchProvider> providers, PipelineProperties properties, MeterRegistry meterRegistry) {
        // stable sort keeps @Order within the same capability
        this.providers = providers.stream()
                .sorted(Comparator.comparing(SearchProvider::getCapability))
                .toList();
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run one query through the chain.
     *
     * @param query   search query
     * @param context project context, null when unavailable
     * @return the first successful provider's items, or a failed result with every attempt recorded
     */
    public Mono<ProviderChainResult> execute(String query, @Nullable ProjectContext context) {
        List<SearchProvider> chain = buildChain(context);
        boolean fallbackEnabled = chain.stream()
                .anyMatch(p -> p.getCapability() == ProviderCapability.LAST_RESORT);

        if (chain.isEmpty()) {
            log.error("No search providers are available for query '{}'", query);
            return Mono.just(ProviderChainResult.failed(query, List.of(), false));
        }

        log.debug("Search chain for '{}' initialized with {} providers: {}",
                query, chain.size(), chain.stream().map(SearchProvider::getName).toList());

        return tryProvidersInSequence(chain, 0, query, context, new ArrayList<>(), fallbackEnabled);
    }

    /**
     * Providers that take part in a run for the given context, in order.
     */
    public List<SearchProvider> buildChain(@Nullable ProjectContext context) {
        List<SearchProvider> chain = new ArrayList<>();
        for (SearchProvider provider : providers) {
            if (!isEnabledByConfiguration(provider.getCapability())) {
                continue;
            }
            if (provider.getCapability() == ProviderCapability.CONTEXT_AWARE && context == null) {
                log.debug("Skipping context-aware provider {} without project context", provider.getName());
                continue;
            }
            if (!provider.isAvailable()) {
                log.debug("Skipping unavailable provider {}", provider.getName());
                continue;
            }
            chain.add(provider);
        }
        return chain;
    }

    private boolean isEnabledByConfiguration(ProviderCapability capability) {
        return switch (capability) {
            case CONTEXT_AWARE -> properties.isContextAwareSearchEnabled();
            case CONTEXT_FREE -> properties.isSemanticSearchEnabled();
            case LAST_RESORT -> properties.isWebSearchFallbackEnabled();
        };
    }

    /**
     * Try providers in sequence until one succeeds
     */
    private Mono<ProviderChainResult> tryProvidersInSequence(List<SearchProvider> chain, int index, String query,
                                                             @Nullable ProjectContext context,
                                                             List<ProviderAttempt> attempts, boolean fallbackEnabled) {
        if (index >= chain.size()) {
            log.warn("All {} search providers failed for query '{}'", chain.size(), query);
            return Mono.just(ProviderChainResult.failed(query, attempts, fallbackEnabled));
        }

        SearchProvider current = chain.get(index);
        log.info("Attempting search provider: {} for '{}' (attempt {}/{})",
                current.getName(), query, index + 1, chain.size());

        return Mono.defer(() -> current.search(query, context))
                .timeout(properties.getProviderTimeout())
                .map(items -> validate(current, items))
                // an empty list counts as an empty answer and falls through below
                .filter(items -> !items.isEmpty())
                .map(items -> {
                    attempts.add(ProviderAttempt.succeeded(current.getName(), items.size()));
                    log.info("Search provider {} returned {} items for '{}'", current.getName(), items.size(), query);
                    return ProviderChainResult.succeeded(query, current.getName(), items, attempts);
                })
                .onErrorResume(e -> {
                    attempts.add(ProviderAttempt.failed(current.getName(), e));
                    countFailure(current);
                    log.warn("Search provider {} failed for '{}': {}. Trying next provider...",
                            current.getName(), query, e.getMessage());
                    return tryProvidersInSequence(chain, index + 1, query, context, attempts, fallbackEnabled);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    attempts.add(ProviderAttempt.empty(current.getName()));
                    countFailure(current);
                    log.warn("Search provider {} returned no results for '{}'. Trying next provider...",
                            current.getName(), query);
                    return tryProvidersInSequence(chain, index + 1, query, context, attempts, fallbackEnabled);
                }));
    }

    /**
     * Drop items that cannot become discoveries. A non-empty answer with no usable item is malformed.
     */
    private List<CandidateItem> validate(SearchProvider provider, List<CandidateItem> items) {
        List<CandidateItem> valid = items.stream()
                .filter(item -> item != null && item.isWellFormed())
                .toList();
        if (valid.isEmpty() && !items.isEmpty()) {
            throw new MalformedProviderOutputException(
                    provider.getName() + " returned " + items.size() + " items without title or source");
        }
        if (valid.size() < items.size()) {
            log.debug("Dropped {} malformed items from {}", items.size() - valid.size(), provider.getName());
        }
        return valid;
    }

    private void countFailure(SearchProvider provider) {
        meterRegistry.counter("discovery.provider.failures", "provider", provider.getName()).increment();
    }
}
