package com.agenttracker.discovery.service.provider;

import com.agenttracker.discovery.dto.pipeline.CandidateItem;

import java.util.List;

/**
 * Outcome of running one query through the provider chain.
 *
 * @param provider                 provider that succeeded, null when all failed
 * @param exhaustedWithoutFallback every provider failed and no last-resort provider was enabled
 */
public record ProviderChainResult(
        String query,
        List<CandidateItem> items,
        List<ProviderAttempt> attempts,
        String provider,
        boolean succeeded,
        boolean exhaustedWithoutFallback
) {

    public static ProviderChainResult succeeded(String query, String provider, List<CandidateItem> items,
                                                List<ProviderAttempt> attempts) {
        return new ProviderChainResult(query, List.copyOf(items), List.copyOf(attempts), provider, true, false);
    }

    public static ProviderChainResult failed(String query, List<ProviderAttempt> attempts, boolean fallbackEnabled) {
        return new ProviderChainResult(query, List.of(), List.copyOf(attempts), null, false, !fallbackEnabled);
    }
}
