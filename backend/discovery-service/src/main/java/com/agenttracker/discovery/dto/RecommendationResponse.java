package com.agenttracker.discovery.dto;

import java.util.List;

/**
 * Digest of the discoveries not yet presented to the user.
 *
 * @param summary   null when there was nothing to present
 * @param generator how the summary text was produced
 */
public record RecommendationResponse(
        String message,
        String summary,
        SummaryGenerator generator,
        List<DiscoveryDto> discoveries
) {

    public enum SummaryGenerator {
        /** Written by the configured LLM */
        LLM,
        /** Plain listing, used when the LLM is unavailable */
        DIGEST
    }

    public static RecommendationResponse empty() {
        return new RecommendationResponse("No recent discoveries found for this project", null, null, List.of());
    }
}
