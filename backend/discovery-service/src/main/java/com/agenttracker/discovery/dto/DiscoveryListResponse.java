package com.agenttracker.discovery.dto;

public record DiscoveryListResponse(
        PageResponse<DiscoveryDto> discoveries,
        DiscoveryCounts counts
) {
}
