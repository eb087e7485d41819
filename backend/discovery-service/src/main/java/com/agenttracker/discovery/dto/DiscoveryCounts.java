package com.agenttracker.discovery.dto;

/**
 * Discovery counts of a project by review state. Hidden items count only toward {@code hidden}.
 */
public record DiscoveryCounts(
        long total,
        long newCount,
        long viewed,
        long hidden,
        long useful,
        long notUseful
) {
}
