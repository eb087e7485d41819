package com.agenttracker.discovery.dto;

import java.util.Locale;

/**
 * Review-state filter for discovery listings. Every filter except HIDDEN excludes hidden discoveries.
 */
public enum DiscoveryFilter {
    ALL,
    NEW,
    VIEWED,
    HIDDEN,
    USEFUL,
    NOT_USEFUL;

    /**
     * Lenient request parameter lookup: "new", "not-useful", "NOT_USEFUL".
     */
    public static DiscoveryFilter fromParam(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown discovery filter: " + value, e);
        }
    }
}
