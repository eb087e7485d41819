package com.agenttracker.discovery.dto;

import org.springframework.data.domain.Sort;

import java.util.Locale;

public enum DiscoverySort {
    RELEVANCE,
    DATE,
    FEEDBACK;

    public Sort toSort() {
        return switch (this) {
            case RELEVANCE -> Sort.by(Sort.Order.desc("relevanceScore"), Sort.Order.desc("discoveredAt"));
            case DATE -> Sort.by(Sort.Order.desc("discoveredAt"));
            case FEEDBACK -> Sort.by(Sort.Order.desc("feedbackRank"), Sort.Order.desc("relevanceScore"));
        };
    }

    public static DiscoverySort fromParam(String value) {
        if (value == null || value.isBlank()) {
            return RELEVANCE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown discovery sort: " + value, e);
        }
    }
}
