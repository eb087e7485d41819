package com.agenttracker.discovery.entity.discovery;

import java.util.Locale;

/**
 * Kind of content a discovery points to.
 * {@link #OTHER} is the value for anything that cannot be resolved.
 */
public enum ContentType {
    ARTICLE,
    DISCUSSION,
    NEWS,
    RESEARCH,
    TOOL,
    OTHER;

    /**
     * Case-insensitive lookup; unknown or blank labels map to {@link #OTHER}.
     */
    public static ContentType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (ContentType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
