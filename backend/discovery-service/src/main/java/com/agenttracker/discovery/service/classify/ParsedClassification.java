package com.agenttracker.discovery.service.classify;

import com.agenttracker.discovery.entity.discovery.ContentType;

import java.util.List;

/**
 * Classification fields read from one classifier answer.
 */
public record ParsedClassification(
        int relevanceScore,
        List<String> categories,
        ContentType contentType,
        String reasoning,
        ParseOutcome outcome
) {

    public static final int DEFAULT_SCORE = 5;

    public static ParsedClassification defaults() {
        return new ParsedClassification(DEFAULT_SCORE, List.of(), ContentType.OTHER, null, ParseOutcome.DEFAULTED);
    }
}
