package com.agenttracker.discovery.dto.pipeline;

import com.agenttracker.discovery.entity.discovery.ContentType;
import com.agenttracker.discovery.service.classify.ParseOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Candidate annotated with relevance. Identity fields always come from the candidate.
 */
@Value
@Builder
public class ClassifiedItem {

    CandidateItem candidate;

    /**
     * 1-10
     */
    int relevanceScore;

    @Builder.Default
    List<String> categories = List.of();

    @Builder.Default
    ContentType contentType = ContentType.OTHER;

    String reasoning;

    @Builder.Default
    ParseOutcome parseOutcome = ParseOutcome.STRICT;

    public String getSource() {
        return candidate.getSource();
    }
}
