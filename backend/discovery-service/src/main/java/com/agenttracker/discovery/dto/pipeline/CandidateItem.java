package com.agenttracker.discovery.dto.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Unscored item produced by the extractor or a search provider. Never persisted as is.
 */
@Value
@Builder(toBuilder = true)
public class CandidateItem {

    String title;

    String description;

    /**
     * Source URI, the identity of the item within a project
     */
    String source;

    LocalDateTime publicationDate;

    String searchQuery;

    String categoryHint;

    Integer popularity;

    /**
     * Provider or newsletter that produced the item
     */
    String origin;

    public boolean isWellFormed() {
        return source != null && !source.isBlank() && title != null && !title.isBlank();
    }
}
