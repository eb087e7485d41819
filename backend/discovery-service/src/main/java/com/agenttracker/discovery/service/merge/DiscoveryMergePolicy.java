package com.agenttracker.discovery.service.merge;

import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ClassifiedItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.entity.discovery.Discovery;

import java.time.LocalDateTime;
import java.util.ArrayList;

/**
 * Pure merge rules for one (projectId, source) key.
 *
 * <ul>
 *   <li>no stored discovery: insert</li>
 *   <li>strictly higher score: the incoming classification wins; a hidden
 *       discovery only takes the new score</li>
 *   <li>otherwise nothing changes</li>
 * </ul>
 * Review state (viewed, hidden, feedback) is never touched by a merge.
 */
public final class DiscoveryMergePolicy {

    private DiscoveryMergePolicy() {
    }

    public static MergeDecision decide(Discovery existing, ClassifiedItem incoming) {
        if (existing == null) {
            return MergeDecision.INSERT;
        }
        int storedScore = existing.getRelevanceScore() != null ? existing.getRelevanceScore() : 0;
        return incoming.getRelevanceScore() > storedScore ? MergeDecision.UPDATE : MergeDecision.NOOP;
    }

    /**
     * New discovery for an item that has no stored counterpart.
     */
    public static Discovery newDiscovery(ProjectContext context, ClassifiedItem incoming, LocalDateTime now) {
        CandidateItem candidate = incoming.getCandidate();
        return Discovery.builder()
                .projectId(context.projectId())
                .source(candidate.getSource())
                .title(candidate.getTitle())
                .description(candidate.getDescription())
                .relevanceScore(incoming.getRelevanceScore())
                .categories(new ArrayList<>(incoming.getCategories()))
                .contentType(incoming.getContentType())
                .publicationDate(candidate.getPublicationDate())
                .discoveredAt(now)
                .searchQueryUsed(candidate.getSearchQuery())
                .origin(candidate.getOrigin())
                .searchContext(context.toSearchContext())
                .build();
    }

    /**
     * Copy the winning classification onto the stored discovery: score, categories,
     * content type and publication date. Title and description keep their first-seen text.
     */
    public static void applyUpdate(Discovery existing, ClassifiedItem incoming) {
        existing.setRelevanceScore(incoming.getRelevanceScore());
        if (existing.isHidden()) {
            return;
        }
        CandidateItem candidate = incoming.getCandidate();
        existing.setCategories(new ArrayList<>(incoming.getCategories()));
        existing.setContentType(incoming.getContentType());
        if (candidate.getPublicationDate() != null) {
            existing.setPublicationDate(candidate.getPublicationDate());
        }
    }
}
