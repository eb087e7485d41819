package com.agenttracker.discovery.dto;

import com.agenttracker.discovery.entity.discovery.ContentType;
import com.agenttracker.discovery.entity.discovery.Discovery;
import com.agenttracker.discovery.entity.discovery.UserFeedback;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * DTO for Discovery API responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryDto {

    private Long id;
    private Long projectId;
    private String source;
    private String title;
    private String description;
    private Integer relevanceScore;
    private List<String> categories;
    private ContentType contentType;
    private LocalDateTime discoveredAt;
    private LocalDateTime publicationDate;
    private boolean viewed;
    private LocalDateTime viewedAt;
    private boolean hidden;
    private boolean presented;
    private Boolean feedbackUseful;
    private String feedbackNotes;
    private Integer feedbackRelevance;
    private String searchQueryUsed;
    private String origin;
    private Map<String, Object> searchContext;

    /**
     * Convert entity to DTO.
     */
    public static DiscoveryDto fromEntity(Discovery entity) {
        UserFeedback feedback = entity.getUserFeedback();
        return DiscoveryDto.builder()
                .id(entity.getId())
                .projectId(entity.getProjectId())
                .source(entity.getSource())
                .title(entity.getTitle())
                .description(entity.getDescription())
                .relevanceScore(entity.getRelevanceScore())
                .categories(entity.getCategories())
                .contentType(entity.getContentType())
                .discoveredAt(entity.getDiscoveredAt())
                .publicationDate(entity.getPublicationDate())
                .viewed(entity.isViewed())
                .viewedAt(entity.getViewedAt())
                .hidden(entity.isHidden())
                .presented(entity.isPresented())
                .feedbackUseful(feedback != null ? feedback.getUseful() : null)
                .feedbackNotes(feedback != null ? feedback.getNotes() : null)
                .feedbackRelevance(feedback != null ? feedback.getRelevance() : null)
                .searchQueryUsed(entity.getSearchQueryUsed())
                .origin(entity.getOrigin())
                .searchContext(entity.getSearchContext())
                .build();
    }
}
