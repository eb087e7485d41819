package com.agenttracker.discovery.entity.discovery;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Formula;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Persisted, deduplicated finding for a project.
 * Identity is (projectId, source); the pair is unique.
 * Discoveries are never deleted, hiding is the only way to remove one from view.
 */
@Entity
@Table(name = "discoveries",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_discovery_project_source", columnNames = {"project_id", "source"})
        },
        indexes = {
                @Index(name = "idx_discovery_project_id", columnList = "project_id"),
                @Index(name = "idx_discovery_discovered_at", columnList = "project_id, discovered_at"),
                @Index(name = "idx_discovery_score", columnList = "relevance_score"),
                @Index(name = "idx_discovery_viewed", columnList = "viewed"),
                @Index(name = "idx_discovery_hidden", columnList = "hidden"),
                @Index(name = "idx_discovery_presented", columnList = "project_id, presented")
        })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Discovery {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    /**
     * Source URI, part of the identity key
     */
    @Column(name = "source", nullable = false, length = 2048)
    private String source;

    @Column(name = "title", length = 512)
    private String title;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    /**
     * Relevance score 1-10
     */
    @Column(name = "relevance_score", nullable = false)
    private Integer relevanceScore;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "categories", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> categories = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", length = 32)
    @Builder.Default
    private ContentType contentType = ContentType.OTHER;

    @Column(name = "discovered_at", nullable = false, updatable = false)
    private LocalDateTime discoveredAt;

    @Column(name = "publication_date")
    private LocalDateTime publicationDate;

    // Review state

    @Column(name = "viewed", nullable = false)
    @Builder.Default
    private Boolean viewed = false;

    @Column(name = "viewed_at")
    private LocalDateTime viewedAt;

    @Column(name = "hidden", nullable = false)
    @Builder.Default
    private Boolean hidden = false;

    /**
     * Included in a recommendation digest already
     */
    @Column(name = "presented", nullable = false)
    @Builder.Default
    private Boolean presented = false;

    @Embedded
    private UserFeedback userFeedback;

    /**
     * Sort key for feedback ordering: useful 2, no verdict 1, not useful 0
     */
    @Formula("case when feedback_useful = true then 2 when feedback_useful = false then 0 else 1 end")
    private Integer feedbackRank;

    // Provenance

    @Column(name = "search_query_used", length = 512)
    private String searchQueryUsed;

    /**
     * Provider or newsletter that produced the item
     */
    @Column(name = "origin", length = 128)
    private String origin;

    /**
     * Project phase/progress at discovery time
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "search_context", columnDefinition = "jsonb")
    private Map<String, Object> searchContext;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    // ============ Helper methods ============

    public boolean isViewed() {
        return Boolean.TRUE.equals(viewed);
    }

    public boolean isHidden() {
        return Boolean.TRUE.equals(hidden);
    }

    public boolean isPresented() {
        return Boolean.TRUE.equals(presented);
    }

    public void markPresented() {
        this.presented = true;
    }

    /**
     * Mark as viewed. One-way; the first viewedAt is kept.
     */
    public void markViewed(LocalDateTime now) {
        if (!isViewed()) {
            this.viewed = true;
            this.viewedAt = now;
        }
    }

    public void hide() {
        this.hidden = true;
    }

    public void unhide() {
        this.hidden = false;
    }

    public void toggleHidden() {
        this.hidden = !isHidden();
    }

    /**
     * Apply feedback fields that are present. Giving feedback implies the item was seen.
     */
    public void applyFeedback(Boolean useful, String notes, Integer relevance, LocalDateTime now) {
        if (userFeedback == null) {
            userFeedback = new UserFeedback();
        }
        if (useful != null) {
            userFeedback.setUseful(useful);
        }
        if (notes != null) {
            userFeedback.setNotes(notes);
        }
        if (relevance != null) {
            userFeedback.setRelevance(Math.max(1, Math.min(5, relevance)));
        }
        markViewed(now);
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
