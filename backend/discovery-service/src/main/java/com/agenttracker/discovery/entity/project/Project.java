package com.agenttracker.discovery.entity.project;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entity representing a tracked project.
 * A project describes a domain of interest with goals and interests;
 * the discovery pipeline reads it and only ever writes {@code lastUpdated}.
 */
@Entity
@Table(name = "projects", indexes = {
        @Index(name = "idx_project_owner_id", columnList = "owner_id"),
        @Index(name = "idx_project_last_updated", columnList = "last_updated")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Project {

    public static final String PROGRESS_NOT_STARTED = "Not Started";
    public static final String PROGRESS_IN_PROGRESS = "In Progress";
    public static final String PROGRESS_COMPLETED = "Completed";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Owner user ID
     */
    @Column(name = "owner_id", length = 64)
    private String ownerId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", length = 2048)
    private String description;

    /**
     * Domain label, e.g. "game development"
     */
    @Column(name = "domain", length = 255)
    private String domain;

    /**
     * Ordered goals
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "goals", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> goals = new ArrayList<>();

    /**
     * Ordered interests
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "interests", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> interests = new ArrayList<>();

    /**
     * Coarse progress label
     */
    @Column(name = "progress", length = 32)
    @Builder.Default
    private String progress = PROGRESS_NOT_STARTED;

    /**
     * Phase name as tracked by the project context
     */
    @Column(name = "current_phase", length = 128)
    @Builder.Default
    private String currentPhase = "initial";

    /**
     * Progress 0-100
     */
    @Column(name = "progress_percentage")
    @Builder.Default
    private Integer progressPercentage = 0;

    /**
     * Last time the project state changed or a search run finished.
     * Staleness signal for the search necessity check.
     */
    @Column(name = "last_updated")
    private LocalDateTime lastUpdated;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    // ============ Helper methods ============

    /**
     * Trim, drop blanks and deduplicate goals and interests keeping their order.
     */
    @PrePersist
    @PreUpdate
    public void normalizeTerms() {
        this.goals = normalize(goals);
        this.interests = normalize(interests);
    }

    public static List<String> normalize(List<String> terms) {
        if (terms == null) {
            return new ArrayList<>();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                unique.add(term.trim());
            }
        }
        return new ArrayList<>(unique);
    }
}
