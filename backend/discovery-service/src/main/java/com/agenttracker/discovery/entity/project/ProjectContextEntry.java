package com.agenttracker.discovery.entity.project;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One entry of a project's running context: questions asked by the agent,
 * user answers and updates, feedback on discoveries and milestones.
 */
@Entity
@Table(name = "project_context_entries", indexes = {
        @Index(name = "idx_pce_project_id", columnList = "project_id"),
        @Index(name = "idx_pce_type", columnList = "entry_type"),
        @Index(name = "idx_pce_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectContextEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 32)
    private EntryType entryType;

    @Column(name = "content", columnDefinition = "text")
    private String content;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public enum EntryType {
        AGENT_QUESTION,
        USER_RESPONSE,
        USER_UPDATE,
        FEEDBACK,
        MILESTONE
    }

    // ============ Static factory methods ============

    public static ProjectContextEntry feedback(Long projectId, Long discoveryId, String title, boolean useful, String notes) {
        StringBuilder content = new StringBuilder()
                .append("User found \"").append(title).append("\" ")
                .append(useful ? "useful" : "not useful");
        if (notes != null && !notes.isBlank()) {
            content.append(": ").append(notes);
        }
        return ProjectContextEntry.builder()
                .projectId(projectId)
                .entryType(EntryType.FEEDBACK)
                .content(content.toString())
                .metadata(Map.of("discoveryId", discoveryId, "useful", useful))
                .build();
    }
}
