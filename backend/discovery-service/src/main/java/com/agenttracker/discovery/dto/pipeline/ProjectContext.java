package com.agenttracker.discovery.dto.pipeline;

import com.agenttracker.discovery.entity.project.Project;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of a project handed to providers, classifier and merge engine.
 */
public record ProjectContext(
        Long projectId,
        String name,
        String domain,
        List<String> goals,
        List<String> interests,
        String phase,
        int progressPercentage,
        String progress,
        LocalDateTime lastUpdated
) {

    public static ProjectContext from(Project project) {
        return new ProjectContext(
                project.getId(),
                project.getName(),
                project.getDomain(),
                List.copyOf(Project.normalize(project.getGoals())),
                List.copyOf(Project.normalize(project.getInterests())),
                project.getCurrentPhase() != null ? project.getCurrentPhase() : "initial",
                project.getProgressPercentage() != null ? project.getProgressPercentage() : 0,
                project.getProgress() != null ? project.getProgress() : Project.PROGRESS_NOT_STARTED,
                project.getLastUpdated()
        );
    }

    /**
     * Snapshot stored on each new discovery
     */
    public Map<String, Object> toSearchContext() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("phase", phase);
        snapshot.put("progressPercentage", progressPercentage);
        snapshot.put("progress", progress);
        return snapshot;
    }
}
