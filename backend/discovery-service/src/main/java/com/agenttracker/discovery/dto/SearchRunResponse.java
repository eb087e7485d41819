package com.agenttracker.discovery.dto;

import com.agenttracker.discovery.service.search.SearchRun;
import com.agenttracker.discovery.service.search.SearchRunResult;
import com.agenttracker.discovery.service.search.SearchRunState;
import com.agenttracker.discovery.service.search.SearchRunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * DTO for search run status responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRunResponse {

    private String runId;
    private Long projectId;
    private boolean force;
    private SearchRunStatus status;
    private SearchRunState state;
    private SearchRunResult result;
    private String error;
    private LocalDateTime submittedAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;

    public static SearchRunResponse from(SearchRun run) {
        return SearchRunResponse.builder()
                .runId(run.getId())
                .projectId(run.getProjectId())
                .force(run.isForce())
                .status(run.getStatus())
                .state(run.getState())
                .result(run.getResult())
                .error(run.getError())
                .submittedAt(run.getSubmittedAt())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .build();
    }
}
