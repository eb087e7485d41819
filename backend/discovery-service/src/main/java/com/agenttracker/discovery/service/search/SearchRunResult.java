package com.agenttracker.discovery.service.search;

import com.agenttracker.discovery.service.merge.MergeSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one orchestrator run.
 */
@Value
@Builder(toBuilder = true)
public class SearchRunResult {

    Long projectId;

    SearchRunStatus status;

    /**
     * True only when a caller has to act: every provider failed with no
     * fallback enabled, or the store was unreachable
     */
    boolean actionRequired;

    String message;

    @Builder.Default
    List<String> queries = List.of();

    int queriesSucceeded;

    int queriesFailed;

    int candidatesFound;

    int classified;

    int inserted;

    int updated;

    int unchanged;

    int belowThreshold;

    public static SearchRunResult skipped(Long projectId, String reason) {
        return SearchRunResult.builder()
                .projectId(projectId)
                .status(SearchRunStatus.SKIPPED)
                .message(reason)
                .build();
    }

    public static SearchRunResult timedOut(Long projectId, String message) {
        return SearchRunResult.builder()
                .projectId(projectId)
                .status(SearchRunStatus.TIMED_OUT)
                .message(message)
                .build();
    }

    public static SearchRunResult failed(Long projectId, String message, boolean actionRequired) {
        return SearchRunResult.builder()
                .projectId(projectId)
                .status(SearchRunStatus.FAILED)
                .actionRequired(actionRequired)
                .message(message)
                .build();
    }

    public SearchRunResult withMerge(MergeSummary summary) {
        return toBuilder()
                .inserted(summary.inserted())
                .updated(summary.updated())
                .unchanged(summary.unchanged())
                .belowThreshold(summary.belowThreshold())
                .build();
    }
}
