package com.agenttracker.discovery.service.newsletter;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one mailbox import for a project.
 */
@Value
@Builder
public class NewsletterImportResult {

    Long projectId;

    int messagesFetched;

    int messagesProcessed;

    int messagesFailed;

    int messagesMarkedRead;

    int candidatesExtracted;

    int inserted;

    int updated;

    int unchanged;

    int belowThreshold;

    @Builder.Default
    List<String> subjects = List.of();
}
