package com.agenttracker.discovery.dto;

import java.util.List;

public record BulkUpdateResult(
        int requested,
        int succeeded,
        int failed,
        List<Long> failedIds
) {
}
