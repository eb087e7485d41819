package com.agenttracker.discovery.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Bulk review action over explicit ids or, when ids are absent, over a filter.
 *
 * @param filter NEW, VIEWED or ALL
 */
public record BulkUpdateRequest(
        List<Long> ids,
        DiscoveryFilter filter,
        @NotNull BulkAction action
) {

    public enum BulkAction {
        MARK_VIEWED,
        HIDE,
        UNHIDE
    }

    public boolean hasIds() {
        return ids != null && !ids.isEmpty();
    }
}
