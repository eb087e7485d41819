package com.agenttracker.discovery.service.merge;

import com.agenttracker.discovery.entity.discovery.Discovery;

import java.util.List;

/**
 * Counts of one merge pass.
 *
 * @param discoveries discoveries inserted or updated by the pass
 * @param failed      items given up on after repeated conflicts
 */
public record MergeSummary(
        int inserted,
        int updated,
        int unchanged,
        int belowThreshold,
        int failed,
        List<Discovery> discoveries
) {

    public static MergeSummary empty() {
        return new MergeSummary(0, 0, 0, 0, 0, List.of());
    }

    public int stored() {
        return inserted + updated;
    }
}
