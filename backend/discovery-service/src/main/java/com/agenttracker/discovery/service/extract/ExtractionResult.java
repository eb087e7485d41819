package com.agenttracker.discovery.service.extract;

import com.agenttracker.discovery.dto.pipeline.CandidateItem;

import java.util.List;
import java.util.Map;

/**
 * Items extracted from one content unit plus the raw text of each recognized section.
 *
 * @param strategy name of the strategy that produced the items, null when none did
 */
public record ExtractionResult(
        List<CandidateItem> items,
        Map<String, String> sections,
        ExtractionOutcome outcome,
        String strategy
) {

    public static ExtractionResult absent() {
        return new ExtractionResult(List.of(), Map.of(), ExtractionOutcome.INPUT_ABSENT, null);
    }

    public static ExtractionResult empty(Map<String, String> sections) {
        return new ExtractionResult(List.of(), sections, ExtractionOutcome.EMPTY, null);
    }
}
