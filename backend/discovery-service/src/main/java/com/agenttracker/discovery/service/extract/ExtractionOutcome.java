package com.agenttracker.discovery.service.extract;

public enum ExtractionOutcome {
    /** No content was supplied */
    INPUT_ABSENT,
    /** Content was supplied but nothing could be extracted */
    EMPTY,
    /** Items came from a link extraction strategy */
    EXTRACTED,
    /** Items came from the loose title/description heuristic */
    FALLBACK
}
