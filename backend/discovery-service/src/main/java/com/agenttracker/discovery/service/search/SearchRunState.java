package com.agenttracker.discovery.service.search;

/**
 * Steps of one orchestrator run, in order.
 */
public enum SearchRunState {
    START,
    NECESSITY_CHECK,
    SKIPPED,
    GENERATE_QUERIES,
    FAN_OUT,
    EXTRACT,
    CLASSIFY,
    MERGE,
    UPDATE_PROJECT_TIMESTAMP,
    END
}
