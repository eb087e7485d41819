package com.agenttracker.discovery.exception;

/**
 * Cancel requested for a search run that has already finished
 */
public class SearchRunFinishedException extends DiscoveryServiceException {

    public SearchRunFinishedException(String runId) {
        super("SEARCH_RUN_FINISHED", "Search run already finished: " + runId);
    }
}
