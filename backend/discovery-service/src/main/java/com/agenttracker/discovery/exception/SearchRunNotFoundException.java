package com.agenttracker.discovery.exception;

public class SearchRunNotFoundException extends DiscoveryServiceException {

    public SearchRunNotFoundException(String runId) {
        super("SEARCH_RUN_NOT_FOUND", "Search run not found or expired: " + runId);
    }
}
