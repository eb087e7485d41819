package com.agenttracker.discovery.service.search;

public enum SearchRunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    SKIPPED,
    ALL_QUERIES_FAILED,
    TIMED_OUT,
    CANCELLED,
    FAILED;

    public boolean isFinished() {
        return this != PENDING && this != RUNNING;
    }
}
