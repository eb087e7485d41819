package com.agenttracker.discovery.service.search;

import lombok.Getter;
import reactor.core.Disposable;

import java.time.LocalDateTime;

/**
 * One submitted orchestrator run, tracked in memory by {@link SearchRunRegistry}.
 */
@Getter
public class SearchRun {

    private final String id;
    private final Long projectId;
    private final boolean force;
    private final LocalDateTime submittedAt;

    private volatile SearchRunState state;
    private volatile SearchRunStatus status = SearchRunStatus.PENDING;
    private volatile SearchRunResult result;
    private volatile String error;
    private volatile LocalDateTime startedAt;
    private volatile LocalDateTime finishedAt;

    @Getter(lombok.AccessLevel.NONE)
    private volatile Disposable subscription;

    SearchRun(String id, Long projectId, boolean force) {
        this.id = id;
        this.projectId = projectId;
        this.force = force;
        this.submittedAt = LocalDateTime.now();
    }

    /**
     * PENDING → RUNNING only; a run cancelled before it reached the executor stays cancelled.
     */
    synchronized boolean started() {
        if (status != SearchRunStatus.PENDING) {
            return false;
        }
        this.status = SearchRunStatus.RUNNING;
        this.startedAt = LocalDateTime.now();
        return true;
    }

    void transition(SearchRunState state) {
        this.state = state;
    }

    void attach(Disposable subscription) {
        this.subscription = subscription;
        // cancelled before the subscription existed
        if (status == SearchRunStatus.CANCELLED) {
            subscription.dispose();
        }
    }

    synchronized boolean complete(SearchRunResult result) {
        if (status.isFinished()) {
            return false;
        }
        this.result = result;
        this.status = result.getStatus();
        this.finishedAt = LocalDateTime.now();
        return true;
    }

    synchronized boolean fail(Throwable error) {
        if (status.isFinished()) {
            return false;
        }
        this.error = error.getMessage();
        this.status = SearchRunStatus.FAILED;
        this.finishedAt = LocalDateTime.now();
        return true;
    }

    synchronized boolean cancel() {
        if (status.isFinished()) {
            return false;
        }
        this.status = SearchRunStatus.CANCELLED;
        this.finishedAt = LocalDateTime.now();
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
        return true;
    }

    public boolean isFinished() {
        return status.isFinished();
    }
}
