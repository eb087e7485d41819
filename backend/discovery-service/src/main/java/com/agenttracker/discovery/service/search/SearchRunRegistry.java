package com.agenttracker.discovery.service.search;

import com.agenttracker.discovery.config.PipelineProperties;
import com.agenttracker.discovery.exception.ProjectNotFoundException;
import com.agenttracker.discovery.exception.SearchRunFinishedException;
import com.agenttracker.discovery.exception.SearchRunNotFoundException;
import com.agenttracker.discovery.repository.ProjectRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Tracks submitted search runs in memory.
 *
 * A run is accepted immediately and executed on the search executor.
 * At most one run is active per project; triggering again while one is
 * running returns the active run. Finished runs stay queryable for
 * {@code run-retention} and are then evicted.
 */
@Service
@Slf4j
public class SearchRunRegistry {

    private final DiscoverySearchOrchestrator orchestrator;
    private final ProjectRepository projectRepository;
    private final PipelineProperties properties;
    private final Scheduler scheduler;

    private final Map<String, SearchRun> runs = new ConcurrentHashMap<>();
    private final Map<Long, SearchRun> activeByProject = new ConcurrentHashMap<>();

    public SearchRunRegistry(DiscoverySearchOrchestrator orchestrator,
                             ProjectRepository projectRepository,
                             PipelineProperties properties,
                             @Qualifier("searchExecutor") Executor searchExecutor) {
        this.orchestrator = orchestrator;
        this.projectRepository = projectRepository;
        this.properties = properties;
        this.scheduler = Schedulers.fromExecutor(searchExecutor);
    }

    /**
     * Accept a run for the project, or return the one already running.
     *
     * @throws ProjectNotFoundException when the project does not exist
     */
    public SearchRun submit(Long projectId, boolean force) {
        if (!projectRepository.existsById(projectId)) {
            throw new ProjectNotFoundException(projectId);
        }

        SearchRun[] created = new SearchRun[1];
        SearchRun run = activeByProject.compute(projectId, (id, current) -> {
            if (current != null && !current.isFinished()) {
                return current;
            }
            created[0] = new SearchRun(UUID.randomUUID().toString(), projectId, force);
            return created[0];
        });

        if (created[0] == null) {
            log.info("Search already running for project {}: runId={}", projectId, run.getId());
            return run;
        }

        runs.put(run.getId(), run);
        Disposable subscription = orchestrator.run(projectId, force, run::transition)
                .subscribeOn(scheduler)
                .doOnSubscribe(s -> run.started())
                .doFinally(signal -> activeByProject.remove(projectId, run))
                .subscribe(
                        result -> run.complete(result),
                        error -> {
                            log.error("Search run failed: runId={}, projectId={}, error={}",
                                    run.getId(), projectId, error.getMessage(), error);
                            run.fail(error);
                        });
        run.attach(subscription);

        log.info("Search run submitted: runId={}, projectId={}, force={}", run.getId(), projectId, force);
        return run;
    }

    public Optional<SearchRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public SearchRun get(String runId) {
        return find(runId).orElseThrow(() -> new SearchRunNotFoundException(runId));
    }

    /**
     * Cancel a pending or running run.
     *
     * @throws SearchRunNotFoundException when the run is unknown or evicted
     * @throws SearchRunFinishedException when the run has already finished
     */
    public SearchRun cancel(String runId) {
        SearchRun run = get(runId);
        if (!run.cancel()) {
            throw new SearchRunFinishedException(runId);
        }
        activeByProject.remove(run.getProjectId(), run);
        log.info("Search run cancelled: runId={}, projectId={}", runId, run.getProjectId());
        return run;
    }

    /**
     * Evict finished runs older than the retention window
     */
    @Scheduled(fixedDelayString = "${discovery.pipeline.run-cleanup-interval-ms:600000}")
    public void evictFinishedRuns() {
        LocalDateTime cutoff = LocalDateTime.now().minus(properties.getRunRetention());
        int before = runs.size();
        runs.values().removeIf(run -> run.isFinished()
                && run.getFinishedAt() != null
                && run.getFinishedAt().isBefore(cutoff));
        int evicted = before - runs.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished search runs", evicted);
        }
    }
}
