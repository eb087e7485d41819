package com.agenttracker.discovery.service.search;

import com.agenttracker.discovery.config.PipelineProperties;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.dto.pipeline.SearchNecessityDecision;
import com.agenttracker.discovery.exception.ProjectNotFoundException;
import com.agenttracker.discovery.repository.ProjectRepository;
import com.agenttracker.discovery.service.classify.RelevanceClassifierGateway;
import com.agenttracker.discovery.service.merge.DiscoveryMergeService;
import com.agenttracker.discovery.service.merge.DiscoveryStore;
import com.agenttracker.discovery.service.provider.ProviderChainResult;
import com.agenttracker.discovery.service.provider.SearchProviderChain;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Search Orchestrator.
 *
 * One run per project:
 * <pre>
 * START → NECESSITY_CHECK → {SKIPPED | GENERATE_QUERIES → FAN_OUT → EXTRACT → CLASSIFY → MERGE}
 *       → UPDATE_PROJECT_TIMESTAMP → END
 * </pre>
 * The project timestamp is refreshed on every exit path (skip, failure, timeout, cancel)
 * so the necessity check always sees an accurate staleness signal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscoverySearchOrchestrator {

    private final ProjectRepository projectRepository;
    private final DiscoveryStore discoveryStore;
    private final SearchNecessityEvaluator necessityEvaluator;
    private final SearchQueryGenerator queryGenerator;
    private final TemplateQueryGenerator templateQueryGenerator;
    private final SearchProviderChain providerChain;
    private final RelevanceClassifierGateway classifierGateway;
    private final DiscoveryMergeService mergeService;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Run the pipeline for one project.
     *
     * @param force    skip the necessity check
     * @param listener notified on every state transition
     * @return the run result; errors other than an unknown project are folded into it
     */
    public Mono<SearchRunResult> run(Long projectId, boolean force, Consumer<SearchRunState> listener) {
        Consumer<SearchRunState> states = listener != null ? listener : state -> { };
        return Mono.fromCallable(() -> loadContext(projectId))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(context -> {
                    states.accept(SearchRunState.START);
                    log.info("Search run started: projectId={}, force={}", projectId, force);
                })
                .flatMap(context -> execute(context, force, states)
                        .timeout(properties.getRunTimeout(), Schedulers.boundedElastic())
                        .onErrorResume(e -> Mono.just(toFailureResult(projectId, e)))
                        .flatMap(result -> touchProject(projectId, states).thenReturn(result))
                        .doOnCancel(() -> {
                            log.warn("Search run cancelled: projectId={}", projectId);
                            Schedulers.boundedElastic().schedule(() -> updateTimestamp(projectId));
                        }))
                .doOnNext(result -> {
                    states.accept(SearchRunState.END);
                    meterRegistry.counter("discovery.search.runs", "outcome", result.getStatus().name()).increment();
                    log.info("Search run finished: projectId={}, status={}, inserted={}, updated={}, unchanged={}",
                            projectId, result.getStatus(), result.getInserted(), result.getUpdated(), result.getUnchanged());
                });
    }

    private ProjectContext loadContext(Long projectId) {
        return projectRepository.findById(projectId)
                .map(ProjectContext::from)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    private Mono<SearchRunResult> execute(ProjectContext context, boolean force, Consumer<SearchRunState> states) {
        return checkNecessity(context, force, states)
                .flatMap(decision -> {
                    if (!decision.shouldSearch()) {
                        states.accept(SearchRunState.SKIPPED);
                        log.info("Search skipped: projectId={}, reason={}", context.projectId(), decision.rationale());
                        return Mono.just(SearchRunResult.skipped(context.projectId(), decision.rationale()));
                    }
                    return search(context, states);
                });
    }

    // ============ NECESSITY_CHECK ============

    Mono<SearchNecessityDecision> checkNecessity(ProjectContext context, boolean force, Consumer<SearchRunState> states) {
        if (force) {
            return Mono.just(SearchNecessityDecision.search("Forced search"));
        }
        states.accept(SearchRunState.NECESSITY_CHECK);
        LocalDateTime since = LocalDateTime.now().minus(properties.getNecessityLookback());

        return Mono.fromCallable(() -> discoveryStore.countDiscoveredSince(context.projectId(), since))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(recentCount -> {
                    boolean updatedRecently = context.lastUpdated() != null && context.lastUpdated().isAfter(since);
                    if (recentCount == 0 || !updatedRecently) {
                        return Mono.just(SearchNecessityDecision.search("No recent search results"));
                    }
                    log.debug("Project {} has {} discoveries in the lookback window, asking evaluator",
                            context.projectId(), recentCount);
                    return necessityEvaluator.evaluate(context)
                            .defaultIfEmpty(SearchNecessityDecision.search("Evaluator gave no answer"))
                            .onErrorResume(e -> {
                                log.warn("Necessity check failed for project {}, searching anyway: {}",
                                        context.projectId(), e.getMessage());
                                return Mono.just(SearchNecessityDecision.search("Necessity check failed"));
                            });
                });
    }

    // ============ GENERATE_QUERIES → MERGE ============

    private Mono<SearchRunResult> search(ProjectContext context, Consumer<SearchRunState> states) {
        states.accept(SearchRunState.GENERATE_QUERIES);
        int batchSize = properties.getQueryBatchSize();
        return queryGenerator.generate(context, batchSize)
                .map(QuerySanitizer::sanitizeAll)
                .filter(queries -> !queries.isEmpty())
                .switchIfEmpty(Mono.fromSupplier(() -> templateQueryGenerator.queriesFor(context, batchSize)))
                .flatMap(queries -> {
                    if (queries.isEmpty()) {
                        log.warn("No search queries could be built for project {}", context.projectId());
                        return Mono.just(SearchRunResult.builder()
                                .projectId(context.projectId())
                                .status(SearchRunStatus.COMPLETED)
                                .message("Project has no goals, interests or domain to search for")
                                .build());
                    }
                    log.info("Generated {} queries for project {}: {}", queries.size(), context.projectId(), queries);
                    return fanOut(context, queries, states);
                });
    }

    private Mono<SearchRunResult> fanOut(ProjectContext context, List<String> queries, Consumer<SearchRunState> states) {
        states.accept(SearchRunState.FAN_OUT);
        return Flux.fromIterable(queries)
                .flatMapSequential(query -> providerChain.execute(query, context),
                        Math.max(1, properties.getQueryConcurrency()))
                .collectList()
                .flatMap(chainResults -> {
                    List<ProviderChainResult> succeeded = chainResults.stream()
                            .filter(ProviderChainResult::succeeded)
                            .toList();
                    SearchRunResult base = SearchRunResult.builder()
                            .projectId(context.projectId())
                            .status(SearchRunStatus.COMPLETED)
                            .queries(queries)
                            .queriesSucceeded(succeeded.size())
                            .queriesFailed(chainResults.size() - succeeded.size())
                            .build();

                    if (succeeded.isEmpty()) {
                        return Mono.just(allQueriesFailed(context, chainResults, base));
                    }

                    states.accept(SearchRunState.EXTRACT);
                    List<CandidateItem> candidates = uniqueBySource(succeeded);
                    log.info("Collected {} unique candidates for project {} from {}/{} queries",
                            candidates.size(), context.projectId(), succeeded.size(), chainResults.size());

                    states.accept(SearchRunState.CLASSIFY);
                    return classifierGateway.classifyAll(candidates, context)
                            .flatMap(classified -> {
                                states.accept(SearchRunState.MERGE);
                                return Mono.fromCallable(() -> mergeService.mergeAll(context, classified))
                                        .subscribeOn(Schedulers.boundedElastic())
                                        .map(summary -> base.toBuilder()
                                                .candidatesFound(candidates.size())
                                                .classified(classified.size())
                                                .build()
                                                .withMerge(summary));
                            });
                });
    }

    private SearchRunResult allQueriesFailed(ProjectContext context, List<ProviderChainResult> chainResults,
                                             SearchRunResult base) {
        boolean noFallback = chainResults.stream().allMatch(ProviderChainResult::exhaustedWithoutFallback);
        log.error("No search methods succeeded: projectId={}, queries={}, fallbackEnabled={}",
                context.projectId(), chainResults.size(), !noFallback);
        meterRegistry.counter("discovery.search.all_queries_failed").increment();
        return base.toBuilder()
                .status(SearchRunStatus.ALL_QUERIES_FAILED)
                .actionRequired(noFallback)
                .message(noFallback
                        ? "All search providers failed and no fallback provider is enabled"
                        : "All search providers failed")
                .build();
    }

    /**
     * First occurrence of each source wins.
     */
    static List<CandidateItem> uniqueBySource(List<ProviderChainResult> results) {
        Map<String, CandidateItem> unique = new LinkedHashMap<>();
        for (ProviderChainResult result : results) {
            for (CandidateItem item : result.items()) {
                unique.putIfAbsent(item.getSource(), item);
            }
        }
        return new ArrayList<>(unique.values());
    }

    // ============ UPDATE_PROJECT_TIMESTAMP ============

    private Mono<Void> touchProject(Long projectId, Consumer<SearchRunState> states) {
        return Mono.fromRunnable(() -> {
                    states.accept(SearchRunState.UPDATE_PROJECT_TIMESTAMP);
                    updateTimestamp(projectId);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private void updateTimestamp(Long projectId) {
        try {
            projectRepository.updateLastUpdated(projectId, LocalDateTime.now());
        } catch (DataAccessException e) {
            log.error("Failed to update project timestamp: projectId={}, error={}", projectId, e.getMessage(), e);
        }
    }

    private SearchRunResult toFailureResult(Long projectId, Throwable error) {
        if (error instanceof TimeoutException) {
            log.error("Search run timed out: projectId={}, timeout={}", projectId, properties.getRunTimeout());
            return SearchRunResult.timedOut(projectId, "Search run exceeded " + properties.getRunTimeout());
        }
        if (error instanceof DataAccessException) {
            log.error("Discovery store unavailable during search run: projectId={}", projectId, error);
            return SearchRunResult.failed(projectId, "Discovery store unavailable: " + error.getMessage(), true);
        }
        log.error("Search run failed: projectId={}", projectId, error);
        return SearchRunResult.failed(projectId, error.getMessage(), false);
    }
}
