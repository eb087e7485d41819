package com.agenttracker.discovery.service.search;

import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.dto.pipeline.SearchNecessityDecision;
import reactor.core.publisher.Mono;

/**
 * Judges whether a project that was searched recently needs a fresh search.
 */
public interface SearchNecessityEvaluator {

    Mono<SearchNecessityDecision> evaluate(ProjectContext context);
}
