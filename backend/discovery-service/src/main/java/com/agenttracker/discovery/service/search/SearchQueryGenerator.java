package com.agenttracker.discovery.service.search;

import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Produces the batch of search queries for one run.
 */
public interface SearchQueryGenerator {

    Mono<List<String>> generate(ProjectContext context, int count);
}
