package com.agenttracker.discovery.service.classify;

import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import reactor.core.publisher.Mono;

/**
 * Scores one candidate against a project. Returns the raw classifier answer;
 * reading it is left to {@link ClassificationResponseParser}.
 */
public interface RelevanceClassifier {

    Mono<String> classifyRaw(CandidateItem item, ProjectContext context);
}
