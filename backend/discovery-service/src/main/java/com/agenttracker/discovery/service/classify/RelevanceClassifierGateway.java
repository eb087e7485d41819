package com.agenttracker.discovery.service.classify;

import com.agenttracker.discovery.config.PipelineProperties;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ClassifiedItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Relevance Classifier Gateway.
 *
 * Classifies candidates in parallel, bounded by {@code classification-concurrency}.
 * Every candidate comes back classified: a failed, timed out or unreadable
 * answer yields the default classification (5, [], OTHER). Identity fields are
 * always taken from the candidate, never from the classifier's answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RelevanceClassifierGateway {

    private final RelevanceClassifier classifier;
    private final ClassificationResponseParser parser;
    private final PipelineProperties properties;

    public Mono<List<ClassifiedItem>> classifyAll(List<CandidateItem> items, ProjectContext context) {
        if (items == null || items.isEmpty()) {
            return Mono.just(List.of());
        }
        log.debug("Classifying {} candidates for project {}", items.size(), context.projectId());
        return Flux.fromIterable(items)
                .flatMapSequential(item -> classify(item, context), Math.max(1, properties.getClassificationConcurrency()))
                .collectList();
    }

    public Mono<ClassifiedItem> classify(CandidateItem item, ProjectContext context) {
        return Mono.defer(() -> classifier.classifyRaw(item, context))
                .timeout(properties.getClassificationTimeout())
                .map(parser::parse)
                .defaultIfEmpty(ParsedClassification.defaults())
                .onErrorResume(e -> {
                    log.warn("Classification failed for {}, using defaults: {}", item.getSource(), e.getMessage());
                    return Mono.just(ParsedClassification.defaults());
                })
                .map(parsed -> toClassifiedItem(item, parsed));
    }

    private static ClassifiedItem toClassifiedItem(CandidateItem item, ParsedClassification parsed) {
        return ClassifiedItem.builder()
                .candidate(item)
                .relevanceScore(parsed.relevanceScore())
                .categories(parsed.categories())
                .contentType(parsed.contentType())
                .reasoning(parsed.reasoning())
                .parseOutcome(parsed.outcome())
                .build();
    }
}
