package com.agenttracker.discovery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Settings for the discovery ingestion pipeline.
 *
 * Passed into the orchestrator, the provider chain, the classifier gateway
 * and the merge engine at construction. Provider toggles live here rather
 * than being read from the environment at call sites.
 */
@Configuration
@ConfigurationProperties(prefix = "discovery.pipeline")
@Data
public class PipelineProperties {

    /**
     * Minimum relevance score (1-10) for a classified item to be stored
     */
    private int relevanceThreshold = 5;

    /**
     * Number of queries generated per search run
     */
    private int queryBatchSize = 5;

    /**
     * Queries executed in parallel within one run
     */
    private int queryConcurrency = 3;

    /**
     * Window used by the search necessity check
     */
    private Duration necessityLookback = Duration.ofHours(6);

    /**
     * Per-provider attempt timeout
     */
    private Duration providerTimeout = Duration.ofSeconds(8);

    /**
     * Per-item classification timeout
     */
    private Duration classificationTimeout = Duration.ofSeconds(8);

    /**
     * Classification calls in flight at once
     */
    private int classificationConcurrency = 4;

    /**
     * Upper bound for a whole orchestrator run
     */
    private Duration runTimeout = Duration.ofMinutes(5);

    /**
     * How long finished runs stay queryable
     */
    private Duration runRetention = Duration.ofHours(1);

    private boolean contextAwareSearchEnabled = true;

    private boolean semanticSearchEnabled = true;

    /**
     * Raw web search has the weakest relevance guarantees, so it is opt-in
     */
    private boolean webSearchFallbackEnabled = false;
}
