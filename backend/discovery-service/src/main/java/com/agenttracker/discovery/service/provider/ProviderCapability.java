package com.agenttracker.discovery.service.provider;

/**
 * What a search provider needs and how much its results can be trusted.
 * Declaration order is chain order.
 */
public enum ProviderCapability {
    /** Uses the project's semantic context; only tried when a context is available */
    CONTEXT_AWARE,
    /** Needs nothing but the query */
    CONTEXT_FREE,
    /** Raw web search, weakest relevance guarantees; only engaged when explicitly enabled */
    LAST_RESORT
}
