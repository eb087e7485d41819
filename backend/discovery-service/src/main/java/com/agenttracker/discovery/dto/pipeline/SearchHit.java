package com.agenttracker.discovery.dto.pipeline;

/**
 * Raw hit from a web search API before it becomes a candidate.
 */
public record SearchHit(String title, String snippet, String url) {
}
