package com.agenttracker.discovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Agent Tracker Discovery Service Application
 *
 * Spring Boot service that keeps surfacing content relevant to a project
 * - web search through an ordered provider fallback chain
 * - newsletter import from an IMAP mailbox
 * - LLM relevance scoring with score-dominant deduplication
 * - PostgreSQL storage of discoveries and their review state
 */
@SpringBootApplication
public class DiscoveryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiscoveryServiceApplication.class, args);
    }
}
