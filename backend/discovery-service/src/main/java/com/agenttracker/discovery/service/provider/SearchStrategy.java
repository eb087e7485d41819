package com.agenttracker.discovery.service.provider;

import com.agenttracker.discovery.dto.pipeline.ProjectContext;

import java.util.List;
import java.util.Locale;

/**
 * Focus the context-aware agent puts on its search, picked from the project's domain and goals.
 */
public enum SearchStrategy {

    TECHNICAL(List.of("software", "programming", "engineering", "development", "code", "api", "backend", "infrastructure"),
            "Focus on technical details, implementation approaches, and code examples."),
    CREATIVE(List.of("design", "art", "game", "music", "creative", "animation", "visual", "film"),
            "Focus on creative applications, design patterns, and innovative approaches."),
    ACADEMIC(List.of("research", "science", "academic", "study", "thesis", "theory", "paper"),
            "Focus on research papers, academic findings, and theoretical foundations."),
    FOCUSED(List.of("tool", "framework", "productivity", "automation", "workflow", "library"),
            "Focus on specific tools, frameworks, and practical applications."),
    DEFAULT(List.of(),
            "Provide a broad overview of relevant information.");

    private final List<String> keywords;
    private final String instruction;

    SearchStrategy(List<String> keywords, String instruction) {
        this.keywords = keywords;
        this.instruction = instruction;
    }

    public String instruction() {
        return instruction;
    }

    /**
     * First strategy whose keywords appear in the domain, then in the goals.
     */
    public static SearchStrategy forContext(ProjectContext context) {
        if (context == null) {
            return DEFAULT;
        }
        SearchStrategy byDomain = match(context.domain());
        if (byDomain != DEFAULT) {
            return byDomain;
        }
        return match(String.join(" ", context.goals()));
    }

    private static SearchStrategy match(String text) {
        if (text == null || text.isBlank()) {
            return DEFAULT;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (SearchStrategy strategy : values()) {
            if (strategy.keywords.stream().anyMatch(lower::contains)) {
                return strategy;
            }
        }
        return DEFAULT;
    }
}
