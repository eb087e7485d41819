package com.agenttracker.discovery.dto.pipeline;

public record SearchNecessityDecision(boolean shouldSearch, String rationale) {

    public static SearchNecessityDecision search(String rationale) {
        return new SearchNecessityDecision(true, rationale);
    }

    public static SearchNecessityDecision skip(String rationale) {
        return new SearchNecessityDecision(false, rationale);
    }
}
