package com.agenttracker.discovery.service.extract;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A named section that starts at a marker and runs to the first of its end markers
 * (or to the end of the text when none follows).
 */
public record SectionBoundary(String name, String startMarker, List<String> endMarkers) {

    public Pattern toPattern() {
        String ends = endMarkers.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile(Pattern.quote(startMarker) + "([\\s\\S]*?)(?=" + ends + "|\\z)",
                Pattern.CASE_INSENSITIVE);
    }
}
