package com.agenttracker.discovery.service.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Splits a newsletter body into its named sections. Sections whose start marker
 * is missing are simply absent from the result.
 */
public final class SectionSegmenter {

    private SectionSegmenter() {
    }

    public static Map<String, String> segment(String content, NewsletterFormat format) {
        if (content == null || content.isEmpty() || format.sections().isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> sections = new LinkedHashMap<>();
        for (SectionBoundary boundary : format.sections()) {
            Matcher matcher = boundary.toPattern().matcher(content);
            if (matcher.find()) {
                String body = matcher.group(1);
                if (body != null && !body.isBlank()) {
                    sections.put(boundary.name(), body);
                }
            }
        }
        return sections;
    }
}
