package com.agenttracker.discovery.service.provider;

import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a list of results out of an LLM answer: a bare JSON array, an object
 * with a {@code results} array, or either of those wrapped in a code fence.
 */
class ResultListParser {

    static final String UNTITLED = "Untitled Discovery";
    static final String NO_DESCRIPTION = "No description available";

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private final ObjectMapper objectMapper;

    ResultListParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * An empty result list yields an empty list.
     *
     * @throws MalformedProviderOutputException when no result list can be found, or the list
     *                                          has entries but none carries an http(s) source
     */
    List<CandidateItem> parse(String content, String query, String origin) {
        JsonNode results = readResults(content);
        List<CandidateItem> items = new ArrayList<>();
        for (JsonNode node : results) {
            String source = text(node, "source", text(node, "url", null));
            if (source == null || !source.startsWith("http")) {
                continue;
            }
            items.add(CandidateItem.builder()
                    .title(text(node, "title", UNTITLED))
                    .description(text(node, "description", NO_DESCRIPTION))
                    .source(source.trim())
                    .publicationDate(parseDate(text(node, "publicationDate", null)))
                    .categoryHint(text(node, "type", null))
                    .searchQuery(query)
                    .origin(origin)
                    .build());
        }
        if (items.isEmpty() && results.size() > 0) {
            throw new MalformedProviderOutputException(
                    "Provider answer has " + results.size() + " results but none with a usable source");
        }
        return items;
    }

    private JsonNode readResults(String content) {
        if (content == null || content.isBlank()) {
            throw new MalformedProviderOutputException("Empty provider answer");
        }
        String json = content.trim();
        Matcher fence = CODE_FENCE.matcher(json);
        if (fence.find()) {
            json = fence.group(1).trim();
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root.isArray()) {
                return root;
            }
            if (root.has("results") && root.get("results").isArray()) {
                return root.get("results");
            }
            if (root.has("discoveries") && root.get("discoveries").isArray()) {
                return root.get("discoveries");
            }
        } catch (Exception e) {
            throw new MalformedProviderOutputException("Provider answer is not JSON: " + e.getMessage(), e);
        }
        throw new MalformedProviderOutputException("Provider answer has no result list");
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return fallback;
        }
        return value.asText();
    }

    private static LocalDateTime parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay();
            }
            return LocalDateTime.parse(value.length() > 19 ? value.substring(0, 19) : value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
