package com.agenttracker.discovery.service.classify;

import com.agenttracker.discovery.entity.discovery.ContentType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the classifier's answer. Never throws.
 *
 * Tolerance ladder:
 * 1. strict JSON object
 * 2. code fence stripped, first {...} block
 * 3. per-field regex salvage
 * 4. defaults (5, [], OTHER)
 */
@Component
@Slf4j
public class ClassificationResponseParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");
    private static final Pattern JSON_BLOCK = Pattern.compile("\\{[\\s\\S]*}");
    private static final Pattern SCORE_FIELD = Pattern.compile("\"?relevanceScore\"?\\s*[:=]\\s*\"?(-?\\d+(?:\\.\\d+)?)");
    private static final Pattern CATEGORIES_FIELD = Pattern.compile("\"?categories\"?\\s*[:=]\\s*\\[([^\\]]*)]");
    private static final Pattern TYPE_FIELD = Pattern.compile("\"?type\"?\\s*[:=]\\s*\"([^\"]*)\"");
    private static final Pattern REASONING_FIELD = Pattern.compile("\"?reasoning\"?\\s*[:=]\\s*\"([^\"]*)\"");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    private final ObjectMapper objectMapper;

    public ClassificationResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedClassification parse(String response) {
        if (response == null || response.isBlank()) {
            return ParsedClassification.defaults();
        }
        String trimmed = response.trim();

        ParsedClassification strict = readJson(trimmed, ParseOutcome.STRICT);
        if (strict != null) {
            return strict;
        }

        String candidate = trimmed;
        Matcher fence = CODE_FENCE.matcher(candidate);
        if (fence.find()) {
            candidate = fence.group(1).trim();
        }
        Matcher block = JSON_BLOCK.matcher(candidate);
        if (block.find()) {
            ParsedClassification fenced = readJson(block.group(), ParseOutcome.FENCED);
            if (fenced != null) {
                return fenced;
            }
        }

        ParsedClassification salvaged = salvage(trimmed);
        if (salvaged != null) {
            return salvaged;
        }

        log.debug("Unreadable classification answer, using defaults: {}", abbreviate(trimmed));
        return ParsedClassification.defaults();
    }

    private ParsedClassification readJson(String json, ParseOutcome outcome) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }

        int score = ParsedClassification.DEFAULT_SCORE;
        JsonNode scoreNode = root.get("relevanceScore");
        if (scoreNode != null && scoreNode.isNumber()) {
            score = clampScore(scoreNode.asDouble());
        } else if (scoreNode != null && scoreNode.isTextual()) {
            score = parseScore(scoreNode.asText());
        }

        List<String> categories = new ArrayList<>();
        JsonNode categoriesNode = root.get("categories");
        if (categoriesNode != null && categoriesNode.isArray()) {
            for (JsonNode category : categoriesNode) {
                if (category.isTextual() && !category.asText().isBlank()) {
                    categories.add(category.asText().trim());
                }
            }
        }

        ContentType type = ContentType.fromLabel(root.path("type").asText(null));
        String reasoning = root.hasNonNull("reasoning") ? root.get("reasoning").asText() : null;
        return new ParsedClassification(score, List.copyOf(categories), type, reasoning, outcome);
    }

    private ParsedClassification salvage(String text) {
        Matcher score = SCORE_FIELD.matcher(text);
        Matcher categories = CATEGORIES_FIELD.matcher(text);
        Matcher type = TYPE_FIELD.matcher(text);
        boolean hasScore = score.find();
        boolean hasCategories = categories.find();
        boolean hasType = type.find();
        if (!hasScore && !hasCategories && !hasType) {
            return null;
        }

        List<String> salvagedCategories = new ArrayList<>();
        if (hasCategories) {
            Matcher quoted = QUOTED.matcher(categories.group(1));
            while (quoted.find()) {
                salvagedCategories.add(quoted.group(1).trim());
            }
        }
        Matcher reasoning = REASONING_FIELD.matcher(text);

        return new ParsedClassification(
                hasScore ? parseScore(score.group(1)) : ParsedClassification.DEFAULT_SCORE,
                List.copyOf(salvagedCategories),
                hasType ? ContentType.fromLabel(type.group(1)) : ContentType.OTHER,
                reasoning.find() ? reasoning.group(1) : null,
                ParseOutcome.SALVAGED);
    }

    private static int parseScore(String value) {
        try {
            return clampScore(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return ParsedClassification.DEFAULT_SCORE;
        }
    }

    static int clampScore(double score) {
        if (Double.isNaN(score)) {
            return ParsedClassification.DEFAULT_SCORE;
        }
        long rounded = Math.round(score);
        return (int) Math.max(1, Math.min(10, rounded));
    }

    private static String abbreviate(String text) {
        return text.length() > 120 ? text.substring(0, 120) + "..." : text;
    }
}
