package com.agenttracker.discovery.service.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Strips absolute dates and recency words from generated queries so results
 * are not narrowed to a single period.
 */
public final class QuerySanitizer {

    private static final Pattern ISO_DATE = Pattern.compile("\\b\\d{4}-\\d{1,2}(-\\d{1,2})?\\b");
    private static final Pattern MONTH_YEAR = Pattern.compile(
            "\\b(jan(uary)?|feb(ruary)?|mar(ch)?|apr(il)?|may|june?|july?|aug(ust)?|sep(t(ember)?)?|oct(ober)?|nov(ember)?|dec(ember)?)\\s+(19|20)\\d{2}\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}s?\\b");
    private static final Pattern RECENCY = Pattern.compile("\\b(recent|latest|new|current|today)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORPHAN_PUNCTUATION = Pattern.compile("\\s+([,.;:])|[(\\[]\\s*[)\\]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QuerySanitizer() {
    }

    public static String sanitize(String query) {
        if (query == null) {
            return "";
        }
        String cleaned = ISO_DATE.matcher(query).replaceAll(" ");
        cleaned = MONTH_YEAR.matcher(cleaned).replaceAll(" ");
        cleaned = YEAR.matcher(cleaned).replaceAll(" ");
        cleaned = RECENCY.matcher(cleaned).replaceAll(" ");
        cleaned = ORPHAN_PUNCTUATION.matcher(cleaned).replaceAll("$1");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        // quotes left over from a list answer
        if (cleaned.length() >= 2 && cleaned.startsWith("\"") && cleaned.endsWith("\"")) {
            cleaned = cleaned.substring(1, cleaned.length() - 1).trim();
        }
        return cleaned;
    }

    /**
     * Sanitize every query, drop blanks and case-insensitive repeats, keep order.
     */
    public static List<String> sanitizeAll(Collection<String> queries) {
        List<String> result = new ArrayList<>();
        if (queries == null) {
            return result;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String query : queries) {
            String cleaned = sanitize(query);
            if (cleaned.isBlank()) {
                continue;
            }
            if (seen.add(cleaned.toLowerCase(Locale.ROOT))) {
                result.add(cleaned);
            }
        }
        return result;
    }
}
