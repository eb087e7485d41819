package com.agenttracker.discovery.service.extract;

import org.jsoup.parser.Parser;

import java.util.Locale;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical form of extracted URLs so the same link always yields the same identity key.
 */
public final class LinkNormalizer {

    private static final Pattern ALPHA_SIGNAL_LINK =
            Pattern.compile("^https?://link\\.alphasignal\\.ai/([A-Za-z0-9%]+)");

    private LinkNormalizer() {
    }

    public static String normalize(String url) {
        if (url == null) {
            return null;
        }
        String cleaned = Parser.unescapeEntities(url.trim(), true);

        Matcher tracking = ALPHA_SIGNAL_LINK.matcher(cleaned);
        if (tracking.find()) {
            return "https://link.alphasignal.ai/" + tracking.group(1);
        }
        return stripTrackingParams(cleaned);
    }

    /**
     * Remove utm_* query parameters, keeping the rest in order.
     */
    static String stripTrackingParams(String url) {
        int queryStart = url.indexOf('?');
        if (queryStart < 0) {
            return url;
        }
        int fragmentStart = url.indexOf('#', queryStart);
        String base = url.substring(0, queryStart);
        String query = fragmentStart < 0 ? url.substring(queryStart + 1) : url.substring(queryStart + 1, fragmentStart);
        String fragment = fragmentStart < 0 ? "" : url.substring(fragmentStart);

        StringJoiner kept = new StringJoiner("&");
        for (String param : query.split("&")) {
            if (!param.isEmpty() && !param.toLowerCase(Locale.ROOT).startsWith("utm_")) {
                kept.add(param);
            }
        }
        return kept.length() == 0 ? base + fragment : base + "?" + kept + fragment;
    }
}
