package com.agenttracker.discovery.service.extract;

import com.agenttracker.discovery.util.QuotedPrintable;
import org.jsoup.parser.Parser;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Title and description cleanup shared by the extraction strategies.
 */
final class TextCleaner {

    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");

    private TextCleaner() {
    }

    /**
     * Strip tags, decode QP sequences and HTML entities, collapse whitespace.
     */
    static String clean(String text) {
        if (text == null) {
            return "";
        }
        String decoded = QuotedPrintable.decodeIfEncoded(text);
        String noTags = TAG.matcher(decoded).replaceAll(" ");
        String unescaped = Parser.unescapeEntities(noTags, false);
        return WHITESPACE.matcher(unescaped.replace('\u00A0', ' ')).replaceAll(" ").trim();
    }

    static String truncate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max).trim() + "...";
    }

    static String slug(String text) {
        if (text == null) {
            return "";
        }
        String slug = NON_SLUG.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = slug.replaceAll("^-+|-+$", "");
        return slug.length() > 80 ? slug.substring(0, 80) : slug;
    }
}
