package com.agenttracker.discovery.service.extract;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the category label printed above a link and the like count printed below it.
 */
final class LinkContextReader {

    static final int LOOK_BEHIND = 500;
    static final int LOOK_AHEAD = 500;

    private static final List<Pattern> CATEGORY_PATTERNS = List.of(
            Pattern.compile("<span style=3D[^>]*>([^<]{2,80})</span>"),
            Pattern.compile("<span style=[^>]*>([^<]{2,80})</span>"),
            Pattern.compile("class=(?:3D)?[\"']?category[\"']?[^>]*>([^<]{2,80})<")
    );

    private static final List<Pattern> POPULARITY_PATTERNS = List.of(
            Pattern.compile("=E2=87=A7\\s*([\\d,]+)\\s*Likes"),
            Pattern.compile("\u21e7\\s*([\\d,]+)\\s*Likes"),
            Pattern.compile("(\\d+)\\s*Likes")
    );

    private static final Pattern DESCRIPTION_END =
            Pattern.compile("<a\\s|\u21e7|=E2=87=A7|\\d+\\s*Likes", Pattern.CASE_INSENSITIVE);

    private LinkContextReader() {
    }

    /**
     * Blurb printed right after the link, up to the next link or like counter.
     */
    static String descriptionAfter(String raw, int linkEnd) {
        String window = raw.substring(linkEnd, Math.min(raw.length(), linkEnd + LOOK_AHEAD));
        Matcher end = DESCRIPTION_END.matcher(window);
        if (end.find()) {
            window = window.substring(0, end.start());
        }
        String cleaned = TextCleaner.clean(window);
        return cleaned.length() >= 20 ? TextCleaner.truncate(cleaned, 300) : null;
    }

    /**
     * Last category label in the window before the link, if any.
     */
    static String categoryBefore(String raw, int linkStart) {
        String window = raw.substring(Math.max(0, linkStart - LOOK_BEHIND), linkStart);
        for (Pattern pattern : CATEGORY_PATTERNS) {
            Matcher matcher = pattern.matcher(window);
            String last = null;
            while (matcher.find()) {
                last = matcher.group(1);
            }
            if (last != null) {
                String cleaned = TextCleaner.clean(last);
                if (!cleaned.isEmpty()) {
                    return cleaned;
                }
            }
        }
        return null;
    }

    /**
     * First like count in the window after the link, if any.
     */
    static Integer popularityAfter(String raw, int linkEnd) {
        String window = raw.substring(linkEnd, Math.min(raw.length(), linkEnd + LOOK_AHEAD));
        for (Pattern pattern : POPULARITY_PATTERNS) {
            Matcher matcher = pattern.matcher(window);
            if (matcher.find()) {
                try {
                    return Integer.parseInt(matcher.group(1).replace(",", ""));
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }
}
