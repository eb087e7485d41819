package com.agenttracker.discovery.service.extract;

import com.agenttracker.discovery.util.QuotedPrintable;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loose title/description heuristics used when no link could be extracted.
 * Patterns are tried in order and the first one that yields entries wins.
 */
public final class FallbackSegmenter {

    private static final int MAX_DESCRIPTION = 500;

    private static final Pattern HEADING_PARAGRAPH = Pattern.compile(
            "<h3[^>]*>(.*?)</h3>.*?<p[^>]*>(.*?)</p>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    // Title line, description, then the like-counter arrow
    private static final Pattern TITLE_BEFORE_ARROW = Pattern.compile(
            "(?m)^([A-Z][^\\n]{2,200})\\n([^⇧]{10,1500}?)⇧");

    // Same shape on the raw body, terminated by a quoted-printable escape
    private static final Pattern TITLE_BEFORE_ESCAPE = Pattern.compile(
            "(?m)^([A-Z][^\\n]{2,200})\\r?\\n([^=]{10,1500}?)=");

    private static final Pattern NUMBERED_ITEM = Pattern.compile(
            "(?m)^\\s*\\d+\\.\\s+([^\\n]{3,200})(?:\\n([^\\n]{10,}))?");

    private static final Pattern EMOJI_BULLET = Pattern.compile(
            "(?:✅|💡|🚀|📌|🔥)\\s*([^:\\n]{3,120}):\\s*([^\\n]{10,})");

    // Title line followed by a paragraph that ends at a blank line
    private static final Pattern TITLE_PARAGRAPH = Pattern.compile(
            "(?m)^([A-Z][^\\n]{2,150})\\n(\\S[\\s\\S]{9,1500}?)(?:\\n\\s*\\n|\\z)");

    private static final Pattern BLOCK_END_TAG = Pattern.compile(
            "(?i)<br\\s*/?>|</p>|</div>|</h\\d>|</tr>|</li>");
    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern INLINE_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f]+");

    private FallbackSegmenter() {
    }

    public record Entry(String title, String description) {
    }

    public static List<Entry> segment(String raw, NewsletterFormat format) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String decoded = QuotedPrintable.decodeIfEncoded(raw);
        String text = toText(decoded);

        List<Entry> entries = collect(HEADING_PARAGRAPH, decoded);
        if (entries.isEmpty() && format == NewsletterFormat.SUPERHUMAN) {
            entries = collect(NUMBERED_ITEM, text);
            if (entries.isEmpty()) {
                entries = collect(EMOJI_BULLET, text);
            }
        }
        if (entries.isEmpty()) {
            entries = collect(TITLE_BEFORE_ARROW, text);
        }
        if (entries.isEmpty()) {
            entries = collect(TITLE_BEFORE_ESCAPE, TAG.matcher(raw).replaceAll(""));
        }
        if (entries.isEmpty()) {
            entries = collect(TITLE_PARAGRAPH, text);
        }
        return entries;
    }

    private static List<Entry> collect(Pattern pattern, String input) {
        List<Entry> entries = new ArrayList<>();
        Set<String> seenTitles = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(input);
        while (matcher.find()) {
            String title = TextCleaner.clean(matcher.group(1));
            String description = matcher.groupCount() >= 2 && matcher.group(2) != null
                    ? TextCleaner.clean(matcher.group(2))
                    : "";
            if (title.length() < 3 || PromotionalFilter.isPromotional(title) || !seenTitles.add(title)) {
                continue;
            }
            if (description.isEmpty()) {
                description = title;
            }
            entries.add(new Entry(title, TextCleaner.truncate(description, MAX_DESCRIPTION)));
        }
        return entries;
    }

    /**
     * HTML to text keeping block boundaries as line breaks.
     */
    static String toText(String html) {
        if (html.indexOf('<') < 0) {
            return html.replace("\r\n", "\n");
        }
        String withBreaks = BLOCK_END_TAG.matcher(html).replaceAll("\n");
        String noTags = TAG.matcher(withBreaks).replaceAll("");
        String unescaped = Parser.unescapeEntities(noTags, false).replace("\r\n", "\n");
        return INLINE_WHITESPACE.matcher(unescaped).replaceAll(" ")
                .replaceAll("(?m)^ +| +$", "");
    }
}
