package com.agenttracker.discovery.service.extract;

import com.agenttracker.discovery.util.QuotedPrintable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based anchor scan. The pattern must expose the URL and the anchor text as groups.
 */
public class RegexAnchorStrategy implements LinkExtractionStrategy {

    /**
     * Anchors inside a quoted-printable body: {@code <a href=3D"https://...">Title</a>},
     * with double, single or no quotes.
     */
    public static RegexAnchorStrategy quotedPrintable() {
        return new RegexAnchorStrategy("qp-anchor",
                Pattern.compile("<a\\s[^>]*?href=3D([\"']?)(https?://[^\"'\\s>]+)\\1[^>]*>(.*?)</a>",
                        Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
                2, 3, true);
    }

    /**
     * Plain HTML anchors with any quoting style.
     */
    public static RegexAnchorStrategy html() {
        return new RegexAnchorStrategy("html-anchor",
                Pattern.compile("<a\\s[^>]*?href\\s*=\\s*([\"']?)(https?://[^\"'\\s>]+)\\1[^>]*>(.*?)</a>",
                        Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
                2, 3, false);
    }

    /**
     * {@code [Title](https://...)} links found in plain-text parts.
     */
    public static RegexAnchorStrategy markdown() {
        return new RegexAnchorStrategy("markdown-link",
                Pattern.compile("\\[([^\\]\\n]{2,300})\\]\\((https?://[^)\\s]+)\\)"),
                2, 1, false);
    }

    private final String name;
    private final Pattern pattern;
    private final int urlGroup;
    private final int titleGroup;
    private final boolean quotedPrintableInput;

    public RegexAnchorStrategy(String name, Pattern pattern, int urlGroup, int titleGroup, boolean quotedPrintableInput) {
        this.name = name;
        this.pattern = pattern;
        this.urlGroup = urlGroup;
        this.titleGroup = titleGroup;
        this.quotedPrintableInput = quotedPrintableInput;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<LinkTuple> extract(String raw) {
        List<LinkTuple> tuples = new ArrayList<>();
        if (raw == null || raw.isEmpty()) {
            return tuples;
        }
        String text = quotedPrintableInput ? QuotedPrintable.removeSoftBreaks(raw) : raw;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String url = matcher.group(urlGroup);
            String title = TextCleaner.clean(matcher.group(titleGroup));
            if (title.isEmpty() || url == null) {
                continue;
            }
            if (quotedPrintableInput) {
                url = QuotedPrintable.decode(url);
            }
            tuples.add(new LinkTuple(
                    title,
                    url,
                    LinkContextReader.descriptionAfter(text, matcher.end()),
                    LinkContextReader.categoryBefore(text, matcher.start()),
                    LinkContextReader.popularityAfter(text, matcher.end())
            ));
        }
        return tuples;
    }
}
