package com.agenttracker.discovery.service.extract;

import java.util.List;
import java.util.Locale;

/**
 * Known newsletter layouts. Each declares its section boundaries in reading order.
 */
public enum NewsletterFormat {

    ALPHA_SIGNAL("alphasignal", List.of(
            new SectionBoundary("topNews", "TOP NEWS", List.of("TRENDING SIGNALS")),
            new SectionBoundary("trendingSignals", "TRENDING SIGNALS", List.of("TOP TUTORIALS")),
            new SectionBoundary("topTutorials", "TOP TUTORIALS", List.of("HOW TO")),
            new SectionBoundary("howTo", "HOW TO", List.of("How was today's email?"))
    )),

    SUPERHUMAN("joinsuperhuman", List.of(
            new SectionBoundary("todayInAi", "TODAY IN AI", List.of("FROM THE FRONTIER", "PRESENTED BY")),
            new SectionBoundary("fromTheFrontier", "FROM THE FRONTIER", List.of("THE AI ACADEMY", "PRESENTED BY")),
            new SectionBoundary("aiTechNews", "AI & TECH NEWS", List.of("PRODUCTIVITY", "PRESENTED BY")),
            new SectionBoundary("productivity", "PRODUCTIVITY", List.of("PROMPT OF THE DAY", "SOCIAL SIGNALS")),
            new SectionBoundary("socialSignals", "SOCIAL SIGNALS", List.of("AI-GENERATED IMAGES"))
    )),

    GENERIC(null, List.of());

    private final String senderDomainHint;
    private final List<SectionBoundary> sections;

    NewsletterFormat(String senderDomainHint, List<SectionBoundary> sections) {
        this.senderDomainHint = senderDomainHint;
        this.sections = sections;
    }

    public List<SectionBoundary> sections() {
        return sections;
    }

    /**
     * Resolve the layout from a sender address; unknown senders are GENERIC.
     */
    public static NewsletterFormat fromSender(String sender) {
        if (sender == null) {
            return GENERIC;
        }
        String lower = sender.toLowerCase(Locale.ROOT);
        for (NewsletterFormat format : values()) {
            if (format.senderDomainHint != null && lower.contains(format.senderDomainHint)) {
                return format;
            }
        }
        return GENERIC;
    }
}
