package com.agenttracker.discovery.service.extract;

import java.util.List;
import java.util.Locale;

/**
 * Drops newsletter chrome: subscription prompts, social links, contact pages.
 */
public final class PromotionalFilter {

    static final List<String> STOPLIST = List.of(
            "signup", "sign up", "subscribe", "follow", "work with us", "join",
            "contact", "about us", "feedback", "view in browser", "advertise"
    );

    private PromotionalFilter() {
    }

    public static boolean isPromotional(String title) {
        if (title == null) {
            return true;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (String phrase : STOPLIST) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
