package com.agenttracker.discovery.service.extract;

/**
 * Title/URL pair found in a content unit, with optional hints read around the link.
 */
public record LinkTuple(String title, String url, String description, String category, Integer popularity) {

    public LinkTuple(String title, String url) {
        this(title, url, null, null, null);
    }

    public LinkTuple withUrl(String newUrl) {
        return new LinkTuple(title, newUrl, description, category, popularity);
    }
}
