package com.agenttracker.discovery.service.extract;

import java.util.List;

/**
 * One way of pulling title/URL pairs out of raw text. Implementations are pure
 * and must return an empty list rather than throw on input they do not understand.
 */
public interface LinkExtractionStrategy {

    String name();

    List<LinkTuple> extract(String raw);
}
