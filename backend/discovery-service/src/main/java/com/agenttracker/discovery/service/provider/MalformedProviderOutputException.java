package com.agenttracker.discovery.service.provider;

/**
 * A provider answered, but nothing in the answer could be used as a candidate.
 */
public class MalformedProviderOutputException extends RuntimeException {

    public MalformedProviderOutputException(String message) {
        super(message);
    }

    public MalformedProviderOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
