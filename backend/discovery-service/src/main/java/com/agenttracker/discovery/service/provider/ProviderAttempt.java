package com.agenttracker.discovery.service.provider;

import java.util.concurrent.TimeoutException;

/**
 * Record of one provider tried for one query.
 */
public record ProviderAttempt(String provider, Outcome outcome, int itemCount, String message) {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        MALFORMED,
        EMPTY
    }

    public static ProviderAttempt succeeded(String provider, int itemCount) {
        return new ProviderAttempt(provider, Outcome.SUCCEEDED, itemCount, null);
    }

    public static ProviderAttempt empty(String provider) {
        return new ProviderAttempt(provider, Outcome.EMPTY, 0, "Provider completed without a result");
    }

    public static ProviderAttempt failed(String provider, Throwable error) {
        Outcome outcome;
        if (error instanceof TimeoutException) {
            outcome = Outcome.TIMED_OUT;
        } else if (error instanceof MalformedProviderOutputException) {
            outcome = Outcome.MALFORMED;
        } else {
            outcome = Outcome.FAILED;
        }
        return new ProviderAttempt(provider, outcome, 0, error.getMessage());
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCEEDED;
    }
}
