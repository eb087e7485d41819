package com.agenttracker.discovery.exception;

/**
 * Base class for discovery service errors
 */
public class DiscoveryServiceException extends RuntimeException {

    private final String errorCode;

    public DiscoveryServiceException(String message) {
        super(message);
        this.errorCode = "DISCOVERY_ERROR";
    }

    public DiscoveryServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DiscoveryServiceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
