package com.agenttracker.discovery.exception;

public class DiscoveryNotFoundException extends DiscoveryServiceException {

    public DiscoveryNotFoundException(Long discoveryId) {
        super("DISCOVERY_NOT_FOUND", "Discovery not found: " + discoveryId);
    }
}
