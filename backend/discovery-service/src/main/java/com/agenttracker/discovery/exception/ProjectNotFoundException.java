package com.agenttracker.discovery.exception;

public class ProjectNotFoundException extends DiscoveryServiceException {

    public ProjectNotFoundException(Long projectId) {
        super("PROJECT_NOT_FOUND", "Project not found: " + projectId);
    }
}
