package com.agenttracker.discovery.service.merge;

import com.agenttracker.discovery.entity.discovery.Discovery;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Persistence the merge engine and the orchestrator need.
 * {@link #insert} must reject a second discovery for the same (projectId, source)
 * and {@link #update} must reject a stale version.
 */
public interface DiscoveryStore {

    Optional<Discovery> findByKey(Long projectId, String source);

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when the key already exists
     */
    Discovery insert(Discovery discovery);

    /**
     * @throws org.springframework.dao.OptimisticLockingFailureException when the row changed since it was read
     */
    Discovery update(Discovery discovery);

    long countDiscoveredSince(Long projectId, LocalDateTime since);
}
