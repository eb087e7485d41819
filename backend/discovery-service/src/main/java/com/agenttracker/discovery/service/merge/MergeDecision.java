package com.agenttracker.discovery.service.merge;

/**
 * What the merge policy decided for one classified item.
 */
public enum MergeDecision {
    /** No discovery with this key yet */
    INSERT,
    /** Incoming item scored higher than the stored one */
    UPDATE,
    /** Stored discovery already at least as relevant */
    NOOP
}
