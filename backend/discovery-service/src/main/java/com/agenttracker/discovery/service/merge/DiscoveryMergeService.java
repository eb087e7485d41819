package com.agenttracker.discovery.service.merge;

import com.agenttracker.discovery.config.PipelineProperties;
import com.agenttracker.discovery.dto.pipeline.ClassifiedItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.entity.discovery.Discovery;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Dedup & Merge Engine.
 *
 * Writes classified items into the discovery store, one (projectId, source)
 * key at a time. Within this JVM a striped lock serializes work on a key;
 * across instances the unique key and the entity version act as
 * compare-and-swap, and a lost race is retried by re-reading and re-merging.
 */
@Service
@Slf4j
public class DiscoveryMergeService {

    static final int MAX_ATTEMPTS = 3;
    private static final int LOCK_STRIPES = 64;

    private final DiscoveryStore store;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public DiscoveryMergeService(DiscoveryStore store, PipelineProperties properties, MeterRegistry meterRegistry) {
        this(store, properties, meterRegistry, Clock.systemDefaultZone());
    }

    DiscoveryMergeService(DiscoveryStore store, PipelineProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Merge a batch of classified items for one project.
     * Items below the relevance threshold are dropped without a write.
     */
    public MergeSummary mergeAll(ProjectContext context, List<ClassifiedItem> items) {
        if (items == null || items.isEmpty()) {
            return MergeSummary.empty();
        }
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        int belowThreshold = 0;
        int failed = 0;
        List<Discovery> touched = new ArrayList<>();

        for (ClassifiedItem item : items) {
            if (item.getRelevanceScore() < properties.getRelevanceThreshold()) {
                belowThreshold++;
                count("below_threshold");
                log.debug("Discarding {} with score {} below threshold {}",
                        item.getSource(), item.getRelevanceScore(), properties.getRelevanceThreshold());
                continue;
            }
            try {
                MergeOutcome outcome = merge(context, item);
                switch (outcome.decision()) {
                    case INSERT -> inserted++;
                    case UPDATE -> updated++;
                    case NOOP -> unchanged++;
                }
                if (outcome.discovery() != null) {
                    touched.add(outcome.discovery());
                }
                count(outcome.decision().name().toLowerCase(Locale.ROOT));
            } catch (MergeConflictException e) {
                failed++;
                count("conflict");
                log.warn("Giving up on merge: projectId={}, source={}, error={}",
                        context.projectId(), item.getSource(), e.getMessage());
            }
        }

        log.info("Merge finished: projectId={}, inserted={}, updated={}, unchanged={}, belowThreshold={}, failed={}",
                context.projectId(), inserted, updated, unchanged, belowThreshold, failed);
        return new MergeSummary(inserted, updated, unchanged, belowThreshold, failed, List.copyOf(touched));
    }

    /**
     * Merge one item under its key lock, retrying lost races.
     */
    MergeOutcome merge(ProjectContext context, ClassifiedItem item) {
        ReentrantLock lock = lockFor(context.projectId(), item.getSource());
        lock.lock();
        try {
            RuntimeException lastConflict = null;
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                try {
                    return mergeOnce(context, item);
                } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
                    lastConflict = e;
                    log.debug("Merge conflict on {} (attempt {}/{}): {}",
                            item.getSource(), attempt, MAX_ATTEMPTS, e.getMessage());
                }
            }
            throw new MergeConflictException(
                    "Merge of " + item.getSource() + " lost " + MAX_ATTEMPTS + " races", lastConflict);
        } finally {
            lock.unlock();
        }
    }

    private MergeOutcome mergeOnce(ProjectContext context, ClassifiedItem item) {
        Optional<Discovery> existing = store.findByKey(context.projectId(), item.getSource());
        MergeDecision decision = DiscoveryMergePolicy.decide(existing.orElse(null), item);
        return switch (decision) {
            case INSERT -> new MergeOutcome(decision,
                    store.insert(DiscoveryMergePolicy.newDiscovery(context, item, LocalDateTime.now(clock))));
            case UPDATE -> {
                Discovery discovery = existing.get();
                DiscoveryMergePolicy.applyUpdate(discovery, item);
                yield new MergeOutcome(decision, store.update(discovery));
            }
            case NOOP -> new MergeOutcome(decision, null);
        };
    }

    private ReentrantLock lockFor(Long projectId, String source) {
        int hash = (projectId + "|" + source).hashCode();
        return locks[Math.floorMod(hash, LOCK_STRIPES)];
    }

    private void count(String result) {
        meterRegistry.counter("discovery.merge", "result", result).increment();
    }

    record MergeOutcome(MergeDecision decision, Discovery discovery) {
    }

    static class MergeConflictException extends RuntimeException {
        MergeConflictException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
