package com.agenttracker.discovery.support;

import com.agenttracker.discovery.entity.discovery.Discovery;
import com.agenttracker.discovery.entity.discovery.UserFeedback;
import com.agenttracker.discovery.service.merge.DiscoveryStore;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * DiscoveryStore fake that enforces the (projectId, source) key and the entity version
 * the way the database does. Rows are copied in and out so callers cannot mutate them.
 */
public class InMemoryDiscoveryStore implements DiscoveryStore {

    private final Map<String, Discovery> rows = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final AtomicInteger writes = new AtomicInteger();
    private volatile Consumer<Discovery> beforeInsert = discovery -> { };

    @Override
    public Optional<Discovery> findByKey(Long projectId, String source) {
        return Optional.ofNullable(rows.get(key(projectId, source))).map(InMemoryDiscoveryStore::copy);
    }

    @Override
    public synchronized Discovery insert(Discovery discovery) {
        Consumer<Discovery> hook = beforeInsert;
        beforeInsert = d -> { };
        hook.accept(discovery);

        String key = key(discovery.getProjectId(), discovery.getSource());
        if (rows.containsKey(key)) {
            throw new DataIntegrityViolationException("duplicate key value violates unique constraint uk_discovery_project_source");
        }
        Discovery stored = copy(discovery);
        stored.setId(ids.incrementAndGet());
        stored.setVersion(0L);
        rows.put(key, stored);
        writes.incrementAndGet();
        return copy(stored);
    }

    @Override
    public synchronized Discovery update(Discovery discovery) {
        String key = key(discovery.getProjectId(), discovery.getSource());
        Discovery current = rows.get(key);
        if (current == null || !current.getVersion().equals(discovery.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(Discovery.class, discovery.getId());
        }
        Discovery stored = copy(discovery);
        stored.setVersion(current.getVersion() + 1);
        stored.setUpdatedAt(LocalDateTime.now());
        rows.put(key, stored);
        writes.incrementAndGet();
        return copy(stored);
    }

    @Override
    public long countDiscoveredSince(Long projectId, LocalDateTime since) {
        return rows.values().stream()
                .filter(d -> d.getProjectId().equals(projectId))
                .filter(d -> d.getDiscoveredAt() != null && !d.getDiscoveredAt().isBefore(since))
                .count();
    }

    /**
     * Store a row directly, bypassing the write counter.
     */
    public Discovery seed(Discovery discovery) {
        Discovery stored = copy(discovery);
        stored.setId(ids.incrementAndGet());
        stored.setVersion(0L);
        rows.put(key(stored.getProjectId(), stored.getSource()), stored);
        return copy(stored);
    }

    /**
     * Another writer inserts the same key right before the next insert lands.
     */
    public void simulateConcurrentInsert(Discovery competing) {
        beforeInsert = discovery -> seed(competing);
    }

    /**
     * Change a stored row behind the caller's back, bumping its version.
     */
    public void modifyConcurrently(Long projectId, String source, Consumer<Discovery> change) {
        rows.computeIfPresent(key(projectId, source), (k, row) -> {
            Discovery changed = copy(row);
            change.accept(changed);
            changed.setVersion(row.getVersion() + 1);
            return changed;
        });
    }

    public List<Discovery> all() {
        return rows.values().stream().map(InMemoryDiscoveryStore::copy).toList();
    }

    public int writeCount() {
        return writes.get();
    }

    private static String key(Long projectId, String source) {
        return projectId + "|" + source;
    }

    private static Discovery copy(Discovery d) {
        return d.toBuilder()
                .categories(d.getCategories() != null ? new ArrayList<>(d.getCategories()) : new ArrayList<>())
                .userFeedback(d.getUserFeedback() != null
                        ? new UserFeedback(d.getUserFeedback().getUseful(), d.getUserFeedback().getNotes(),
                        d.getUserFeedback().getRelevance())
                        : null)
                .build();
    }
}
