package com.agenttracker.discovery.service;

import com.agenttracker.discovery.dto.BulkUpdateRequest;
import com.agenttracker.discovery.dto.BulkUpdateRequest.BulkAction;
import com.agenttracker.discovery.dto.BulkUpdateResult;
import com.agenttracker.discovery.dto.DiscoveryCounts;
import com.agenttracker.discovery.dto.DiscoveryDto;
import com.agenttracker.discovery.dto.DiscoveryFilter;
import com.agenttracker.discovery.dto.DiscoveryListResponse;
import com.agenttracker.discovery.dto.DiscoverySort;
import com.agenttracker.discovery.dto.FeedbackRequest;
import com.agenttracker.discovery.dto.PageResponse;
import com.agenttracker.discovery.entity.discovery.Discovery;
import com.agenttracker.discovery.entity.project.ProjectContextEntry;
import com.agenttracker.discovery.exception.DiscoveryNotFoundException;
import com.agenttracker.discovery.exception.ProjectNotFoundException;
import com.agenttracker.discovery.repository.DiscoveryRepository;
import com.agenttracker.discovery.repository.ProjectContextEntryRepository;
import com.agenttracker.discovery.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Discovery Lifecycle Store.
 *
 * Review state of stored discoveries: listing by state, viewed marking,
 * hiding, feedback and bulk actions. Discoveries are never deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscoveryService {

    private static final int MAX_PAGE_SIZE = 100;

    private final DiscoveryRepository discoveryRepository;
    private final ProjectRepository projectRepository;
    private final ProjectContextEntryRepository contextEntryRepository;

    // ============ Queries ============

    @Transactional(readOnly = true)
    public DiscoveryListResponse listDiscoveries(Long projectId, DiscoveryFilter filter, DiscoverySort sort,
                                                 int page, int size) {
        requireProject(projectId);
        DiscoveryFilter effectiveFilter = filter != null ? filter : DiscoveryFilter.ALL;
        DiscoverySort effectiveSort = sort != null ? sort : DiscoverySort.RELEVANCE;
        Pageable pageable = PageRequest.of(Math.max(0, page), Math.max(1, Math.min(size, MAX_PAGE_SIZE)),
                effectiveSort.toSort());

        Page<Discovery> result = switch (effectiveFilter) {
            case ALL -> discoveryRepository.findByProjectIdAndHiddenFalse(projectId, pageable);
            case NEW -> discoveryRepository.findByProjectIdAndViewedFalseAndHiddenFalse(projectId, pageable);
            case VIEWED -> discoveryRepository.findByProjectIdAndViewedTrueAndHiddenFalse(projectId, pageable);
            case HIDDEN -> discoveryRepository.findByProjectIdAndHiddenTrue(projectId, pageable);
            case USEFUL -> discoveryRepository.findByProjectIdAndUserFeedbackUsefulAndHiddenFalse(projectId, true, pageable);
            case NOT_USEFUL -> discoveryRepository.findByProjectIdAndUserFeedbackUsefulAndHiddenFalse(projectId, false, pageable);
        };

        return new DiscoveryListResponse(PageResponse.from(result, DiscoveryDto::fromEntity), countsFor(projectId));
    }

    @Transactional(readOnly = true)
    public DiscoveryCounts countsFor(Long projectId) {
        return new DiscoveryCounts(
                discoveryRepository.countByProjectIdAndHiddenFalse(projectId),
                discoveryRepository.countByProjectIdAndViewedFalseAndHiddenFalse(projectId),
                discoveryRepository.countByProjectIdAndViewedTrueAndHiddenFalse(projectId),
                discoveryRepository.countByProjectIdAndHiddenTrue(projectId),
                discoveryRepository.countByProjectIdAndUserFeedbackUsefulAndHiddenFalse(projectId, true),
                discoveryRepository.countByProjectIdAndUserFeedbackUsefulAndHiddenFalse(projectId, false)
        );
    }

    /**
     * Opening a discovery marks it viewed.
     */
    @Transactional
    public DiscoveryDto getDiscovery(Long id) {
        Discovery discovery = findOrThrow(id);
        if (!discovery.isViewed()) {
            discovery.markViewed(LocalDateTime.now());
            discovery = discoveryRepository.save(discovery);
        }
        return DiscoveryDto.fromEntity(discovery);
    }

    // ============ Review state ============

    @Transactional
    public DiscoveryDto markViewed(Long id) {
        Discovery discovery = findOrThrow(id);
        discovery.markViewed(LocalDateTime.now());
        return DiscoveryDto.fromEntity(discoveryRepository.save(discovery));
    }

    @Transactional
    public DiscoveryDto toggleHidden(Long id) {
        Discovery discovery = findOrThrow(id);
        discovery.toggleHidden();
        log.info("Discovery {} is now {}", id, discovery.isHidden() ? "hidden" : "visible");
        return DiscoveryDto.fromEntity(discoveryRepository.save(discovery));
    }

    @Transactional
    public DiscoveryDto setHidden(Long id, boolean hidden) {
        Discovery discovery = findOrThrow(id);
        if (hidden) {
            discovery.hide();
        } else {
            discovery.unhide();
        }
        return DiscoveryDto.fromEntity(discoveryRepository.save(discovery));
    }

    /**
     * Merge the given feedback fields and record the verdict in the project context,
     * where the query generator picks it up.
     */
    @Transactional
    public DiscoveryDto updateFeedback(Long id, FeedbackRequest request) {
        Discovery discovery = findOrThrow(id);
        discovery.applyFeedback(request.useful(), request.notes(), request.relevance(), LocalDateTime.now());
        Discovery saved = discoveryRepository.save(discovery);

        if (request.useful() != null) {
            contextEntryRepository.save(ProjectContextEntry.feedback(
                    saved.getProjectId(), saved.getId(), saved.getTitle(), request.useful(), request.notes()));
        }
        log.info("Feedback recorded: discoveryId={}, useful={}, relevance={}", id, request.useful(), request.relevance());
        return DiscoveryDto.fromEntity(saved);
    }

    // ============ Bulk ============

    /**
     * Apply one action to many discoveries. Each discovery is saved on its own,
     * so one failure does not roll back the others.
     */
    public BulkUpdateResult bulkUpdate(Long projectId, BulkUpdateRequest request) {
        requireProject(projectId);
        if (request.action() == null) {
            throw new IllegalArgumentException("Bulk action is required");
        }
        List<Long> targetIds = request.hasIds() ? request.ids() : idsForFilter(projectId, request.filter());

        LocalDateTime now = LocalDateTime.now();
        List<Long> failedIds = new ArrayList<>();
        int succeeded = 0;
        for (Long id : targetIds) {
            try {
                Optional<Discovery> found = discoveryRepository.findById(id);
                if (found.isEmpty() || !projectId.equals(found.get().getProjectId())) {
                    failedIds.add(id);
                    continue;
                }
                Discovery discovery = found.get();
                apply(discovery, request.action(), now);
                discoveryRepository.save(discovery);
                succeeded++;
            } catch (DataAccessException e) {
                log.warn("Bulk {} failed for discovery {}: {}", request.action(), id, e.getMessage());
                failedIds.add(id);
            }
        }

        log.info("Bulk update finished: projectId={}, action={}, requested={}, succeeded={}, failed={}",
                projectId, request.action(), targetIds.size(), succeeded, failedIds.size());
        return new BulkUpdateResult(targetIds.size(), succeeded, failedIds.size(), failedIds);
    }

    private List<Long> idsForFilter(Long projectId, DiscoveryFilter filter) {
        DiscoveryFilter effective = filter != null ? filter : DiscoveryFilter.ALL;
        return switch (effective) {
            case ALL -> discoveryRepository.findIdsByProjectId(projectId);
            case NEW -> discoveryRepository.findNewIdsByProjectId(projectId);
            case VIEWED -> discoveryRepository.findViewedIdsByProjectId(projectId);
            case HIDDEN -> discoveryRepository.findHiddenIdsByProjectId(projectId);
            default -> throw new IllegalArgumentException("Bulk updates support NEW, VIEWED, HIDDEN or ALL, not " + effective);
        };
    }

    private static void apply(Discovery discovery, BulkAction action, LocalDateTime now) {
        switch (action) {
            case MARK_VIEWED -> discovery.markViewed(now);
            case HIDE -> discovery.hide();
            case UNHIDE -> discovery.unhide();
        }
    }

    private Discovery findOrThrow(Long id) {
        return discoveryRepository.findById(id)
                .orElseThrow(() -> new DiscoveryNotFoundException(id));
    }

    private void requireProject(Long projectId) {
        if (!projectRepository.existsById(projectId)) {
            throw new ProjectNotFoundException(projectId);
        }
    }
}
