package com.agenttracker.discovery.repository;

import com.agenttracker.discovery.entity.discovery.Discovery;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Discovery entity.
 */
@Repository
public interface DiscoveryRepository extends JpaRepository<Discovery, Long> {

    /**
     * Find by identity key (hot path of the merge engine)
     */
    Optional<Discovery> findByProjectIdAndSource(Long projectId, String source);

    /**
     * Count discoveries created since the given time (hot path of the necessity check)
     */
    long countByProjectIdAndDiscoveredAtAfter(Long projectId, LocalDateTime since);

    List<Discovery> findTop10ByProjectIdAndDiscoveredAtAfterOrderByDiscoveredAtDesc(Long projectId, LocalDateTime since);

    List<Discovery> findTop5ByProjectIdAndUserFeedbackUsefulOrderByDiscoveredAtDesc(Long projectId, Boolean useful);

    // ============ Recommendations ============

    /**
     * Highest-scored visible discoveries not yet included in a recommendation digest
     */
    List<Discovery> findTop10ByProjectIdAndPresentedFalseAndHiddenFalseOrderByRelevanceScoreDesc(Long projectId);

    /**
     * Flag discoveries as presented. Bumps the version so a merge holding a stale copy retries
     * instead of writing the flag back.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE Discovery d SET d.presented = true, d.version = d.version + 1 WHERE d.id IN :ids")
    int markPresented(@Param("ids") List<Long> ids);

    // ============ Listing by review state ============

    Page<Discovery> findByProjectIdAndHiddenFalse(Long projectId, Pageable pageable);

    Page<Discovery> findByProjectIdAndViewedFalseAndHiddenFalse(Long projectId, Pageable pageable);

    Page<Discovery> findByProjectIdAndViewedTrueAndHiddenFalse(Long projectId, Pageable pageable);

    Page<Discovery> findByProjectIdAndHiddenTrue(Long projectId, Pageable pageable);

    Page<Discovery> findByProjectIdAndUserFeedbackUsefulAndHiddenFalse(Long projectId, Boolean useful, Pageable pageable);

    // ============ Counts ============

    long countByProjectIdAndHiddenFalse(Long projectId);

    long countByProjectIdAndViewedFalseAndHiddenFalse(Long projectId);

    long countByProjectIdAndViewedTrueAndHiddenFalse(Long projectId);

    long countByProjectIdAndHiddenTrue(Long projectId);

    long countByProjectIdAndUserFeedbackUsefulAndHiddenFalse(Long projectId, Boolean useful);

    // ============ Bulk targets ============

    @Query("SELECT d.id FROM Discovery d WHERE d.projectId = :projectId ORDER BY d.id")
    List<Long> findIdsByProjectId(@Param("projectId") Long projectId);

    @Query("""
            SELECT d.id FROM Discovery d
            WHERE d.projectId = :projectId
            AND d.viewed = false AND d.hidden = false
            ORDER BY d.id
            """)
    List<Long> findNewIdsByProjectId(@Param("projectId") Long projectId);

    @Query("""
            SELECT d.id FROM Discovery d
            WHERE d.projectId = :projectId
            AND d.viewed = true AND d.hidden = false
            ORDER BY d.id
            """)
    List<Long> findViewedIdsByProjectId(@Param("projectId") Long projectId);

    @Query("SELECT d.id FROM Discovery d WHERE d.projectId = :projectId AND d.hidden = true ORDER BY d.id")
    List<Long> findHiddenIdsByProjectId(@Param("projectId") Long projectId);
}
