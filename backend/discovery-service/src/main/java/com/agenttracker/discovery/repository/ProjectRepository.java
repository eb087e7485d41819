package com.agenttracker.discovery.repository;

import com.agenttracker.discovery.entity.project.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Repository for Project entity.
 * Projects are managed elsewhere; this service only refreshes lastUpdated.
 */
@Repository
public interface ProjectRepository extends JpaRepository<Project, Long> {

    /**
     * Update last updated timestamp
     */
    @Modifying
    @Transactional
    @Query("UPDATE Project p SET p.lastUpdated = :timestamp WHERE p.id = :id")
    int updateLastUpdated(@Param("id") Long id, @Param("timestamp") LocalDateTime timestamp);
}
