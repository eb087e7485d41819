package com.agenttracker.discovery.repository;

import com.agenttracker.discovery.entity.project.ProjectContextEntry;
import com.agenttracker.discovery.entity.project.ProjectContextEntry.EntryType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectContextEntryRepository extends JpaRepository<ProjectContextEntry, Long> {

    List<ProjectContextEntry> findTop5ByProjectIdOrderByCreatedAtDesc(Long projectId);

    List<ProjectContextEntry> findTop5ByProjectIdAndEntryTypeOrderByCreatedAtDesc(Long projectId, EntryType entryType);
}
