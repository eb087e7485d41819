package com.agenttracker.discovery.controller;

import com.agenttracker.discovery.dto.SearchRunResponse;
import com.agenttracker.discovery.service.search.SearchRun;
import com.agenttracker.discovery.service.search.SearchRunRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST Controller for discovery search runs.
 * A trigger is accepted immediately; the run continues in the background.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class SearchController {

    private final SearchRunRegistry searchRunRegistry;

    /**
     * Trigger a discovery search for a project.
     */
    @PostMapping("/projects/{projectId}/search")
    public ResponseEntity<Map<String, Object>> triggerSearch(
            @PathVariable Long projectId,
            @RequestParam(defaultValue = "false") boolean force
    ) {
        log.info("Search triggered: projectId={}, force={}", projectId, force);
        SearchRun run = searchRunRegistry.submit(projectId, force);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", run.getId());
        body.put("projectId", projectId);
        body.put("status", run.getStatus().name());
        body.put("message", "Search triggered successfully");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/search-runs/{runId}")
    public ResponseEntity<SearchRunResponse> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(SearchRunResponse.from(searchRunRegistry.get(runId)));
    }

    @DeleteMapping("/search-runs/{runId}")
    public ResponseEntity<Void> cancelRun(@PathVariable String runId) {
        searchRunRegistry.cancel(runId);
        return ResponseEntity.noContent().build();
    }
}
