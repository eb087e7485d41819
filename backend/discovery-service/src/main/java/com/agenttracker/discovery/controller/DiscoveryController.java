package com.agenttracker.discovery.controller;

import com.agenttracker.discovery.dto.BulkUpdateRequest;
import com.agenttracker.discovery.dto.BulkUpdateResult;
import com.agenttracker.discovery.dto.DiscoveryDto;
import com.agenttracker.discovery.dto.DiscoveryFilter;
import com.agenttracker.discovery.dto.DiscoveryListResponse;
import com.agenttracker.discovery.dto.DiscoverySort;
import com.agenttracker.discovery.dto.FeedbackRequest;
import com.agenttracker.discovery.service.DiscoveryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for reviewing discoveries.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DiscoveryController {

    private final DiscoveryService discoveryService;

    /**
     * List a project's discoveries with counts by review state.
     *
     * @param filter all, new, viewed, hidden, useful, not_useful
     * @param sort   relevance, date, feedback
     */
    @GetMapping("/projects/{projectId}/discoveries")
    public ResponseEntity<DiscoveryListResponse> listDiscoveries(
            @PathVariable Long projectId,
            @RequestParam(defaultValue = "all") String filter,
            @RequestParam(defaultValue = "relevance") String sort,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(discoveryService.listDiscoveries(
                projectId, DiscoveryFilter.fromParam(filter), DiscoverySort.fromParam(sort), page, size));
    }

    @GetMapping("/discoveries/{id}")
    public ResponseEntity<DiscoveryDto> getDiscovery(@PathVariable Long id) {
        return ResponseEntity.ok(discoveryService.getDiscovery(id));
    }

    @PutMapping("/discoveries/{id}/feedback")
    public ResponseEntity<DiscoveryDto> updateFeedback(
            @PathVariable Long id,
            @Valid @RequestBody FeedbackRequest request
    ) {
        return ResponseEntity.ok(discoveryService.updateFeedback(id, request));
    }

    @PutMapping("/discoveries/{id}/viewed")
    public ResponseEntity<DiscoveryDto> markViewed(@PathVariable Long id) {
        return ResponseEntity.ok(discoveryService.markViewed(id));
    }

    /**
     * Toggle hidden state
     */
    @PutMapping("/discoveries/{id}/hidden")
    public ResponseEntity<DiscoveryDto> toggleHidden(@PathVariable Long id) {
        return ResponseEntity.ok(discoveryService.toggleHidden(id));
    }

    @PostMapping("/projects/{projectId}/discoveries/bulk")
    public ResponseEntity<BulkUpdateResult> bulkUpdate(
            @PathVariable Long projectId,
            @Valid @RequestBody BulkUpdateRequest request
    ) {
        return ResponseEntity.ok(discoveryService.bulkUpdate(projectId, request));
    }
}
