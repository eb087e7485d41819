package com.agenttracker.discovery.controller;

import com.agenttracker.discovery.dto.RecommendationResponse;
import com.agenttracker.discovery.service.recommend.RecommendationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for project recommendations.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class RecommendationController {

    private final RecommendationService recommendationService;

    /**
     * Summary of the best discoveries not presented yet. Each call marks the returned ones presented.
     */
    @GetMapping("/projects/{projectId}/recommendations")
    public ResponseEntity<RecommendationResponse> getRecommendations(@PathVariable Long projectId) {
        log.debug("Recommendations requested: projectId={}", projectId);
        return ResponseEntity.ok(recommendationService.recommend(projectId));
    }
}
