package com.agenttracker.discovery.controller;

import com.agenttracker.discovery.service.newsletter.NewsletterImportResult;
import com.agenttracker.discovery.service.newsletter.NewsletterImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/projects/{projectId}/newsletters")
@RequiredArgsConstructor
@Slf4j
public class NewsletterImportController {

    private final NewsletterImportService newsletterImportService;

    /**
     * Import unread newsletters from the configured mailbox into the project
     */
    @PostMapping("/import")
    public ResponseEntity<NewsletterImportResult> importNewsletters(@PathVariable Long projectId) {
        log.info("Newsletter import requested: projectId={}", projectId);
        return ResponseEntity.ok(newsletterImportService.importForProject(projectId));
    }
}
