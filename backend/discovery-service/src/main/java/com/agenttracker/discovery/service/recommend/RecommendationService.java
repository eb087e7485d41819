package com.agenttracker.discovery.service.recommend;

import com.agenttracker.discovery.client.OpenAICompatibleClient;
import com.agenttracker.discovery.dto.DiscoveryDto;
import com.agenttracker.discovery.dto.RecommendationResponse;
import com.agenttracker.discovery.dto.RecommendationResponse.SummaryGenerator;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.entity.discovery.Discovery;
import com.agenttracker.discovery.exception.ProjectNotFoundException;
import com.agenttracker.discovery.repository.DiscoveryRepository;
import com.agenttracker.discovery.repository.ProjectRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Summarizes a project's best discoveries that the user has not been shown yet,
 * then flags them as presented so the next digest only covers newer finds.
 *
 * The LLM writes the summary when one is configured. Without it, or when the
 * completion fails, a plain digest of titles and scores is returned instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationService {

    private static final String SYSTEM_PROMPT =
            "You are an assistant that summarizes recent discoveries related to a project in %s.";

    private final ProjectRepository projectRepository;
    private final DiscoveryRepository discoveryRepository;
    private final OpenAICompatibleClient client;
    private final MeterRegistry meterRegistry;

    /**
     * @throws ProjectNotFoundException when the project does not exist
     */
    public RecommendationResponse recommend(Long projectId) {
        ProjectContext context = projectRepository.findById(projectId)
                .map(ProjectContext::from)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));

        List<Discovery> pending = discoveryRepository
                .findTop10ByProjectIdAndPresentedFalseAndHiddenFalseOrderByRelevanceScoreDesc(projectId);
        if (pending.isEmpty()) {
            log.info("No unpresented discoveries: projectId={}", projectId);
            return RecommendationResponse.empty();
        }

        Summary summary = summarize(context, pending).block();

        int marked = discoveryRepository.markPresented(pending.stream().map(Discovery::getId).toList());
        pending.forEach(Discovery::markPresented);
        meterRegistry.counter("discovery.recommendations", "generator", summary.generator().name()).increment();
        log.info("Recommendations generated: projectId={}, discoveries={}, marked={}, generator={}",
                projectId, pending.size(), marked, summary.generator());

        return new RecommendationResponse(
                "Recommendations generated successfully",
                summary.text(),
                summary.generator(),
                pending.stream().map(DiscoveryDto::fromEntity).toList());
    }

    Mono<Summary> summarize(ProjectContext context, List<Discovery> discoveries) {
        Summary digest = new Summary(digest(context, discoveries), SummaryGenerator.DIGEST);
        if (!client.isEnabled()) {
            return Mono.just(digest);
        }
        String domain = context.domain() != null ? context.domain() : "general";
        return client.complete(SYSTEM_PROMPT.formatted(domain), buildPrompt(context, discoveries), false)
                .map(String::trim)
                .filter(text -> !text.isEmpty())
                .map(text -> new Summary(text, SummaryGenerator.LLM))
                .defaultIfEmpty(digest)
                .onErrorResume(e -> {
                    log.warn("Summary completion failed for project {}, returning digest: {}",
                            context.projectId(), e.getMessage());
                    return Mono.just(digest);
                });
    }

    String buildPrompt(ProjectContext context, List<Discovery> discoveries) {
        StringBuilder prompt = new StringBuilder()
                .append("Generate a summary of these recent discoveries for a project with the following goals: ")
                .append(String.join(", ", context.goals()))
                .append(" and interests: ")
                .append(String.join(", ", context.interests()))
                .append(".\n\nDiscoveries:\n");
        for (Discovery d : discoveries) {
            prompt.append("- ").append(d.getTitle());
            if (d.getDescription() != null && !d.getDescription().isBlank()) {
                prompt.append(": ").append(d.getDescription());
            }
            prompt.append(" (Relevance: ").append(d.getRelevanceScore()).append("/10)\n");
        }
        return prompt.append("\nProvide a concise summary highlighting the most relevant findings ")
                .append("and explaining why they matter to this project.")
                .toString();
    }

    static String digest(ProjectContext context, List<Discovery> discoveries) {
        StringBuilder text = new StringBuilder()
                .append(discoveries.size())
                .append(discoveries.size() == 1 ? " new discovery" : " new discoveries")
                .append(" for ").append(context.name()).append(":\n");
        for (Discovery d : discoveries) {
            text.append("- ").append(d.getTitle() != null ? d.getTitle() : d.getSource())
                    .append(" (").append(d.getRelevanceScore()).append("/10)\n");
        }
        return text.toString().trim();
    }

    record Summary(String text, SummaryGenerator generator) {
    }
}
