package com.agenttracker.discovery.service.search;

import com.agenttracker.discovery.client.OpenAICompatibleClient;
import com.agenttracker.discovery.config.PipelineProperties;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.dto.pipeline.SearchNecessityDecision;
import com.agenttracker.discovery.entity.discovery.Discovery;
import com.agenttracker.discovery.entity.project.ProjectContextEntry;
import com.agenttracker.discovery.entity.project.ProjectContextEntry.EntryType;
import com.agenttracker.discovery.repository.DiscoveryRepository;
import com.agenttracker.discovery.repository.ProjectContextEntryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Asks the LLM whether the user's latest answers change what the project needs.
 * Errors surface to the caller, which decides to search anyway.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmSearchNecessityEvaluator implements SearchNecessityEvaluator {

    private static final String SYSTEM_PROMPT = """
            You decide whether a project needs a fresh search for resources.
            A new search is needed when the user's recent responses reveal new needs,
            a change of direction, or problems the recent results do not cover.
            Respond only with a JSON object: {"shouldSearch": true|false, "reason": "..."}
            """;

    private final OpenAICompatibleClient client;
    private final DiscoveryRepository discoveryRepository;
    private final ProjectContextEntryRepository contextEntryRepository;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<SearchNecessityDecision> evaluate(ProjectContext context) {
        if (!client.isEnabled()) {
            return Mono.error(new IllegalStateException("No LLM configured for the necessity check"));
        }
        return Mono.fromCallable(() -> buildPrompt(context))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(prompt -> client.complete(SYSTEM_PROMPT, prompt, true))
                .map(this::parseDecision);
    }

    String buildPrompt(ProjectContext context) {
        LocalDateTime since = LocalDateTime.now().minus(properties.getNecessityLookback());
        List<ProjectContextEntry> responses = contextEntryRepository
                .findTop5ByProjectIdAndEntryTypeOrderByCreatedAtDesc(context.projectId(), EntryType.USER_RESPONSE);
        List<Discovery> recent = discoveryRepository
                .findTop10ByProjectIdAndDiscoveredAtAfterOrderByDiscoveredAtDesc(context.projectId(), since);

        StringBuilder prompt = new StringBuilder()
                .append("Project: ").append(context.name()).append('\n')
                .append("Goals: ").append(String.join(", ", context.goals())).append('\n')
                .append("Interests: ").append(String.join(", ", context.interests())).append("\n\n")
                .append("Recent user responses:\n");
        if (responses.isEmpty()) {
            prompt.append("- (none)\n");
        }
        responses.forEach(entry -> prompt.append("- ").append(entry.getContent()).append('\n'));

        prompt.append("\nResources found recently:\n");
        if (recent.isEmpty()) {
            prompt.append("- (none)\n");
        }
        recent.forEach(d -> prompt.append("- ").append(d.getTitle()).append('\n'));
        return prompt.append("\nIs a new search needed?").toString();
    }

    SearchNecessityDecision parseDecision(String content) {
        try {
            JsonNode root = objectMapper.readTree(content.trim());
            JsonNode shouldSearch = root.get("shouldSearch");
            if (shouldSearch == null || !shouldSearch.isBoolean()) {
                throw new IllegalArgumentException("Necessity answer has no shouldSearch flag");
            }
            String reason = root.path("reason").asText("");
            return shouldSearch.asBoolean()
                    ? SearchNecessityDecision.search(reason)
                    : SearchNecessityDecision.skip(reason);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Necessity answer is not JSON: " + e.getOriginalMessage(), e);
        }
    }
}
