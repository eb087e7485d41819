package com.agenttracker.discovery.service.search;

import com.agenttracker.discovery.client.OpenAICompatibleClient;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.entity.discovery.Discovery;
import com.agenttracker.discovery.entity.project.ProjectContextEntry;
import com.agenttracker.discovery.repository.DiscoveryRepository;
import com.agenttracker.discovery.repository.ProjectContextEntryRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Feedback-aware query generation.
 * Asks the LLM for queries informed by the project's goals, recent context and
 * what the user found useful or not; falls back to {@link TemplateQueryGenerator}.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmSearchQueryGenerator implements SearchQueryGenerator {

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    private static final String SYSTEM_PROMPT = """
            You write web search queries that find resources useful for a project.
            Respond only with a JSON object: {"queries": ["...", "..."]}
            Do not include any dates, years, or words like "latest" or "recent".
            """;

    private final OpenAICompatibleClient client;
    private final TemplateQueryGenerator templateGenerator;
    private final DiscoveryRepository discoveryRepository;
    private final ProjectContextEntryRepository contextEntryRepository;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<List<String>> generate(ProjectContext context, int count) {
        if (!client.isEnabled()) {
            log.debug("No LLM configured, using template queries for project {}", context.projectId());
            return templateGenerator.generate(context, count);
        }
        return Mono.fromCallable(() -> buildPrompt(context, count))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(prompt -> client.complete(SYSTEM_PROMPT, prompt, true))
                .map(this::parseQueries)
                .map(QuerySanitizer::sanitizeAll)
                .map(queries -> queries.size() > count ? List.copyOf(queries.subList(0, count)) : queries)
                .filter(queries -> !queries.isEmpty())
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("LLM returned no usable queries for project {}, using templates", context.projectId());
                    return templateGenerator.generate(context, count);
                }))
                .onErrorResume(e -> {
                    log.warn("Query generation failed for project {}, using templates: {}",
                            context.projectId(), e.getMessage());
                    return templateGenerator.generate(context, count);
                });
    }

    String buildPrompt(ProjectContext context, int count) {
        StringBuilder prompt = new StringBuilder()
                .append("Generate ").append(count).append(" search queries for this project.\n\n")
                .append("Project: ").append(context.name()).append('\n')
                .append("Domain: ").append(context.domain()).append('\n')
                .append("Goals: ").append(String.join(", ", context.goals())).append('\n')
                .append("Interests: ").append(String.join(", ", context.interests())).append('\n')
                .append("Current phase: ").append(context.phase())
                .append(" (").append(context.progressPercentage()).append("% complete)\n");

        List<ProjectContextEntry> recent = contextEntryRepository.findTop5ByProjectIdOrderByCreatedAtDesc(context.projectId());
        if (!recent.isEmpty()) {
            prompt.append("\nRecent project context:\n");
            recent.forEach(entry -> prompt.append("- ").append(entry.getContent()).append('\n'));
        }

        List<Discovery> useful = discoveryRepository
                .findTop5ByProjectIdAndUserFeedbackUsefulOrderByDiscoveredAtDesc(context.projectId(), true);
        if (!useful.isEmpty()) {
            prompt.append("\nThe user found these useful, find more like them:\n");
            useful.forEach(d -> prompt.append("- ").append(d.getTitle()).append('\n'));
        }

        List<Discovery> notUseful = discoveryRepository
                .findTop5ByProjectIdAndUserFeedbackUsefulOrderByDiscoveredAtDesc(context.projectId(), false);
        if (!notUseful.isEmpty()) {
            prompt.append("\nThe user did not find these useful, avoid similar results:\n");
            notUseful.forEach(d -> prompt.append("- ").append(d.getTitle()).append('\n'));
        }
        return prompt.toString();
    }

    /**
     * {"queries": [...]} first, any quoted strings otherwise.
     */
    List<String> parseQueries(String content) {
        List<String> queries = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return queries;
        }
        try {
            JsonNode root = objectMapper.readTree(content.trim());
            JsonNode list = root.isArray() ? root : root.path("queries");
            if (list.isArray()) {
                list.forEach(node -> {
                    if (node.isTextual()) {
                        queries.add(node.asText());
                    }
                });
                return queries;
            }
        } catch (Exception e) {
            log.debug("Query answer is not JSON, salvaging quoted strings: {}", e.getMessage());
        }
        Matcher matcher = QUOTED.matcher(content);
        while (matcher.find()) {
            String value = matcher.group(1);
            if (!"queries".equals(value)) {
                queries.add(value);
            }
        }
        return queries;
    }
}
