package com.agenttracker.discovery.service.provider;

import com.agenttracker.discovery.client.OpenAICompatibleClient;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Context-aware search agent. Uses the project's domain, goals and interests
 * to steer an LLM towards resources that matter for this project.
 */
@Component
@Order(1)
@Slf4j
public class SpecializedAgentSearchProvider implements SearchProvider {

    private static final String SYSTEM_PROMPT = """
            You are a specialized research agent that finds online resources for a project.
            Only return resources you can cite with a real URL.
            Respond with a JSON object: {"results": [{"title": "...", "description": "...", \
            "source": "https://...", "type": "Article|Discussion|News|Research|Tool|Other", \
            "publicationDate": "YYYY-MM-DD or null"}]}
            """;

    private final OpenAICompatibleClient client;
    private final ResultListParser parser;

    public SpecializedAgentSearchProvider(OpenAICompatibleClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.parser = new ResultListParser(objectMapper);
    }

    @Override
    public String getName() {
        return "specialized-agent";
    }

    @Override
    public ProviderCapability getCapability() {
        return ProviderCapability.CONTEXT_AWARE;
    }

    @Override
    public boolean isAvailable() {
        return client.isEnabled();
    }

    @Override
    public Mono<List<CandidateItem>> search(String query, @Nullable ProjectContext context) {
        if (context == null) {
            return Mono.error(new IllegalArgumentException("Specialized agent search needs a project context"));
        }
        SearchStrategy strategy = SearchStrategy.forContext(context);
        log.debug("Specialized search for project {} using {} strategy", context.projectId(), strategy);

        return client.complete(SYSTEM_PROMPT, buildPrompt(query, context, strategy), true)
                .map(content -> parser.parse(content, query, getName()));
    }

    String buildPrompt(String query, ProjectContext context, SearchStrategy strategy) {
        return """
                Search for information about %s related to: %s.

                Project goals: %s
                Project interests: %s
                Current phase: %s (%d%% complete)

                %s

                Do not include any dates, years, or time references in your searches.
                Return up to 8 results.
                """.formatted(
                context.domain(),
                query,
                String.join(", ", context.goals()),
                String.join(", ", context.interests()),
                context.phase(),
                context.progressPercentage(),
                strategy.instruction());
    }
}
