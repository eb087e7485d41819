package com.agenttracker.discovery.service.classify;

import com.agenttracker.discovery.client.OpenAICompatibleClient;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * LLM-backed relevance classifier.
 */
@Component
@RequiredArgsConstructor
public class LlmRelevanceClassifier implements RelevanceClassifier {

    private static final String SYSTEM_PROMPT = """
            You are an expert at judging how relevant a resource is to a project.
            Respond only with a JSON object:
            {"relevanceScore": <integer 1-10>, "categories": ["..."], \
            "type": "Article|Discussion|News|Research|Tool|Other", "reasoning": "..."}
            Choose the type from what the resource actually is. Do not default to Article.
            """;

    private final OpenAICompatibleClient client;

    @Override
    public Mono<String> classifyRaw(CandidateItem item, ProjectContext context) {
        return client.complete(SYSTEM_PROMPT, buildPrompt(item, context), true);
    }

    String buildPrompt(CandidateItem item, ProjectContext context) {
        StringBuilder prompt = new StringBuilder()
                .append("Project: ").append(context.name()).append('\n')
                .append("Domain: ").append(context.domain()).append('\n')
                .append("Goals: ").append(String.join(", ", context.goals())).append('\n')
                .append("Interests: ").append(String.join(", ", context.interests())).append('\n')
                .append("Phase: ").append(context.phase()).append('\n')
                .append('\n')
                .append("Resource title: ").append(item.getTitle()).append('\n')
                .append("Resource description: ").append(item.getDescription()).append('\n')
                .append("Resource URL: ").append(item.getSource()).append('\n');
        if (item.getCategoryHint() != null) {
            prompt.append("Listed under: ").append(item.getCategoryHint()).append('\n');
        }
        return prompt.append('\n')
                .append("How relevant is this resource to the project?")
                .toString();
    }
}
