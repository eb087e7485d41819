package com.agenttracker.discovery.service.search;

import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic queries built from goal and interest combinations.
 * Used whenever the LLM generator is unavailable or returns nothing.
 */
@Component
public class TemplateQueryGenerator implements SearchQueryGenerator {

    @Override
    public Mono<List<String>> generate(ProjectContext context, int count) {
        return Mono.fromSupplier(() -> queriesFor(context, count));
    }

    public List<String> queriesFor(ProjectContext context, int count) {
        Set<String> queries = new LinkedHashSet<>();
        String domain = context.domain() != null && !context.domain().isBlank() ? context.domain().trim() : null;
        List<String> goals = context.goals();
        List<String> interests = context.interests();

        for (String goal : goals) {
            for (String interest : interests) {
                queries.add(goal + " " + interest);
            }
        }
        for (String interest : interests) {
            queries.add(domain != null ? interest + " " + domain : interest);
        }
        for (String goal : goals) {
            queries.add(domain != null ? goal + " " + domain : goal);
        }
        if (queries.isEmpty() && domain != null) {
            queries.add(domain);
            queries.add(domain + " best practices");
            queries.add(domain + " tools");
        }
        if (queries.isEmpty() && context.name() != null) {
            queries.add(context.name());
        }

        List<String> sanitized = QuerySanitizer.sanitizeAll(new ArrayList<>(queries));
        return sanitized.size() > count ? List.copyOf(sanitized.subList(0, count)) : sanitized;
    }
}
