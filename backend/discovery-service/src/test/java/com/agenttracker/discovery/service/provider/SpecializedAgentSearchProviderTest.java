package com.agenttracker.discovery.service.provider;

import com.agenttracker.discovery.client.OpenAICompatibleClient;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * SpecializedAgentSearchProvider 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class SpecializedAgentSearchProviderTest {

    @Mock
    private OpenAICompatibleClient client;

    private SpecializedAgentSearchProvider provider;
    private ProjectContext context;

    @BeforeEach
    void setUp() {
        provider = new SpecializedAgentSearchProvider(client, new ObjectMapper());
        context = new ProjectContext(1L, "Terrain", "game art", List.of("procedural terrain"),
                List.of("noise"), "prototype", 30, "In Progress", null);
    }

    @Test
    @DisplayName("컨텍스트 없이 호출하면 오류")
    void requiresContext() {
        StepVerifier.create(provider.search("terrain", null))
                .expectError(IllegalArgumentException.class)
                .verify();
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("results 객체를 후보로 변환, 타입 힌트 유지")
    void parsesResultsObject() {
        // given
        when(client.complete(anyString(), anyString(), eq(true))).thenReturn(Mono.just("""
                {"results": [{"title": "Erosion Simulation", "description": "Hydraulic erosion",
                  "source": "https://example.com/erosion", "type": "Research"}]}
                """));

        // when
        List<CandidateItem> items = provider.search("terrain erosion", context).block();

        // then
        assertThat(items).hasSize(1);
        assertThat(items.get(0).getCategoryHint()).isEqualTo("Research");
        assertThat(items.get(0).getOrigin()).isEqualTo("specialized-agent");
    }

    @Test
    @DisplayName("도메인 키워드로 검색 전략 선택, 프롬프트에 날짜 금지 문구")
    void promptUsesStrategyForDomain() {
        SearchStrategy strategy = SearchStrategy.forContext(context);

        String prompt = provider.buildPrompt("terrain erosion", context, strategy);

        assertThat(strategy).isEqualTo(SearchStrategy.CREATIVE);
        assertThat(prompt).contains("Search for information about game art related to: terrain erosion.")
                .contains("Current phase: prototype (30% complete)")
                .contains(strategy.instruction())
                .contains("Do not include any dates, years, or time references");
    }

    @Test
    @DisplayName("결과 목록이 없는 응답은 잘못된 출력")
    void malformedAnswer() {
        when(client.complete(anyString(), anyString(), eq(true))).thenReturn(Mono.just("Sorry, no idea."));

        StepVerifier.create(provider.search("terrain", context))
                .expectError(MalformedProviderOutputException.class)
                .verify();
    }

    @Test
    @DisplayName("빈 결과 목록은 빈 리스트, 사용할 수 있는 source가 하나도 없으면 잘못된 출력")
    void emptyAndUnusableResultLists() {
        when(client.complete(anyString(), anyString(), eq(true)))
                .thenReturn(Mono.just("{\"results\": []}"))
                .thenReturn(Mono.just("{\"results\": [{\"title\": \"Terrain talk\", \"source\": \"GDC session\"}]}"));

        StepVerifier.create(provider.search("terrain", context))
                .assertNext(items -> assertThat(items).isEmpty())
                .verifyComplete();
        StepVerifier.create(provider.search("terrain", context))
                .expectError(MalformedProviderOutputException.class)
                .verify();
    }
}
