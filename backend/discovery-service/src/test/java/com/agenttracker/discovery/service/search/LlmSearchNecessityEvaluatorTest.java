package com.agenttracker.discovery.service.search;

import com.agenttracker.discovery.client.OpenAICompatibleClient;
import com.agenttracker.discovery.config.PipelineProperties;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.dto.pipeline.SearchNecessityDecision;
import com.agenttracker.discovery.repository.DiscoveryRepository;
import com.agenttracker.discovery.repository.ProjectContextEntryRepository;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * LlmSearchNecessityEvaluator 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class LlmSearchNecessityEvaluatorTest {

    @Mock
    private OpenAICompatibleClient client;

    @Mock
    private DiscoveryRepository discoveryRepository;

    @Mock
    private ProjectContextEntryRepository contextEntryRepository;

    private LlmSearchNecessityEvaluator evaluator;
    private ProjectContext context;

    @BeforeEach
    void setUp() {
        evaluator = new LlmSearchNecessityEvaluator(client, discoveryRepository, contextEntryRepository,
                new PipelineProperties(), new ObjectMapper());
        context = new ProjectContext(1L, "Terrain", "game development", List.of("procedural terrain"),
                List.of(), "initial", 0, "Not Started", null);
    }

    @Test
    @DisplayName("shouldSearch=false 응답은 생략 결정")
    void skipDecision() {
        // given
        when(client.isEnabled()).thenReturn(true);
        when(client.complete(anyString(), anyString(), anyBoolean()))
                .thenReturn(Mono.just("{\"shouldSearch\": false, \"reason\": \"Recent results cover the goals\"}"));

        // when
        SearchNecessityDecision decision = evaluator.evaluate(context).block();

        // then
        assertThat(decision.shouldSearch()).isFalse();
        assertThat(decision.rationale()).isEqualTo("Recent results cover the goals");
    }

    @Test
    @DisplayName("LLM 미설정 시 오류로 알림")
    void errorsWithoutLlm() {
        when(client.isEnabled()).thenReturn(false);

        StepVerifier.create(evaluator.evaluate(context))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    @DisplayName("플래그가 없거나 JSON이 아니면 IllegalArgumentException")
    void rejectsUnreadableAnswer() {
        assertThatThrownBy(() -> evaluator.parseDecision("{\"reason\": \"maybe\"}"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> evaluator.parseDecision("yes, search again"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(evaluator.parseDecision("{\"shouldSearch\": true}").shouldSearch()).isTrue();
    }
}
