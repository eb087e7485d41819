package com.agenttracker.discovery.service.provider;

import com.agenttracker.discovery.client.OpenAICompatibleClient;
import com.agenttracker.discovery.config.PipelineProperties;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * SearchProviderChain 단위 테스트
 */
class SearchProviderChainTest {

    private PipelineProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ProjectContext context;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.setProviderTimeout(Duration.ofMillis(200));
        properties.setWebSearchFallbackEnabled(true);
        meterRegistry = new SimpleMeterRegistry();
        context = new ProjectContext(1L, "Terrain", "game development", List.of("procedural terrain"),
                List.of(), "initial", 0, "Not Started", null);
    }

    @Test
    @DisplayName("앞의 두 제공자가 실패하면 세 번째 제공자의 결과 사용")
    void fallsThroughToThirdProvider() {
        // given
        FakeProvider agent = new FakeProvider("agent", ProviderCapability.CONTEXT_AWARE,
                () -> Mono.error(new IllegalStateException("LLM unavailable")));
        FakeProvider semantic = new FakeProvider("semantic", ProviderCapability.CONTEXT_FREE,
                () -> Mono.error(new IllegalStateException("503 Service Unavailable")));
        FakeProvider web = new FakeProvider("web", ProviderCapability.LAST_RESORT,
                () -> Mono.just(List.of(item("https://a.example.com"), item("https://b.example.com"),
                        item("https://c.example.com"))));
        SearchProviderChain chain = new SearchProviderChain(List.of(web, semantic, agent), properties, meterRegistry);

        // when / then
        StepVerifier.create(chain.execute("terrain noise", context))
                .assertNext(result -> {
                    assertThat(result.succeeded()).isTrue();
                    assertThat(result.provider()).isEqualTo("web");
                    assertThat(result.items()).hasSize(3);
                    assertThat(result.attempts()).extracting(ProviderAttempt::provider)
                            .containsExactly("agent", "semantic", "web");
                    assertThat(result.attempts()).extracting(ProviderAttempt::outcome)
                            .containsExactly(ProviderAttempt.Outcome.FAILED, ProviderAttempt.Outcome.FAILED,
                                    ProviderAttempt.Outcome.SUCCEEDED);
                })
                .verifyComplete();
        assertThat(meterRegistry.counter("discovery.provider.failures", "provider", "agent").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("빈 응답, 타임아웃, 잘못된 항목은 모두 실패로 기록")
    void emptyTimeoutAndMalformedCountAsFailures() {
        // given
        FakeProvider empty = new FakeProvider("agent", ProviderCapability.CONTEXT_AWARE, Mono::empty);
        FakeProvider slow = new FakeProvider("semantic", ProviderCapability.CONTEXT_FREE, Mono::never);
        FakeProvider malformed = new FakeProvider("web", ProviderCapability.LAST_RESORT,
                () -> Mono.just(List.of(CandidateItem.builder().title("No source").build())));
        SearchProviderChain chain = new SearchProviderChain(List.of(empty, slow, malformed), properties, meterRegistry);

        // when
        ProviderChainResult result = chain.execute("terrain noise", context).block();

        // then
        assertThat(result.succeeded()).isFalse();
        assertThat(result.items()).isEmpty();
        assertThat(result.exhaustedWithoutFallback()).isFalse();
        assertThat(result.attempts()).extracting(ProviderAttempt::outcome)
                .containsExactly(ProviderAttempt.Outcome.EMPTY, ProviderAttempt.Outcome.TIMED_OUT,
                        ProviderAttempt.Outcome.MALFORMED);
    }

    @Test
    @DisplayName("빈 목록을 반환한 제공자는 EMPTY로 기록하고 다음 제공자로 진행")
    void emptyListFallsThrough() {
        // given
        FakeProvider agent = new FakeProvider("agent", ProviderCapability.CONTEXT_AWARE, () -> Mono.just(List.of()));
        FakeProvider web = new FakeProvider("web", ProviderCapability.LAST_RESORT,
                () -> Mono.just(List.of(item("https://web.example.com"))));
        SearchProviderChain chain = new SearchProviderChain(List.of(agent, web), properties, meterRegistry);

        // when
        ProviderChainResult result = chain.execute("terrain noise", context).block();

        // then
        assertThat(result.succeeded()).isTrue();
        assertThat(result.provider()).isEqualTo("web");
        assertThat(result.items()).extracting(CandidateItem::getSource).containsExactly("https://web.example.com");
        assertThat(result.attempts()).extracting(ProviderAttempt::outcome)
                .containsExactly(ProviderAttempt.Outcome.EMPTY, ProviderAttempt.Outcome.SUCCEEDED);
    }

    @Test
    @DisplayName("source가 URL이 아닌 결과만 있는 에이전트 응답은 MALFORMED로 기록하고 다음 제공자로 진행")
    void agentAnswerWithoutUsableSourcesFallsThrough() {
        // given
        OpenAICompatibleClient client = mock(OpenAICompatibleClient.class);
        when(client.isEnabled()).thenReturn(true);
        when(client.complete(anyString(), anyString(), anyBoolean())).thenReturn(Mono.just("""
                {"results": [
                  {"title": "Terrain talk", "source": "GDC 2019 session"},
                  {"title": "Noise notes", "source": "internal wiki"}
                ]}
                """));
        SpecializedAgentSearchProvider agent = new SpecializedAgentSearchProvider(client, new ObjectMapper());
        FakeProvider semantic = new FakeProvider("semantic", ProviderCapability.CONTEXT_FREE,
                () -> Mono.just(List.of(item("https://semantic.example.com"))));
        SearchProviderChain chain = new SearchProviderChain(List.of(agent, semantic), properties, meterRegistry);

        // when
        ProviderChainResult result = chain.execute("terrain noise", context).block();

        // then
        assertThat(result.provider()).isEqualTo("semantic");
        assertThat(result.attempts()).extracting(ProviderAttempt::provider)
                .containsExactly("specialized-agent", "semantic");
        assertThat(result.attempts()).extracting(ProviderAttempt::outcome)
                .containsExactly(ProviderAttempt.Outcome.MALFORMED, ProviderAttempt.Outcome.SUCCEEDED);
    }

    @Test
    @DisplayName("프로젝트 컨텍스트가 없으면 컨텍스트 기반 제공자는 건너뜀")
    void skipsContextAwareProviderWithoutContext() {
        // given
        FakeProvider agent = new FakeProvider("agent", ProviderCapability.CONTEXT_AWARE,
                () -> Mono.just(List.of(item("https://agent.example.com"))));
        FakeProvider semantic = new FakeProvider("semantic", ProviderCapability.CONTEXT_FREE,
                () -> Mono.just(List.of(item("https://semantic.example.com"))));
        SearchProviderChain chain = new SearchProviderChain(List.of(agent, semantic), properties, meterRegistry);

        // when
        ProviderChainResult result = chain.execute("terrain noise", null).block();

        // then
        assertThat(result.provider()).isEqualTo("semantic");
        assertThat(agent.calls.get()).isZero();
    }

    @Test
    @DisplayName("웹 검색 폴백이 꺼져 있으면 전부 실패 시 조치 필요로 표시")
    void reportsExhaustionWithoutFallback() {
        // given
        properties.setWebSearchFallbackEnabled(false);
        FakeProvider semantic = new FakeProvider("semantic", ProviderCapability.CONTEXT_FREE,
                () -> Mono.error(new IllegalStateException("quota exceeded")));
        FakeProvider web = new FakeProvider("web", ProviderCapability.LAST_RESORT,
                () -> Mono.just(List.of(item("https://web.example.com"))));
        SearchProviderChain chain = new SearchProviderChain(List.of(semantic, web), properties, meterRegistry);

        // when
        ProviderChainResult result = chain.execute("terrain noise", context).block();

        // then
        assertThat(result.succeeded()).isFalse();
        assertThat(result.exhaustedWithoutFallback()).isTrue();
        assertThat(web.calls.get()).isZero();
    }

    @Test
    @DisplayName("사용 불가능한 제공자는 체인에서 제외")
    void excludesUnavailableProviders() {
        FakeProvider semantic = new FakeProvider("semantic", ProviderCapability.CONTEXT_FREE, Mono::empty);
        semantic.available = false;
        SearchProviderChain chain = new SearchProviderChain(List.of(semantic), properties, meterRegistry);

        assertThat(chain.buildChain(context)).isEmpty();
        assertThat(chain.execute("terrain noise", context).block().attempts()).isEmpty();
    }

    private static CandidateItem item(String source) {
        return CandidateItem.builder().title("Result " + source).source(source).build();
    }

    private static class FakeProvider implements SearchProvider {

        private final String name;
        private final ProviderCapability capability;
        private final Supplier<Mono<List<CandidateItem>>> answer;
        private final AtomicInteger calls = new AtomicInteger();
        private boolean available = true;

        FakeProvider(String name, ProviderCapability capability, Supplier<Mono<List<CandidateItem>>> answer) {
            this.name = name;
            this.capability = capability;
            this.answer = answer;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public ProviderCapability getCapability() {
            return capability;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public Mono<List<CandidateItem>> search(String query, ProjectContext context) {
            calls.incrementAndGet();
            return answer.get();
        }
    }
}
