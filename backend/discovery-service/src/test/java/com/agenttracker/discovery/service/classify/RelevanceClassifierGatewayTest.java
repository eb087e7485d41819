package com.agenttracker.discovery.service.classify;

import com.agenttracker.discovery.config.PipelineProperties;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ClassifiedItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.entity.discovery.ContentType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * RelevanceClassifierGateway 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class RelevanceClassifierGatewayTest {

    @Mock
    private RelevanceClassifier classifier;

    private RelevanceClassifierGateway gateway;

    private ProjectContext context;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.setClassificationTimeout(Duration.ofMillis(200));
        gateway = new RelevanceClassifierGateway(classifier, new ClassificationResponseParser(new ObjectMapper()), properties);
        context = new ProjectContext(1L, "Terrain", "game development", List.of("procedural terrain"),
                List.of("noise"), "initial", 0, "Not Started", null);
    }

    @Test
    @DisplayName("손상된 응답에서 점수 복구, 출처는 후보 그대로")
    void salvagesScoreAndKeepsSource() {
        // given
        CandidateItem item = candidate("https://example.com/terrain");
        when(classifier.classifyRaw(any(), any()))
                .thenReturn(Mono.just("{\"relevanceScore\": 7, \"source\": \"https://other.example.com\""));

        // when / then
        StepVerifier.create(gateway.classifyAll(List.of(item), context))
                .assertNext(result -> {
                    assertThat(result).hasSize(1);
                    assertThat(result.get(0).getRelevanceScore()).isEqualTo(7);
                    assertThat(result.get(0).getSource()).isEqualTo("https://example.com/terrain");
                    assertThat(result.get(0).getParseOutcome()).isEqualTo(ParseOutcome.SALVAGED);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("오류와 타임아웃은 기본 분류, 항목은 누락되지 않음")
    void defaultsOnErrorAndTimeout() {
        // given
        CandidateItem failing = candidate("https://example.com/fails");
        CandidateItem slow = candidate("https://example.com/slow");
        CandidateItem ok = candidate("https://example.com/ok");
        when(classifier.classifyRaw(any(), any())).thenAnswer(invocation -> {
            CandidateItem item = invocation.getArgument(0);
            if (item.getSource().endsWith("fails")) {
                return Mono.error(new IllegalStateException("rate limited"));
            }
            if (item.getSource().endsWith("slow")) {
                return Mono.never();
            }
            return Mono.just("{\"relevanceScore\": 9, \"type\": \"Article\"}");
        });

        // when
        List<ClassifiedItem> result = gateway.classifyAll(List.of(failing, slow, ok), context).block();

        // then
        assertThat(result).extracting(ClassifiedItem::getSource)
                .containsExactly("https://example.com/fails", "https://example.com/slow", "https://example.com/ok");
        assertThat(result).extracting(ClassifiedItem::getRelevanceScore).containsExactly(5, 5, 9);
        assertThat(result.get(0).getContentType()).isEqualTo(ContentType.OTHER);
        assertThat(result.get(1).getParseOutcome()).isEqualTo(ParseOutcome.DEFAULTED);
        assertThat(result.get(2).getContentType()).isEqualTo(ContentType.ARTICLE);
    }

    @Test
    @DisplayName("빈 목록은 호출 없이 빈 결과")
    void emptyInput() {
        assertThat(gateway.classifyAll(List.of(), context).block()).isEmpty();
    }

    private static CandidateItem candidate(String source) {
        return CandidateItem.builder()
                .title("Terrain article")
                .description("About terrain")
                .source(source)
                .build();
    }
}
