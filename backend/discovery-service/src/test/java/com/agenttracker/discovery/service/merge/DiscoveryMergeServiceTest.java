package com.agenttracker.discovery.service.merge;

import com.agenttracker.discovery.config.PipelineProperties;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ClassifiedItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.entity.discovery.ContentType;
import com.agenttracker.discovery.entity.discovery.Discovery;
import com.agenttracker.discovery.support.InMemoryDiscoveryStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DiscoveryMergeService 단위 테스트
 */
class DiscoveryMergeServiceTest {

    private static final String SOURCE = "https://example.com/terrain";

    private InMemoryDiscoveryStore store;
    private SimpleMeterRegistry meterRegistry;
    private DiscoveryMergeService mergeService;
    private ProjectContext context;

    @BeforeEach
    void setUp() {
        store = new InMemoryDiscoveryStore();
        meterRegistry = new SimpleMeterRegistry();
        PipelineProperties properties = new PipelineProperties();
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        mergeService = new DiscoveryMergeService(store, properties, meterRegistry, clock);
        context = new ProjectContext(1L, "Terrain", "game development", List.of("procedural terrain"),
                List.of(), "initial", 0, "Not Started", null);
    }

    @Test
    @DisplayName("임계값 미만 항목은 저장하지 않음")
    void dropsItemsBelowThreshold() {
        // when
        MergeSummary summary = mergeService.mergeAll(context,
                List.of(classified("https://example.com/a", 8), classified("https://example.com/b", 3)));

        // then
        assertThat(summary.inserted()).isEqualTo(1);
        assertThat(summary.belowThreshold()).isEqualTo(1);
        assertThat(store.all()).extracting(Discovery::getSource).containsExactly("https://example.com/a");
        assertThat(store.all().get(0).getDiscoveredAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 12, 0));
        assertThat(meterRegistry.counter("discovery.merge", "result", "below_threshold").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("기본 로케일이 터키어여도 병합 결과 태그는 insert/update")
    void mergeCounterTagsIgnoreDefaultLocale() {
        // given
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            // when
            mergeService.mergeAll(context, List.of(classified(SOURCE, 8)));
            mergeService.mergeAll(context, List.of(classified(SOURCE, 9)));
        } finally {
            Locale.setDefault(original);
        }

        // then
        assertThat(meterRegistry.counter("discovery.merge", "result", "insert").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("discovery.merge", "result", "update").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("같은 점수로 다시 병합하면 쓰기 없음")
    void remergeWithSameScoreIsNoop() {
        // given
        mergeService.mergeAll(context, List.of(classified(SOURCE, 8)));
        int writesAfterFirstRun = store.writeCount();

        // when
        MergeSummary summary = mergeService.mergeAll(context, List.of(classified(SOURCE, 8)));

        // then
        assertThat(summary.unchanged()).isEqualTo(1);
        assertThat(summary.stored()).isZero();
        assertThat(store.writeCount()).isEqualTo(writesAfterFirstRun);
        assertThat(store.all()).hasSize(1);
    }

    @Test
    @DisplayName("더 높은 점수는 갱신하고 viewed 상태는 유지")
    void higherScoreUpdatesAndKeepsViewed() {
        // given
        mergeService.mergeAll(context, List.of(classified(SOURCE, 8)));
        store.modifyConcurrently(1L, SOURCE, d -> d.markViewed(LocalDateTime.now()));

        // when
        MergeSummary summary = mergeService.mergeAll(context, List.of(classified(SOURCE, 9)));

        // then
        assertThat(summary.updated()).isEqualTo(1);
        Discovery stored = store.findByKey(1L, SOURCE).orElseThrow();
        assertThat(stored.getRelevanceScore()).isEqualTo(9);
        assertThat(stored.isViewed()).isTrue();
    }

    @Test
    @DisplayName("동시 삽입으로 충돌하면 다시 읽고 병합")
    void retriesAfterLosingInsertRace() {
        // given
        store.simulateConcurrentInsert(Discovery.builder()
                .projectId(1L)
                .source(SOURCE)
                .title("Inserted elsewhere")
                .relevanceScore(6)
                .categories(new ArrayList<>())
                .discoveredAt(LocalDateTime.now())
                .build());

        // when
        DiscoveryMergeService.MergeOutcome outcome = mergeService.merge(context, classified(SOURCE, 8));

        // then
        assertThat(outcome.decision()).isEqualTo(MergeDecision.UPDATE);
        assertThat(store.all()).hasSize(1);
        assertThat(store.findByKey(1L, SOURCE).orElseThrow().getRelevanceScore()).isEqualTo(8);
    }

    @Test
    @DisplayName("동시에 같은 키를 병합해도 레코드는 하나, 최고 점수 유지")
    void concurrentMergesKeepSingleRecord() throws Exception {
        // given
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<MergeSummary>> tasks = new ArrayList<>();
        for (int score = 5; score <= 10; score++) {
            int s = score;
            tasks.add(() -> {
                start.await();
                return mergeService.mergeAll(context, List.of(classified(SOURCE, s)));
            });
        }

        // when
        List<Future<MergeSummary>> futures = new ArrayList<>();
        for (Callable<MergeSummary> task : tasks) {
            futures.add(executor.submit(task));
        }
        start.countDown();
        int inserted = 0;
        for (Future<MergeSummary> future : futures) {
            inserted += future.get(5, TimeUnit.SECONDS).inserted();
        }
        executor.shutdown();

        // then
        assertThat(inserted).isEqualTo(1);
        assertThat(store.all()).hasSize(1);
        assertThat(store.all().get(0).getRelevanceScore()).isEqualTo(10);
    }

    private static ClassifiedItem classified(String source, int score) {
        return ClassifiedItem.builder()
                .candidate(CandidateItem.builder().title("Terrain Toolkit").source(source).build())
                .relevanceScore(score)
                .categories(List.of("terrain"))
                .contentType(ContentType.TOOL)
                .build();
    }
}
