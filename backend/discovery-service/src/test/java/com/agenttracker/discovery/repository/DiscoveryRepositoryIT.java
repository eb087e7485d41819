package com.agenttracker.discovery.repository;

import com.agenttracker.discovery.dto.DiscoverySort;
import com.agenttracker.discovery.entity.discovery.ContentType;
import com.agenttracker.discovery.entity.discovery.Discovery;
import com.agenttracker.discovery.entity.project.Project;
import com.agenttracker.discovery.service.merge.JpaDiscoveryStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DiscoveryRepository 통합 테스트 (Testcontainers 사용)
 * 실제 PostgreSQL 컨테이너에서 고유 키, 버전, 필터와 정렬을 검증합니다.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers
@ActiveProfiles("test")
@Import(JpaDiscoveryStore.class)
class DiscoveryRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private DiscoveryRepository discoveryRepository;

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private JpaDiscoveryStore discoveryStore;

    @Test
    @DisplayName("프로젝트와 discovery 저장 및 키로 조회")
    void saveAndFindByKey() {
        // given
        Project project = projectRepository.save(Project.builder()
                .name("Terrain Generator")
                .domain("game development")
                .goals(new ArrayList<>(List.of(" procedural terrain ", "procedural terrain", "")))
                .build());

        // when
        discoveryStore.insert(discovery(project.getId(), "https://example.com/terrain", 8));

        // then
        assertThat(projectRepository.findById(project.getId()).orElseThrow().getGoals())
                .containsExactly("procedural terrain");
        Discovery found = discoveryStore.findByKey(project.getId(), "https://example.com/terrain").orElseThrow();
        assertThat(found.getCategories()).containsExactly("terrain");
        assertThat(found.getContentType()).isEqualTo(ContentType.TOOL);
        assertThat(found.getVersion()).isZero();
    }

    @Test
    @DisplayName("같은 (projectId, source) 두 번째 삽입은 제약 위반")
    void duplicateKeyIsRejected() {
        discoveryStore.insert(discovery(1L, "https://example.com/terrain", 8));

        assertThatThrownBy(() -> discoveryStore.insert(discovery(1L, "https://example.com/terrain", 9)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("오래된 버전으로 갱신하면 낙관적 락 실패")
    void staleVersionIsRejected() {
        // given
        Discovery saved = discoveryStore.insert(discovery(1L, "https://example.com/terrain", 6));
        Discovery stale = Discovery.builder()
                .id(saved.getId())
                .version(saved.getVersion())
                .projectId(1L)
                .source(saved.getSource())
                .title(saved.getTitle())
                .relevanceScore(7)
                .discoveredAt(saved.getDiscoveredAt())
                .build();
        saved.setRelevanceScore(9);
        discoveryStore.update(saved);

        // when / then
        assertThatThrownBy(() -> discoveryStore.update(stale))
                .isInstanceOf(OptimisticLockingFailureException.class);
    }

    @Test
    @DisplayName("리뷰 상태별 조회와 카운트")
    void filtersByReviewState() {
        // given
        Discovery fresh = discoveryRepository.save(discovery(1L, "https://example.com/new", 7));
        Discovery seen = discovery(1L, "https://example.com/seen", 8);
        seen.markViewed(LocalDateTime.now());
        discoveryRepository.save(seen);
        Discovery hidden = discovery(1L, "https://example.com/hidden", 9);
        hidden.hide();
        discoveryRepository.save(hidden);
        discoveryRepository.save(discovery(2L, "https://example.com/new", 5));

        // when / then
        assertThat(discoveryRepository.findByProjectIdAndHiddenFalse(1L, PageRequest.of(0, 10)).getTotalElements())
                .isEqualTo(2);
        assertThat(discoveryRepository.findByProjectIdAndViewedFalseAndHiddenFalse(1L, PageRequest.of(0, 10))
                .getContent()).extracting(Discovery::getId).containsExactly(fresh.getId());
        assertThat(discoveryRepository.countByProjectIdAndHiddenTrue(1L)).isEqualTo(1);
        // total matches the ALL filter
        assertThat(discoveryRepository.countByProjectIdAndHiddenFalse(1L)).isEqualTo(2);
        assertThat(discoveryRepository.findNewIdsByProjectId(1L)).containsExactly(fresh.getId());
        assertThat(discoveryStore.countDiscoveredSince(1L, LocalDateTime.now().minusHours(1))).isEqualTo(3);
    }

    @Test
    @DisplayName("피드백 정렬: 유용, 미평가, 비유용 순")
    void sortsByFeedback() {
        // given
        Discovery notUseful = discovery(1L, "https://example.com/a", 9);
        notUseful.applyFeedback(false, null, null, LocalDateTime.now());
        Discovery useful = discovery(1L, "https://example.com/b", 6);
        useful.applyFeedback(true, null, null, LocalDateTime.now());
        Discovery unrated = discovery(1L, "https://example.com/c", 7);
        discoveryRepository.saveAll(List.of(notUseful, useful, unrated));
        discoveryRepository.flush();

        // when
        Page<Discovery> page = discoveryRepository.findByProjectIdAndHiddenFalse(1L,
                PageRequest.of(0, 10, DiscoverySort.FEEDBACK.toSort()));

        // then
        assertThat(page.getContent()).extracting(Discovery::getSource)
                .containsExactly("https://example.com/b", "https://example.com/c", "https://example.com/a");
    }

    @Test
    @DisplayName("추천 대상은 미제시, 비숨김 항목을 점수순으로 조회하고 제시 표시 후 제외")
    void recommendationCandidates() {
        // given
        Discovery low = discoveryRepository.save(discovery(1L, "https://example.com/low", 6));
        Discovery high = discoveryRepository.save(discovery(1L, "https://example.com/high", 9));
        Discovery hidden = discovery(1L, "https://example.com/hidden", 10);
        hidden.hide();
        discoveryRepository.save(hidden);
        discoveryRepository.flush();
        Long versionBefore = high.getVersion();

        // when
        List<Discovery> pending = discoveryRepository
                .findTop10ByProjectIdAndPresentedFalseAndHiddenFalseOrderByRelevanceScoreDesc(1L);
        int marked = discoveryRepository.markPresented(List.of(high.getId()));

        // then
        assertThat(pending).extracting(Discovery::getId).containsExactly(high.getId(), low.getId());
        assertThat(marked).isEqualTo(1);
        assertThat(discoveryRepository.findTop10ByProjectIdAndPresentedFalseAndHiddenFalseOrderByRelevanceScoreDesc(1L))
                .extracting(Discovery::getId).containsExactly(low.getId());
        Discovery reloaded = discoveryRepository.findById(high.getId()).orElseThrow();
        assertThat(reloaded.isPresented()).isTrue();
        assertThat(reloaded.getVersion()).isEqualTo(versionBefore + 1);
    }

    private static Discovery discovery(Long projectId, String source, int score) {
        return Discovery.builder()
                .projectId(projectId)
                .source(source)
                .title("Terrain Toolkit")
                .description("Heightmap tooling")
                .relevanceScore(score)
                .categories(new ArrayList<>(List.of("terrain")))
                .contentType(ContentType.TOOL)
                .discoveredAt(LocalDateTime.now())
                .build();
    }
}
