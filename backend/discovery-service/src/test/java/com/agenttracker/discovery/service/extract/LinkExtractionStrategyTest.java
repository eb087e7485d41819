package com.agenttracker.discovery.service.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * LinkExtractionStrategy 단위 테스트
 */
class LinkExtractionStrategyTest {

    @Test
    @DisplayName("QP 앵커: soft line break 제거 후 카테고리와 좋아요 수까지 추출")
    void quotedPrintableAnchorReadsContext() {
        // given
        String raw = "<span style=3D\"color:#999\">Research</span>\n"
                + "<a href=3D\"https://example.com/terrain=\n/erosion\" target=3D\"_blank\">Proc=\nedural Erosion</a>\n"
                + " =E2=87=A7 1,234 Likes";

        // when
        List<LinkTuple> tuples = RegexAnchorStrategy.quotedPrintable().extract(raw);

        // then
        assertThat(tuples).hasSize(1);
        LinkTuple tuple = tuples.get(0);
        assertThat(tuple.title()).isEqualTo("Procedural Erosion");
        assertThat(tuple.url()).isEqualTo("https://example.com/terrain/erosion");
        assertThat(tuple.category()).isEqualTo("Research");
        assertThat(tuple.popularity()).isEqualTo(1234);
    }

    @Test
    @DisplayName("마크다운 링크 추출")
    void markdownLinks() {
        String raw = "See [Terrain Toolkit](https://example.com/toolkit) and [Noise Primer](https://example.com/noise).";

        List<LinkTuple> tuples = RegexAnchorStrategy.markdown().extract(raw);

        assertThat(tuples).extracting(LinkTuple::title).containsExactly("Terrain Toolkit", "Noise Primer");
        assertThat(tuples).extracting(LinkTuple::url)
                .containsExactly("https://example.com/toolkit", "https://example.com/noise");
    }

    @Test
    @DisplayName("DOM 추출: 텍스트 없는 앵커는 title 속성 사용, 상대 경로 제외")
    void jsoupUsesTitleAttribute() {
        // given
        String raw = """
                <div>
                  <a
                     class="card"
                     href="https://example.com/heightmaps"
                     title="Heightmap Generator"><img src="thumb.png"></a>
                  <a href="/unsubscribe">Unsubscribe</a>
                </div>
                """;

        // when
        List<LinkTuple> tuples = new JsoupAnchorStrategy().extract(raw);

        // then
        assertThat(tuples).containsExactly(new LinkTuple("Heightmap Generator", "https://example.com/heightmaps"));
    }

    @Test
    @DisplayName("이해할 수 없는 입력에는 빈 목록 반환")
    void returnsEmptyOnForeignInput() {
        String plain = "No links here, just a paragraph about terrain.";

        assertThat(RegexAnchorStrategy.html().extract(plain)).isEmpty();
        assertThat(RegexAnchorStrategy.markdown().extract("<a href=\"https://example.com\">x</a>")).isEmpty();
        assertThat(new JsoupAnchorStrategy().extract(plain)).isEmpty();
        assertThat(RegexAnchorStrategy.quotedPrintable().extract(null)).isEmpty();
    }
}
