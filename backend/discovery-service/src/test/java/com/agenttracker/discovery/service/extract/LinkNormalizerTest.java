package com.agenttracker.discovery.service.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * LinkNormalizer 단위 테스트
 */
class LinkNormalizerTest {

    @Test
    @DisplayName("Alpha Signal 추적 링크는 코드까지만 유지")
    void canonicalizesAlphaSignalLinks() {
        assertThat(LinkNormalizer.normalize("https://link.alphasignal.ai/Ab12Cd?utm_source=email&x=1"))
                .isEqualTo("https://link.alphasignal.ai/Ab12Cd");
        assertThat(LinkNormalizer.normalize("http://link.alphasignal.ai/Ab12Cd/extra"))
                .isEqualTo("https://link.alphasignal.ai/Ab12Cd");
    }

    @Test
    @DisplayName("utm 파라미터만 제거하고 나머지는 순서 유지")
    void stripsUtmParameters() {
        assertThat(LinkNormalizer.normalize("https://example.com/post?utm_source=news&id=7&utm_medium=email#top"))
                .isEqualTo("https://example.com/post?id=7#top");
        assertThat(LinkNormalizer.normalize("https://example.com/post?utm_campaign=x"))
                .isEqualTo("https://example.com/post");
    }

    @Test
    @DisplayName("HTML 엔티티가 남은 URL 정리")
    void unescapesEntities() {
        assertThat(LinkNormalizer.normalize(" https://example.com/a?b=1&amp;c=2 "))
                .isEqualTo("https://example.com/a?b=1&c=2");
    }
}
