package com.articlegate.core.config;

import com.articlegate.core.model.LinkScopeMode;
import com.articlegate.core.model.Purpose;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AcquisitionConfigTest {

    @Test
    void defaults_are_conservative() {
        AcquisitionConfig c = AcquisitionConfig.defaults();
        assertThat(c.getAllowedSchemes()).containsExactly("https");
        assertThat(c.hasDomainAllowlist()).isFalse();
        assertThat(c.isBlockPrivateIps()).isTrue();
        assertThat(c.isAllowRedirects()).isFalse();
        assertThat(c.getMaxRedirects()).isEqualTo(2);
        assertThat(c.maxBytes(Purpose.ARTICLE)).isEqualTo(5_000_000L);
        assertThat(c.maxBytes(Purpose.FEED)).isEqualTo(2_000_000L);
        assertThat(c.getConnectTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(c.getReadTimeout()).isEqualTo(Duration.ofSeconds(7));
        assertThat(c.getMaxFeedsPerCall()).isEqualTo(10);
        assertThat(c.getMaxSelectedArticles()).isEqualTo(1);
        assertThat(c.getLinkScopeMode()).isEqualTo(LinkScopeMode.SAME_SITE);
        assertThat(c.getFeedUrls()).isEmpty();
        assertThat(c.allowedContentTypes(Purpose.ARTICLE)).contains("text/html");
        assertThat(c.allowedContentTypes(Purpose.FEED)).contains("application/rss");
    }

    @Test
    void selected_articles_clamped_to_one_through_three() {
        assertThat(AcquisitionConfig.builder().maxSelectedArticles(0).build().getMaxSelectedArticles()).isEqualTo(1);
        assertThat(AcquisitionConfig.builder().maxSelectedArticles(2).build().getMaxSelectedArticles()).isEqualTo(2);
        assertThat(AcquisitionConfig.builder().maxSelectedArticles(99).build().getMaxSelectedArticles()).isEqualTo(3);
    }

    @Test
    void invalid_values_fail_build() {
        assertThatThrownBy(() -> AcquisitionConfig.builder().allowedSchemes(List.of()).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AcquisitionConfig.builder().articleMaxBytes(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AcquisitionConfig.builder().feedMaxBytes(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AcquisitionConfig.builder().readTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void to_builder_copies_everything() {
        AcquisitionConfig a = AcquisitionConfig.builder()
                .allowlistDomains(List.of("example.com"))
                .allowRedirects(true)
                .linkScopeMode(LinkScopeMode.PERMISSIVE)
                .feedUrls(List.of("https://example.com/rss"))
                .build();
        AcquisitionConfig b = a.toBuilder().maxRedirects(4).build();

        assertThat(b.getAllowlistDomains()).containsExactly("example.com");
        assertThat(b.isAllowRedirects()).isTrue();
        assertThat(b.getLinkScopeMode()).isEqualTo(LinkScopeMode.PERMISSIVE);
        assertThat(b.getFeedUrls()).containsExactly("https://example.com/rss");
        assertThat(b.getMaxRedirects()).isEqualTo(4);
        assertThat(a.getMaxRedirects()).isEqualTo(2);
    }
}
