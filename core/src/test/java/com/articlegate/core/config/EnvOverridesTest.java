package com.articlegate.core.config;

import com.articlegate.core.model.LinkScopeMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EnvOverridesTest {

    private static AcquisitionConfig apply(Map<String, String> env) {
        return EnvOverrides.apply(AcquisitionConfig.builder(), env).build();
    }

    @Test
    void all_known_keys_applied() {
        Map<String, String> env = new HashMap<>();
        env.put("URL_ALLOWED_SCHEMES", "https, HTTP");
        env.put("URL_ALLOWLIST_DOMAINS", "example.com\n*.news.test");
        env.put("URL_BLOCK_PRIVATE_IPS", "off");
        env.put("URL_ALLOW_REDIRECTS", "yes");
        env.put("URL_MAX_REDIRECTS", "4");
        env.put("HTTP_MAX_BYTES", "1000");
        env.put("RSS_MAX_BYTES", "500");
        env.put("HTTP_CONNECT_TIMEOUT_SEC", "1");
        env.put("HTTP_READ_TIMEOUT_SEC", "2");
        env.put("RSS_MAX_FEEDS", "3");
        env.put("RSS_MAX_ARTICLES", "2");
        env.put("RSS_ITEM_LINK_POLICY", "b");

        AcquisitionConfig c = apply(env);

        assertThat(c.getAllowedSchemes()).containsExactly("https", "http");
        assertThat(c.getAllowlistDomains()).containsExactly("example.com", "*.news.test");
        assertThat(c.isBlockPrivateIps()).isFalse();
        assertThat(c.isAllowRedirects()).isTrue();
        assertThat(c.getMaxRedirects()).isEqualTo(4);
        assertThat(c.getArticleMaxBytes()).isEqualTo(1000);
        assertThat(c.getFeedMaxBytes()).isEqualTo(500);
        assertThat(c.getConnectTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(c.getReadTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(c.getMaxFeedsPerCall()).isEqualTo(3);
        assertThat(c.getMaxSelectedArticles()).isEqualTo(2);
        assertThat(c.getLinkScopeMode()).isEqualTo(LinkScopeMode.PERMISSIVE);
    }

    @Test
    void unparseable_values_keep_previous() {
        AcquisitionConfig c = apply(Map.of(
                "URL_BLOCK_PRIVATE_IPS", "maybe",
                "URL_MAX_REDIRECTS", "two",
                "HTTP_READ_TIMEOUT_SEC", "0",
                "RSS_ITEM_LINK_POLICY", "C"));

        assertThat(c.isBlockPrivateIps()).isTrue();
        assertThat(c.getMaxRedirects()).isEqualTo(2);
        assertThat(c.getReadTimeout()).isEqualTo(Duration.ofSeconds(7));
        assertThat(c.getLinkScopeMode()).isEqualTo(LinkScopeMode.SAME_SITE);
    }

    @Test
    void empty_allowlist_value_clears_allowlist() {
        AcquisitionConfig.Builder b = AcquisitionConfig.builder().allowlistDomains(java.util.List.of("x.com"));
        AcquisitionConfig c = EnvOverrides.apply(b, Map.of("URL_ALLOWLIST_DOMAINS", "")).build();
        assertThat(c.hasDomainAllowlist()).isFalse();
    }

    @Test
    void bool_parsing() {
        for (String t : new String[]{"1", "true", "YES", "y", "On"}) assertThat(EnvOverrides.parseBool(t)).isTrue();
        for (String f : new String[]{"0", "false", "No", "n", "OFF"}) assertThat(EnvOverrides.parseBool(f)).isFalse();
        assertThat(EnvOverrides.parseBool("perhaps")).isNull();
        assertThat(EnvOverrides.parseBool(null)).isNull();
    }
}
