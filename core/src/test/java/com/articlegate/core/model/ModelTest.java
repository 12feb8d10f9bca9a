package com.articlegate.core.model;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelTest {

    @Test
    void feed_item_requires_link() {
        assertThatThrownBy(() -> FeedItem.of("t", " ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeedItem.of("t", null)).isInstanceOf(NullPointerException.class);
        assertThat(new FeedItem(null, "https://a.example.com", null, null).title()).isEmpty();
    }

    @Test
    void fetch_result_body_is_copied() {
        byte[] raw = {1, 2, 3};
        FetchResult r = new FetchResult(URI.create("https://a.example.com"), raw, null, null);
        raw[0] = 9;
        r.getBody()[1] = 9;
        assertThat(r.getBody()).isEqualTo(new byte[]{1, 2, 3});
        assertThat(r.getContentType()).isEmpty();
    }

    @Test
    void result_map_and_failure_passthrough() {
        AcquisitionResult<String> ok = AcquisitionResult.success("abc");
        assertThat(ok.map(String::length).get()).isEqualTo(3);

        AcquisitionResult<String> bad = AcquisitionResult.failure(Failure.tooLarge("big"));
        assertThat(bad.map(String::length).failure()).contains(Failure.tooLarge("big"));
        assertThat(bad.value()).isEmpty();
    }

    @Test
    void terminal_failures() {
        assertThat(Failure.invalidUrl("x").isTerminal()).isTrue();
        assertThat(Failure.noKeywordMatch("x").isTerminal()).isTrue();
        assertThat(Failure.unreachable("x").isTerminal()).isFalse();
        assertThat(Failure.noCandidates("x").isTerminal()).isFalse();
    }

    @Test
    void link_scope_mode_parsing() {
        assertThat(LinkScopeMode.parse("a")).contains(LinkScopeMode.SAME_SITE);
        assertThat(LinkScopeMode.parse(" permissive ")).contains(LinkScopeMode.PERMISSIVE);
        assertThat(LinkScopeMode.parse("z")).isEmpty();
        assertThat(LinkScopeMode.parse(null)).isEmpty();
    }
}
