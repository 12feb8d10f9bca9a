package com.articlegate.core.service;

import com.articlegate.core.model.ArticleDocument;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResearchDigestTest {

    @Test
    void renders_source_title_and_body_per_document() {
        String out = ResearchDigest.render(List.of(
                new ArticleDocument(URI.create("https://a.example.com/1"), "One", "first body"),
                new ArticleDocument(URI.create("https://b.example.com/2"), "Two", "second body")));

        assertThat(out).isEqualTo(
                "[source] https://a.example.com/1\n"
                        + "[title] One\n\n"
                        + "first body\n"
                        + "\n---\n\n"
                        + "[source] https://b.example.com/2\n"
                        + "[title] Two\n\n"
                        + "second body\n");
    }

    @Test
    void empty_list_renders_nothing() {
        assertThat(ResearchDigest.render(List.of())).isEmpty();
        assertThat(ResearchDigest.render(null)).isEmpty();
    }
}
