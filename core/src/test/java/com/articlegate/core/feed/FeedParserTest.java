package com.articlegate.core.feed;

import com.articlegate.core.model.FeedItem;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedParserTest {

    private final FeedParser parser = new FeedParser();

    static byte[] fixture(String name) throws IOException {
        try (InputStream in = FeedParserTest.class.getResourceAsStream("/feeds/" + name)) {
            if (in == null) throw new IOException("missing fixture " + name);
            return in.readAllBytes();
        }
    }

    @Test
    void rss2_items_in_order_and_linkless_dropped() throws Exception {
        List<FeedItem> items = parser.parse(fixture("rss2.xml"));

        assertThat(items).extracting(FeedItem::link).containsExactly(
                "https://news.example.com/2024/quantum",
                "https://news.example.com/2024/ryoshi");

        FeedItem first = items.get(0);
        assertThat(first.title()).isEqualTo("Quantum computing breakthrough");
        assertThat(first.summary()).isEqualTo("Researchers report <b>stable</b> qubits.");
        assertThat(first.published()).isEqualTo("Mon, 01 Jan 2024 09:00:00 GMT");

        // pubDate 가 없으면 dc:date
        assertThat(items.get(1).published()).isEqualTo("2024-01-02T10:00:00Z");
        assertThat(items.get(1).title()).isEqualTo("量子コンピュータの新展開");
    }

    @Test
    void atom_entries_use_href_summary_fallback_and_updated() throws Exception {
        List<FeedItem> items = parser.parse(fixture("atom.xml"));

        assertThat(items).hasSize(2);
        assertThat(items.get(0).link()).isEqualTo("https://blog.example.org/one");
        assertThat(items.get(0).summary()).isEqualTo("First summary");
        assertThat(items.get(0).published()).isEqualTo("2024-02-03T00:00:00Z");

        assertThat(items.get(1).summary()).isEqualTo("Only content, no summary");
        assertThat(items.get(1).published()).isEqualTo("2024-02-02T00:00:00Z");
    }

    @Test
    void rss1_rdf_items() throws Exception {
        List<FeedItem> items = parser.parse(fixture("rdf.xml"));
        assertThat(items).singleElement().satisfies(it -> {
            assertThat(it.link()).isEqualTo("https://rdf.example.net/a");
            assertThat(it.summary()).isEqualTo("RSS 1.0 description");
            assertThat(it.published()).isEqualTo("2024-03-01");
        });
    }

    @Test
    void prefixed_and_mixed_case_tags() throws Exception {
        String xml = "<x:RSS xmlns:x='urn:x'><x:Channel><x:Item>"
                + "<x:Title>T</x:Title><x:Link> https://a.example.com/p </x:Link>"
                + "</x:Item></x:Channel></x:RSS>";
        assertThat(parser.parse(xml)).containsExactly(FeedItem.of("T", "https://a.example.com/p"));
    }

    @Test
    void atom_link_text_fallback() throws Exception {
        String xml = "<feed xmlns='http://www.w3.org/2005/Atom'><entry><title>t</title>"
                + "<link>https://a.example.com/text-link</link></entry></feed>";
        assertThat(parser.parse(xml)).extracting(FeedItem::link).containsExactly("https://a.example.com/text-link");
    }

    @Test
    void unknown_root_gives_no_items() throws Exception {
        assertThat(parser.parse("<html><body>not a feed</body></html>")).isEmpty();
        assertThat(parser.parse("<rss version='2.0'/>")).isEmpty();
    }

    @Test
    void malformed_xml_throws() {
        assertThatThrownBy(() -> parser.parse("<rss><channel><item>"))
                .isInstanceOf(FeedParser.FeedParseException.class);
        assertThatThrownBy(() -> parser.parse(new byte[0]))
                .isInstanceOf(FeedParser.FeedParseException.class);
    }

    @Test
    void external_entities_are_not_resolved() {
        String xml = "<?xml version='1.0'?><!DOCTYPE rss [<!ENTITY xxe SYSTEM 'file:///etc/hostname'>]>"
                + "<rss><channel><item><title>&xxe;</title><link>https://a.example.com/x</link></item></channel></rss>";
        try {
            List<FeedItem> items = parser.parse(xml);
            assertThat(items).allSatisfy(it -> assertThat(it.title()).isEmpty());
        } catch (FeedParser.FeedParseException e) {
            // 거부해도 된다: 중요한 건 파일 내용이 새지 않는 것
            assertThat(e).hasMessageContaining("malformed");
        }
    }
}
