package com.articlegate.core.extract;

import com.articlegate.core.model.ArticleDocument;
import com.articlegate.core.model.FetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.StringJoiner;

/**
 * 페치된 본문(HTML 또는 text/plain) → ArticleDocument.
 *
 * 제목: og:title → &lt;title&gt; → 첫 &lt;h1&gt; → fallbackTitle → URL
 * 본문: 잡음 요소 제거 후 &lt;article&gt; → &lt;p&gt; 모음 → body 전체 텍스트
 */
public final class ArticleExtractor {

    private static final String NOISE = "script, style, noscript, nav, header, footer, aside, form, iframe";

    public ArticleDocument extract(FetchResult fetched, String fallbackTitle) {
        String fallback = fallbackTitle == null || fallbackTitle.isBlank()
                ? fetched.getUrl().toString()
                : fallbackTitle.strip();

        if (fetched.getContentType().startsWith("text/plain")) {
            String text = new String(fetched.getBody(), charsetOr(fetched.getCharset(), StandardCharsets.UTF_8));
            return new ArticleDocument(fetched.getUrl(), fallback, text.strip());
        }

        Document doc = parseHtml(fetched);
        String title = firstNonBlank(
                metaProperty(doc, "og:title"),
                doc.title(),
                textOf(doc.selectFirst("h1")),
                fallback);

        doc.select(NOISE).remove();
        return new ArticleDocument(fetched.getUrl(), title, bodyText(doc));
    }

    private static Document parseHtml(FetchResult fetched) {
        // charset 이 없으면 jsoup 이 meta/BOM 으로 감지
        try (ByteArrayInputStream in = new ByteArrayInputStream(fetched.getBody())) {
            return Jsoup.parse(in, validCharsetName(fetched.getCharset()), fetched.getUrl().toString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String bodyText(Document doc) {
        Element article = doc.selectFirst("article");
        if (article != null) {
            String t = article.text().strip();
            if (!t.isEmpty()) return t;
        }
        Elements ps = doc.select("p");
        if (!ps.isEmpty()) {
            StringJoiner sj = new StringJoiner("\n\n");
            for (Element p : ps) {
                String t = p.text().strip();
                if (!t.isEmpty()) sj.add(t);
            }
            if (sj.length() > 0) return sj.toString();
        }
        return doc.body() == null ? "" : doc.body().text().strip();
    }

    private static String metaProperty(Document doc, String property) {
        for (Element m : doc.select("meta[property]")) {
            if (property.equalsIgnoreCase(m.attr("property").trim())) return m.attr("content");
        }
        return "";
    }

    private static String textOf(Element e) {
        return e == null ? "" : e.text();
    }

    private static String firstNonBlank(String... candidates) {
        for (String c : candidates) {
            if (c != null && !c.isBlank()) return c.strip();
        }
        return "";
    }

    private static String validCharsetName(String name) {
        if (name == null || name.isBlank()) return null;
        try {
            return Charset.isSupported(name) ? name : null;
        } catch (IllegalCharsetNameException e) {
            return null;
        }
    }

    private static Charset charsetOr(String name, Charset dflt) {
        String valid = validCharsetName(name);
        if (valid == null) return dflt;
        try {
            return Charset.forName(valid);
        } catch (UnsupportedCharsetException e) {
            return dflt;
        }
    }
}
