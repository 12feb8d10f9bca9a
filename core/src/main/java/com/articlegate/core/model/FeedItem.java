package com.articlegate.core.model;

import java.util.Objects;

/** RSS item / Atom entry 한 건. link 는 필수, 나머지는 없으면 빈 문자열. */
public record FeedItem(String title, String link, String summary, String published) {

    public FeedItem {
        Objects.requireNonNull(link, "link");
        if (link.isBlank()) throw new IllegalArgumentException("link must not be blank");
        title = title == null ? "" : title;
        summary = summary == null ? "" : summary;
        published = published == null ? "" : published;
    }

    public static FeedItem of(String title, String link) {
        return new FeedItem(title, link, "", "");
    }
}
