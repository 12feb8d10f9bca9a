package com.articlegate.core.model;

import java.net.URI;
import java.util.Objects;

/** 하위 분석 파이프라인에 넘기는 기사 한 건. */
public record ArticleDocument(URI sourceUrl, String title, String text) {

    public ArticleDocument {
        Objects.requireNonNull(sourceUrl, "sourceUrl");
        title = title == null ? "" : title;
        text = text == null ? "" : text;
    }
}
