package com.articlegate.core.model;

import java.util.Objects;

/** 랭킹 결과. score 는 항상 양수 (0점은 결과에 포함되지 않음). */
public record ScoredItem(FeedItem item, int score) {

    public ScoredItem {
        Objects.requireNonNull(item, "item");
        if (score <= 0) throw new IllegalArgumentException("score must be > 0");
    }
}
