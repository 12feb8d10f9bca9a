package com.articlegate.core.rank;

import com.articlegate.core.model.FeedItem;
import com.articlegate.core.model.ScoredItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 제목+요약 부분 문자열 매칭 기반 랭커.
 * 토큰이 포함되면 토큰 길이(1~6으로 제한)만큼 가산. 0점 항목은 결과에서 제외.
 * 정렬은 점수 내림차순 안정 정렬이라 동점이면 원래 순서를 유지한다.
 */
public final class RelevanceRanker {

    public static final int MIN_WEIGHT = 1;
    public static final int MAX_WEIGHT = 6;

    public List<ScoredItem> rank(List<FeedItem> items, String query, int limit) {
        if (items == null || items.isEmpty() || limit <= 0) return List.of();
        Set<String> tokens = QueryTokenizer.tokenize(query);
        if (tokens.isEmpty()) return List.of();

        List<ScoredItem> scored = new ArrayList<>();
        for (FeedItem it : items) {
            int s = score(it, tokens);
            if (s > 0) scored.add(new ScoredItem(it, s));
        }
        scored.sort(Comparator.comparingInt(ScoredItem::score).reversed());
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : List.copyOf(scored);
    }

    static int score(FeedItem item, Set<String> tokens) {
        String hay = (item.title() + "\n" + item.summary()).toLowerCase(Locale.ROOT);
        int total = 0;
        for (String t : tokens) {
            if (!t.isEmpty() && hay.contains(t)) total += weight(t);
        }
        return total;
    }

    static int weight(String token) {
        int len = token.codePointCount(0, token.length());
        return Math.max(MIN_WEIGHT, Math.min(MAX_WEIGHT, len));
    }
}
