package com.articlegate.core.rank;

import com.articlegate.core.model.FeedItem;
import com.articlegate.core.model.ScoredItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RelevanceRankerTest {

    private final RelevanceRanker ranker = new RelevanceRanker();

    private static FeedItem item(String title, String summary) {
        return new FeedItem(title, "https://news.example.com/" + Math.abs((title + summary).hashCode()), summary, "");
    }

    @Test
    void cjk_single_token_gets_bigrams() {
        assertThat(QueryTokenizer.tokenize("量子コンピュータ"))
                .startsWith("量子コンピュータ")
                .contains("量子", "子コ", "ータ");
    }

    @Test
    void short_or_multi_token_queries_get_no_bigrams() {
        assertThat(QueryTokenizer.tokenize("量子計")).containsExactly("量子計");
        assertThat(QueryTokenizer.tokenize("量子 コンピュータ")).containsExactly("量子", "コンピュータ");
        assertThat(QueryTokenizer.tokenize("Quantum")).containsExactly("quantum");
    }

    @Test
    void tokens_are_case_folded_and_unique() {
        assertThat(QueryTokenizer.tokenize("  AI ai　Ai  chips ")).containsExactly("ai", "chips");
        assertThat(QueryTokenizer.tokenize("   ")).isEmpty();
        assertThat(QueryTokenizer.tokenize(null)).isEmpty();
    }

    @Test
    void bigram_count_is_capped() {
        String longCjk = "あ".repeat(100) + "い";
        // 같은 조각은 하나로 합쳐지므로 bigrams() 자체로 상한 확인
        assertThat(QueryTokenizer.bigrams(longCjk)).hasSize(QueryTokenizer.MAX_BIGRAMS);
    }

    @Test
    void more_bigram_overlap_ranks_higher() {
        FeedItem partial = item("量子の話", "");
        FeedItem exact = item("量子コンピュータの新展開", "");
        FeedItem none = item("Weather today", "sunny");

        List<ScoredItem> out = ranker.rank(List.of(partial, none, exact), "量子コンピュータ", 5);

        assertThat(out).extracting(ScoredItem::item).containsExactly(exact, partial);
        assertThat(out.get(0).score()).isGreaterThan(out.get(1).score());
    }

    @Test
    void zero_score_items_excluded() {
        List<ScoredItem> out = ranker.rank(List.of(item("cats", "dogs")), "quantum", 5);
        assertThat(out).isEmpty();
    }

    @Test
    void ties_keep_input_order_and_limit_applies() {
        FeedItem a = item("ai news A", "");
        FeedItem b = item("ai news B", "");
        FeedItem c = item("ai news C", "");

        List<ScoredItem> out = ranker.rank(List.of(a, b, c), "ai", 2);

        assertThat(out).extracting(ScoredItem::item).containsExactly(a, b);
    }

    @Test
    void summary_counts_and_weight_is_clamped() {
        FeedItem inSummary = item("headline", "about superconductivity");
        List<ScoredItem> out = ranker.rank(List.of(inSummary), "Superconductivity", 1);
        assertThat(out).singleElement().extracting(ScoredItem::score).isEqualTo(RelevanceRanker.MAX_WEIGHT);

        assertThat(RelevanceRanker.weight("a")).isEqualTo(1);
        assertThat(RelevanceRanker.weight("量子")).isEqualTo(2);
    }

    @Test
    void title_and_summary_are_not_glued() {
        // "ab" + "\n" + "cd" 에서 "bc" 는 일치하면 안 된다
        assertThat(ranker.rank(List.of(item("ab", "cd")), "bc", 5)).isEmpty();
    }

    @Test
    void empty_query_or_non_positive_limit() {
        List<FeedItem> items = List.of(item("x", "y"));
        assertThat(ranker.rank(items, "", 5)).isEmpty();
        assertThat(ranker.rank(items, "x", 0)).isEmpty();
        assertThat(ranker.rank(List.of(), "x", 5)).isEmpty();
    }
}
