package com.articlegate.core.service;

import com.articlegate.core.api.IContentFetcher;
import com.articlegate.core.config.AcquisitionConfig;
import com.articlegate.core.extract.ArticleExtractor;
import com.articlegate.core.feed.FeedAggregator;
import com.articlegate.core.http.FetchError;
import com.articlegate.core.http.FetchOutcome;
import com.articlegate.core.http.SecureFetcher;
import com.articlegate.core.model.AcquisitionResult;
import com.articlegate.core.model.ArticleDocument;
import com.articlegate.core.model.Failure;
import com.articlegate.core.model.FeedItem;
import com.articlegate.core.model.Purpose;
import com.articlegate.core.model.ScoredItem;
import com.articlegate.core.rank.RelevanceRanker;
import com.articlegate.core.scope.LinkScopePolicy;
import com.articlegate.core.util.StructuredLog;
import com.articlegate.core.util.UrlLogSanitizer;
import com.articlegate.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 호출자 진입점:
 *  - fetchDirect: URL 하나 → 검증 → 페치 → 본문 추출
 *  - searchFeeds: 피드 수집 → 랭킹 → 링크 범위 판정 → 후보 기사 페치 (최대 maxSelectedArticles 건)
 *  - acquire: 절대 URL 이면 fetchDirect, 아니면 키워드로 searchFeeds
 *
 * 배치 안의 개별 실패(피드 하나, 후보 하나)는 로그 후 건너뛰고,
 * 후보를 전부 소진했을 때만 Failure 로 돌려준다.
 */
public final class ContentAcquisitionService {

    private static final Logger LOG = LoggerFactory.getLogger(ContentAcquisitionService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ContentAcquisitionService.class);

    private final AcquisitionConfig config;
    private final IContentFetcher fetcher;
    private final FeedAggregator aggregator;
    private final RelevanceRanker ranker;
    private final ArticleExtractor extractor;

    /** 기본 구현 */
    public ContentAcquisitionService(AcquisitionConfig config) {
        this(config, new SecureFetcher(config));
    }

    /** 페처 주입 (테스트용) */
    public ContentAcquisitionService(AcquisitionConfig config, IContentFetcher fetcher) {
        this(config, fetcher, new FeedAggregator(config, fetcher), new RelevanceRanker(), new ArticleExtractor());
    }

    public ContentAcquisitionService(AcquisitionConfig config,
                                     IContentFetcher fetcher,
                                     FeedAggregator aggregator,
                                     RelevanceRanker ranker,
                                     ArticleExtractor extractor) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /** 주제 문자열 분기: 절대 URL → fetchDirect, 그 외 → searchFeeds */
    public AcquisitionResult<List<ArticleDocument>> acquire(String topic) {
        if (topic == null || topic.isBlank()) {
            return AcquisitionResult.failure(Failure.invalidUrl("empty topic"));
        }
        String t = topic.strip();
        if (UrlUtils.looksAbsolute(t)) {
            return fetchDirect(t).map(doc -> List.of(doc));
        }
        return searchFeeds(t);
    }

    public AcquisitionResult<ArticleDocument> fetchDirect(String url) {
        FetchOutcome fo = fetcher.fetch(url, Purpose.ARTICLE);
        if (!fo.isOk()) {
            SLOG.info("direct.failed", "url", UrlLogSanitizer.sanitize(url), "error", fo.error());
            return AcquisitionResult.failure(toFailure(fo));
        }
        return AcquisitionResult.success(extractor.extract(fo.result(), null));
    }

    public AcquisitionResult<List<ArticleDocument>> searchFeeds(String query) {
        List<String> feeds = config.getFeedUrls();
        if (feeds.isEmpty()) {
            return AcquisitionResult.failure(Failure.noFeedsConfigured("no feed URLs configured"));
        }

        List<FeedAggregator.SourcedItem> sourced = aggregator.collect(feeds);
        if (sourced.isEmpty()) {
            return AcquisitionResult.failure(Failure.unreachable("no feed produced any items"));
        }

        // 랭커는 같은 FeedItem 인스턴스를 돌려주므로 identity 로 출처 피드를 되찾는다
        Map<FeedItem, String> origin = new IdentityHashMap<>();
        List<FeedItem> items = new ArrayList<>(sourced.size());
        for (FeedAggregator.SourcedItem s : sourced) {
            origin.put(s.item(), s.feedUrl());
            items.add(s.item());
        }

        List<ScoredItem> ranked = ranker.rank(items, query, config.getRankLimit());
        if (ranked.isEmpty()) {
            SLOG.info("search.no_match", "items", items.size());
            return AcquisitionResult.failure(Failure.noKeywordMatch("no feed item matched the query"));
        }

        int cap = config.getMaxSelectedArticles();
        List<ArticleDocument> docs = new ArrayList<>();
        for (ScoredItem cand : ranked) {
            if (docs.size() >= cap) break;
            FeedItem item = cand.item();
            String safeLink = UrlLogSanitizer.sanitize(item.link());

            LinkScopePolicy.Decision d = LinkScopePolicy.decide(
                    item.link(), origin.get(item), config.getLinkScopeMode(), config.getAllowlistDomains());
            if (d == LinkScopePolicy.Decision.DENY) {
                SLOG.info("candidate.out_of_scope", "link", safeLink, "mode", config.getLinkScopeMode());
                continue;
            }

            FetchOutcome fo = fetcher.fetch(item.link(), Purpose.ARTICLE);
            if (!fo.isOk()) {
                SLOG.warn("candidate.fetch_failed", "link", safeLink, "error", fo.error(), "detail", fo.detail());
                continue;
            }
            docs.add(extractor.extract(fo.result(), item.title()));
            SLOG.debug("candidate.fetched", "link", safeLink, "score", cand.score());
        }

        if (docs.isEmpty()) {
            return AcquisitionResult.failure(Failure.noCandidates(
                    "none of " + ranked.size() + " ranked candidates could be fetched"));
        }
        LOG.info("search: fetched {} of {} ranked candidates", docs.size(), ranked.size());
        return AcquisitionResult.success(List.copyOf(docs));
    }

    /** 페처 오류 → 호출자 Failure */
    static Failure toFailure(FetchOutcome fo) {
        FetchError e = fo.error();
        String detail = fo.detail();
        return switch (e) {
            case INVALID_URL -> Failure.invalidUrl(detail);
            case CONNECTION_FAILURE, STATUS_ERROR, REDIRECT_LIMIT_EXCEEDED, REDIRECT_NOT_ALLOWED ->
                    Failure.unreachable(e + ": " + detail);
            case TOO_LARGE -> Failure.tooLarge(detail);
            case UNSUPPORTED_CONTENT_TYPE -> Failure.unsupportedContent(detail);
        };
    }
}
