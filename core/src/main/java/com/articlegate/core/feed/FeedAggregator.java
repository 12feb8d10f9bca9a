package com.articlegate.core.feed;

import com.articlegate.core.api.IContentFetcher;
import com.articlegate.core.config.AcquisitionConfig;
import com.articlegate.core.http.FetchOutcome;
import com.articlegate.core.model.FeedItem;
import com.articlegate.core.model.Purpose;
import com.articlegate.core.util.StructuredLog;
import com.articlegate.core.util.UrlLogSanitizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 허용된 피드 목록을 순서대로 받아 항목을 모은다.
 * - 호출당 최대 maxFeedsPerCall 개 피드만 처리
 * - 페치/파싱 실패한 피드는 로그만 남기고 건너뜀 (나머지 피드 처리는 계속)
 * - 결과는 피드 목록 순서대로 이어 붙인 항목
 */
public final class FeedAggregator {

    private static final StructuredLog SLOG = StructuredLog.get(FeedAggregator.class);

    /** 항목 + 그 항목이 나온 피드 URL (링크 범위 판정에 필요) */
    public record SourcedItem(String feedUrl, FeedItem item) {
        public SourcedItem {
            Objects.requireNonNull(feedUrl, "feedUrl");
            Objects.requireNonNull(item, "item");
        }
    }

    private final IContentFetcher fetcher;
    private final FeedParser parser;
    private final int maxFeeds;

    public FeedAggregator(AcquisitionConfig config, IContentFetcher fetcher) {
        this(config, fetcher, new FeedParser());
    }

    public FeedAggregator(AcquisitionConfig config, IContentFetcher fetcher, FeedParser parser) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.maxFeeds = Objects.requireNonNull(config, "config").getMaxFeedsPerCall();
    }

    public List<FeedItem> aggregate(List<String> feedUrls) {
        List<FeedItem> out = new ArrayList<>();
        for (SourcedItem s : collect(feedUrls)) out.add(s.item());
        return out;
    }

    public List<SourcedItem> collect(List<String> feedUrls) {
        List<SourcedItem> out = new ArrayList<>();
        if (feedUrls == null || feedUrls.isEmpty()) return out;

        int processed = 0;
        for (String feedUrl : feedUrls) {
            if (processed >= maxFeeds) {
                SLOG.info("feed.cap_reached", "max", maxFeeds, "configured", feedUrls.size());
                break;
            }
            processed++;
            if (feedUrl == null || feedUrl.isBlank()) continue;

            List<FeedItem> items = loadOne(feedUrl);
            for (FeedItem it : items) out.add(new SourcedItem(feedUrl, it));
        }
        return out;
    }

    /** 한 피드. 실패는 빈 목록 */
    private List<FeedItem> loadOne(String feedUrl) {
        String safeUrl = UrlLogSanitizer.sanitize(feedUrl);
        FetchOutcome fo = fetcher.fetch(feedUrl, Purpose.FEED);
        if (!fo.isOk()) {
            SLOG.warn("feed.fetch_failed", "feed", safeUrl, "error", fo.error(), "detail", fo.detail());
            return List.of();
        }
        try {
            List<FeedItem> items = parser.parse(fo.result().getBody());
            SLOG.debug("feed.parsed", "feed", safeUrl, "items", items.size());
            return items;
        } catch (FeedParser.FeedParseException e) {
            SLOG.warn("feed.parse_failed", "feed", safeUrl, "detail", e.getMessage());
            return List.of();
        }
    }
}
