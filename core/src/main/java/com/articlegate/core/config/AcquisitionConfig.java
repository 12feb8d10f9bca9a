package com.articlegate.core.config;

import com.articlegate.core.model.LinkScopeMode;
import com.articlegate.core.model.Purpose;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 콘텐츠 수집 설정 (acquisition.yml + 환경변수 매핑 대상).
 * 프로세스 시작 시 한 번 만들고 Validator/Fetcher/Aggregator 에 그대로 넘긴다. 생성 후 불변.
 */
public final class AcquisitionConfig {

    public static final long DEFAULT_ARTICLE_MAX_BYTES = 5_000_000L;
    public static final long DEFAULT_FEED_MAX_BYTES = 2_000_000L;
    public static final int MAX_SELECTED_ARTICLES_CEILING = 3;
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) ArticleGate/0.1";

    public static final List<String> DEFAULT_ARTICLE_CONTENT_TYPES =
            List.of("text/html", "application/xhtml", "text/plain");
    public static final List<String> DEFAULT_FEED_CONTENT_TYPES =
            List.of("application/rss", "application/atom", "application/xml", "text/xml", "text/plain");

    private final Set<String> allowedSchemes;
    private final List<String> allowlistDomains;
    private final boolean blockPrivateIps;
    private final boolean allowRedirects;
    private final int maxRedirects;
    private final long articleMaxBytes;
    private final long feedMaxBytes;
    private final List<String> articleContentTypes;
    private final List<String> feedContentTypes;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final int maxFeedsPerCall;
    private final int maxSelectedArticles;
    private final int rankLimit;
    private final LinkScopeMode linkScopeMode;
    private final String userAgent;
    private final List<String> feedUrls;

    private AcquisitionConfig(Builder b) {
        this.allowedSchemes = Set.copyOf(b.allowedSchemes);
        this.allowlistDomains = List.copyOf(b.allowlistDomains);
        this.blockPrivateIps = b.blockPrivateIps;
        this.allowRedirects = b.allowRedirects;
        this.maxRedirects = b.maxRedirects;
        this.articleMaxBytes = b.articleMaxBytes;
        this.feedMaxBytes = b.feedMaxBytes;
        this.articleContentTypes = List.copyOf(b.articleContentTypes);
        this.feedContentTypes = List.copyOf(b.feedContentTypes);
        this.connectTimeout = b.connectTimeout;
        this.readTimeout = b.readTimeout;
        this.maxFeedsPerCall = b.maxFeedsPerCall;
        this.maxSelectedArticles = b.maxSelectedArticles;
        this.rankLimit = b.rankLimit;
        this.linkScopeMode = b.linkScopeMode;
        this.userAgent = b.userAgent;
        this.feedUrls = List.copyOf(b.feedUrls);
    }

    // ---------- getters ----------
    public Set<String> getAllowedSchemes() { return allowedSchemes; }
    public List<String> getAllowlistDomains() { return allowlistDomains; }
    public boolean hasDomainAllowlist() { return !allowlistDomains.isEmpty(); }
    public boolean isBlockPrivateIps() { return blockPrivateIps; }
    public boolean isAllowRedirects() { return allowRedirects; }
    public int getMaxRedirects() { return maxRedirects; }
    public long getArticleMaxBytes() { return articleMaxBytes; }
    public long getFeedMaxBytes() { return feedMaxBytes; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getReadTimeout() { return readTimeout; }
    public int getMaxFeedsPerCall() { return maxFeedsPerCall; }
    public int getMaxSelectedArticles() { return maxSelectedArticles; }
    public int getRankLimit() { return rankLimit; }
    public LinkScopeMode getLinkScopeMode() { return linkScopeMode; }
    public String getUserAgent() { return userAgent; }
    public List<String> getFeedUrls() { return feedUrls; }

    /** 목적별 바이트 상한 */
    public long maxBytes(Purpose purpose) {
        return purpose == Purpose.FEED ? feedMaxBytes : articleMaxBytes;
    }

    /** 목적별 Content-Type 허용 접두어 */
    public List<String> allowedContentTypes(Purpose purpose) {
        return purpose == Purpose.FEED ? feedContentTypes : articleContentTypes;
    }

    public static AcquisitionConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    /** 현재 값을 복사한 빌더 (YAML → 환경변수 순으로 덮어쓸 때 사용) */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.allowedSchemes = new LinkedHashSet<>(allowedSchemes);
        b.allowlistDomains = new ArrayList<>(allowlistDomains);
        b.blockPrivateIps = blockPrivateIps;
        b.allowRedirects = allowRedirects;
        b.maxRedirects = maxRedirects;
        b.articleMaxBytes = articleMaxBytes;
        b.feedMaxBytes = feedMaxBytes;
        b.articleContentTypes = new ArrayList<>(articleContentTypes);
        b.feedContentTypes = new ArrayList<>(feedContentTypes);
        b.connectTimeout = connectTimeout;
        b.readTimeout = readTimeout;
        b.maxFeedsPerCall = maxFeedsPerCall;
        b.maxSelectedArticles = maxSelectedArticles;
        b.rankLimit = rankLimit;
        b.linkScopeMode = linkScopeMode;
        b.userAgent = userAgent;
        b.feedUrls = new ArrayList<>(feedUrls);
        return b;
    }

    @Override
    public String toString() {
        return "AcquisitionConfig{schemes=" + allowedSchemes
                + ", allowlist=" + allowlistDomains
                + ", blockPrivateIps=" + blockPrivateIps
                + ", redirects=" + (allowRedirects ? maxRedirects : "off")
                + ", articleMaxBytes=" + articleMaxBytes
                + ", feedMaxBytes=" + feedMaxBytes
                + ", connectTimeout=" + connectTimeout
                + ", readTimeout=" + readTimeout
                + ", maxFeeds=" + maxFeedsPerCall
                + ", maxArticles=" + maxSelectedArticles
                + ", scope=" + linkScopeMode
                + ", feeds=" + feedUrls.size() + "}";
    }

    // ---------- builder ----------
    public static final class Builder {
        private Set<String> allowedSchemes = new LinkedHashSet<>(List.of("https"));
        private List<String> allowlistDomains = new ArrayList<>();
        private boolean blockPrivateIps = true;
        private boolean allowRedirects = false;
        private int maxRedirects = 2;
        private long articleMaxBytes = DEFAULT_ARTICLE_MAX_BYTES;
        private long feedMaxBytes = DEFAULT_FEED_MAX_BYTES;
        private List<String> articleContentTypes = new ArrayList<>(DEFAULT_ARTICLE_CONTENT_TYPES);
        private List<String> feedContentTypes = new ArrayList<>(DEFAULT_FEED_CONTENT_TYPES);
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(7);
        private int maxFeedsPerCall = 10;
        private int maxSelectedArticles = 1;
        private int rankLimit = 5;
        private LinkScopeMode linkScopeMode = LinkScopeMode.SAME_SITE;
        private String userAgent = DEFAULT_USER_AGENT;
        private List<String> feedUrls = new ArrayList<>();

        private Builder() {}

        public Builder allowedSchemes(List<String> schemes) {
            if (schemes == null) return this;
            Set<String> out = new LinkedHashSet<>();
            for (String s : schemes) {
                if (s != null && !s.isBlank()) out.add(s.trim().toLowerCase(Locale.ROOT));
            }
            this.allowedSchemes = out;
            return this;
        }

        public Builder allowlistDomains(List<String> domains) {
            List<String> out = new ArrayList<>();
            if (domains != null) {
                for (String d : domains) if (d != null && !d.isBlank()) out.add(d.trim());
            }
            this.allowlistDomains = out;
            return this;
        }

        public Builder blockPrivateIps(boolean v) { this.blockPrivateIps = v; return this; }
        public Builder allowRedirects(boolean v) { this.allowRedirects = v; return this; }
        public Builder maxRedirects(int v) { this.maxRedirects = Math.max(0, v); return this; }
        public Builder articleMaxBytes(long v) { this.articleMaxBytes = v; return this; }
        public Builder feedMaxBytes(long v) { this.feedMaxBytes = v; return this; }

        public Builder articleContentTypes(List<String> prefixes) {
            if (prefixes != null && !prefixes.isEmpty()) this.articleContentTypes = lower(prefixes);
            return this;
        }

        public Builder feedContentTypes(List<String> prefixes) {
            if (prefixes != null && !prefixes.isEmpty()) this.feedContentTypes = lower(prefixes);
            return this;
        }

        public Builder connectTimeout(Duration d) { this.connectTimeout = d; return this; }
        public Builder readTimeout(Duration d) { this.readTimeout = d; return this; }
        public Builder maxFeedsPerCall(int v) { this.maxFeedsPerCall = Math.max(1, v); return this; }

        /** [1, 3] 범위로 보정 */
        public Builder maxSelectedArticles(int v) {
            this.maxSelectedArticles = Math.max(1, Math.min(MAX_SELECTED_ARTICLES_CEILING, v));
            return this;
        }

        public Builder rankLimit(int v) { this.rankLimit = Math.max(1, v); return this; }

        public Builder linkScopeMode(LinkScopeMode m) {
            this.linkScopeMode = (m != null ? m : LinkScopeMode.SAME_SITE);
            return this;
        }

        public Builder userAgent(String ua) {
            if (ua != null && !ua.isBlank()) this.userAgent = ua.trim();
            return this;
        }

        public Builder feedUrls(List<String> urls) {
            this.feedUrls = (urls != null ? new ArrayList<>(urls) : new ArrayList<>());
            return this;
        }

        public AcquisitionConfig build() {
            validate();
            return new AcquisitionConfig(this);
        }

        private void validate() {
            if (allowedSchemes.isEmpty()) throw new IllegalArgumentException("allowedSchemes must not be empty");
            if (articleMaxBytes <= 0) throw new IllegalArgumentException("articleMaxBytes must be > 0");
            if (feedMaxBytes <= 0) throw new IllegalArgumentException("feedMaxBytes must be > 0");
            checkTimeout(connectTimeout, "connectTimeout");
            checkTimeout(readTimeout, "readTimeout");
            Objects.requireNonNull(userAgent, "userAgent");
        }

        private static void checkTimeout(Duration d, String name) {
            if (d == null || d.isNegative() || d.isZero())
                throw new IllegalArgumentException(name + " must be > 0");
        }

        private static List<String> lower(List<String> in) {
            List<String> out = new ArrayList<>();
            for (String s : in) if (s != null && !s.isBlank()) out.add(s.trim().toLowerCase(Locale.ROOT));
            return out;
        }
    }
}
