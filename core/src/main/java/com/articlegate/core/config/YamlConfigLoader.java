package com.articlegate.core.config;

import com.articlegate.core.model.LinkScopeMode;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * acquisition.yml 을 읽어 AcquisitionConfig 로 변환.
 * 적용 순서: 기본값 → YAML → 환경변수. 피드 목록은 환경변수 → YAML feeds.urls → feeds.file 순.
 *
 * 예상 YAML 키:
 * url:
 *   allowedSchemes: ["https"]
 *   allowlistDomains: ["example.com", "*.news.example"]
 *   blockPrivateIps: true
 * redirects:
 *   allow: false
 *   max: 2
 * limits:
 *   articleMaxBytes: 5000000
 *   feedMaxBytes: 2000000
 * timeouts:
 *   connectMs: 3000
 *   readMs: 7000
 * contentTypes:
 *   article: ["text/html", "application/xhtml", "text/plain"]
 *   feed: ["application/rss", "application/atom", "application/xml", "text/xml", "text/plain"]
 * feeds:
 *   urls: []
 *   file: "config/rss_feeds.txt"
 *   maxPerCall: 10
 *   maxArticles: 1
 *   rankLimit: 5
 *   linkPolicy: A          # A | B
 * userAgent: "..."
 */
public final class YamlConfigLoader {

    public static final Path DEFAULT_PATH = Path.of("acquisition.yml");

    private YamlConfigLoader() {}

    /** ./acquisition.yml (없으면 기본값) + 프로세스 환경변수 */
    public static AcquisitionConfig loadDefault() throws IOException {
        return load(DEFAULT_PATH, System.getenv());
    }

    /**
     * yamlPath 가 없으면 YAML 단계는 건너뛴다 (기본값 + 환경변수).
     * YAML 의 feeds.file 상대 경로는 yaml 파일 위치 기준으로 해석한다.
     */
    public static AcquisitionConfig load(Path yamlPath, Map<String, String> env) throws IOException {
        Objects.requireNonNull(env, "env");
        AcquisitionConfig.Builder b = AcquisitionConfig.builder();
        Path feedFile = FeedSourceLoader.DEFAULT_FILE;
        List<String> yamlFeeds = List.of();

        if (yamlPath != null && Files.exists(yamlPath)) {
            Map<?, ?> root = read(yamlPath);
            if (root != null) {
                applyYaml(root, b);
                Map<String, Object> feeds = getMap(root, "feeds");
                if (feeds != null) {
                    yamlFeeds = stringList(feeds.get("urls"));
                    Object f = feeds.get("file");
                    if (f != null) {
                        Path p = Path.of(String.valueOf(f));
                        Path base = yamlPath.toAbsolutePath().getParent();
                        feedFile = (p.isAbsolute() || base == null) ? p : base.resolve(p);
                    }
                }
            }
        }

        EnvOverrides.apply(b, env);

        List<String> feedUrls;
        String envFeeds = env.get(FeedSourceLoader.ENV_FEED_URLS);
        if (envFeeds != null && !envFeeds.isBlank()) {
            feedUrls = FeedSourceLoader.load(env, feedFile);
        } else if (!yamlFeeds.isEmpty()) {
            feedUrls = FeedSourceLoader.dedupe(yamlFeeds);
        } else {
            feedUrls = FeedSourceLoader.readFile(feedFile);
        }
        b.feedUrls(feedUrls);

        return b.build();
    }

    private static Map<?, ?> read(Path yamlPath) throws IOException {
        try (InputStream in = Files.newInputStream(yamlPath)) {
            LoaderOptions opts = new LoaderOptions();
            Yaml yaml = new Yaml(new SafeConstructor(opts));
            Object root = yaml.load(in);
            // 비어있거나 단순 스칼라면 기본값 유지
            return (root instanceof Map<?, ?> map) ? map : null;
        } catch (YAMLException e) {
            throw new IOException("invalid yaml: " + yamlPath + ": " + e.getMessage(), e);
        }
    }

    static void applyYaml(Map<?, ?> map, AcquisitionConfig.Builder b) {
        setString(map, "userAgent", b::userAgent);

        Map<String, Object> url = getMap(map, "url");
        if (url != null) {
            if (url.containsKey("allowedSchemes")) b.allowedSchemes(stringList(url.get("allowedSchemes")));
            if (url.containsKey("allowlistDomains")) b.allowlistDomains(stringList(url.get("allowlistDomains")));
            setBoolean(url, "blockPrivateIps", b::blockPrivateIps);
        }

        Map<String, Object> redirects = getMap(map, "redirects");
        if (redirects != null) {
            setBoolean(redirects, "allow", b::allowRedirects);
            setInt(redirects, "max", b::maxRedirects);
        }

        Map<String, Object> limits = getMap(map, "limits");
        if (limits != null) {
            setLong(limits, "articleMaxBytes", b::articleMaxBytes);
            setLong(limits, "feedMaxBytes", b::feedMaxBytes);
        }

        Map<String, Object> timeouts = getMap(map, "timeouts");
        if (timeouts != null) {
            setMillis(timeouts, "connectMs", b::connectTimeout);
            setMillis(timeouts, "readMs", b::readTimeout);
        }

        Map<String, Object> ct = getMap(map, "contentTypes");
        if (ct != null) {
            b.articleContentTypes(stringList(ct.get("article")));
            b.feedContentTypes(stringList(ct.get("feed")));
        }

        Map<String, Object> feeds = getMap(map, "feeds");
        if (feeds != null) {
            setInt(feeds, "maxPerCall", b::maxFeedsPerCall);
            setInt(feeds, "maxArticles", b::maxSelectedArticles);
            setInt(feeds, "rankLimit", b::rankLimit);
            Object policy = feeds.get("linkPolicy");
            if (policy != null) LinkScopeMode.parse(String.valueOf(policy)).ifPresent(b::linkScopeMode);
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    /** 리스트 또는 "a,b,c" 문자열 모두 지원 */
    private static List<String> stringList(Object v) {
        List<String> out = new ArrayList<>();
        if (v == null) return out;
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null && !String.valueOf(o).isBlank()) out.add(String.valueOf(o).trim());
            return out;
        }
        return EnvOverrides.splitList(String.valueOf(v));
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean bool) setter.accept(bool);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setMillis(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMillis(ms));
    }
}
