package com.articlegate.core.config;

import com.articlegate.core.model.LinkScopeMode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * 환경변수 → 설정 덮어쓰기.
 * 해석할 수 없는 값은 무시하고 이전 값(YAML 또는 기본값)을 유지한다.
 * env 는 주입받으므로 테스트에서 System.getenv() 에 의존하지 않는다.
 */
public final class EnvOverrides {

    public static final String URL_ALLOWED_SCHEMES = "URL_ALLOWED_SCHEMES";
    public static final String URL_ALLOWLIST_DOMAINS = "URL_ALLOWLIST_DOMAINS";
    public static final String URL_BLOCK_PRIVATE_IPS = "URL_BLOCK_PRIVATE_IPS";
    public static final String URL_ALLOW_REDIRECTS = "URL_ALLOW_REDIRECTS";
    public static final String URL_MAX_REDIRECTS = "URL_MAX_REDIRECTS";
    public static final String HTTP_MAX_BYTES = "HTTP_MAX_BYTES";
    public static final String RSS_MAX_BYTES = "RSS_MAX_BYTES";
    public static final String HTTP_CONNECT_TIMEOUT_SEC = "HTTP_CONNECT_TIMEOUT_SEC";
    public static final String HTTP_READ_TIMEOUT_SEC = "HTTP_READ_TIMEOUT_SEC";
    public static final String RSS_MAX_FEEDS = "RSS_MAX_FEEDS";
    public static final String RSS_MAX_ARTICLES = "RSS_MAX_ARTICLES";
    public static final String RSS_ITEM_LINK_POLICY = "RSS_ITEM_LINK_POLICY";

    private EnvOverrides() {}

    public static AcquisitionConfig.Builder apply(AcquisitionConfig.Builder b, Map<String, String> env) {
        Objects.requireNonNull(b, "builder");
        Objects.requireNonNull(env, "env");

        // 빈 문자열이면 "설정 안 함"과 같다. 단, 허용목록은 빈 값으로 명시적 해제 가능
        String schemes = env.get(URL_ALLOWED_SCHEMES);
        if (schemes != null && !schemes.isBlank()) b.allowedSchemes(splitList(schemes));
        if (env.containsKey(URL_ALLOWLIST_DOMAINS)) b.allowlistDomains(splitList(env.get(URL_ALLOWLIST_DOMAINS)));

        setBool(env, URL_BLOCK_PRIVATE_IPS, b::blockPrivateIps);
        setBool(env, URL_ALLOW_REDIRECTS, b::allowRedirects);
        setInt(env, URL_MAX_REDIRECTS, b::maxRedirects);
        setLong(env, HTTP_MAX_BYTES, b::articleMaxBytes);
        setLong(env, RSS_MAX_BYTES, b::feedMaxBytes);
        setSeconds(env, HTTP_CONNECT_TIMEOUT_SEC, b::connectTimeout);
        setSeconds(env, HTTP_READ_TIMEOUT_SEC, b::readTimeout);
        setInt(env, RSS_MAX_FEEDS, b::maxFeedsPerCall);
        setInt(env, RSS_MAX_ARTICLES, b::maxSelectedArticles);

        String policy = env.get(RSS_ITEM_LINK_POLICY);
        LinkScopeMode.parse(policy).ifPresent(b::linkScopeMode);
        return b;
    }

    /** "1/true/yes/y/on" → true, "0/false/no/n/off" → false, 그 외 null */
    static Boolean parseBool(String v) {
        if (v == null) return null;
        switch (v.trim().toLowerCase(Locale.ROOT)) {
            case "1": case "true": case "yes": case "y": case "on": return Boolean.TRUE;
            case "0": case "false": case "no": case "n": case "off": return Boolean.FALSE;
            default: return null;
        }
    }

    /** 쉼표/공백(개행 포함) 구분 목록 */
    public static List<String> splitList(String v) {
        List<String> out = new ArrayList<>();
        if (v == null) return out;
        for (String p : v.trim().split("[\\s,]+")) {
            if (!p.isBlank()) out.add(p.trim());
        }
        return out;
    }

    private static void setBool(Map<String, String> env, String key, Consumer<Boolean> setter) {
        Boolean b = parseBool(env.get(key));
        if (b != null) setter.accept(b);
    }

    private static void setInt(Map<String, String> env, String key, IntConsumer setter) {
        String v = env.get(key);
        if (v == null || v.isBlank()) return;
        try {
            setter.accept(Integer.parseInt(v.trim()));
        } catch (NumberFormatException ignore) {
            // 잘못된 숫자는 무시
        }
    }

    private static void setLong(Map<String, String> env, String key, LongConsumer setter) {
        String v = env.get(key);
        if (v == null || v.isBlank()) return;
        try {
            setter.accept(Long.parseLong(v.trim()));
        } catch (NumberFormatException ignore) {
            // 잘못된 숫자는 무시
        }
    }

    private static void setSeconds(Map<String, String> env, String key, Consumer<Duration> setter) {
        setLong(env, key, sec -> {
            if (sec > 0) setter.accept(Duration.ofSeconds(sec));
        });
    }
}
