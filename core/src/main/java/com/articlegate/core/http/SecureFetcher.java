package com.articlegate.core.http;

import com.articlegate.core.api.IContentFetcher;
import com.articlegate.core.config.AcquisitionConfig;
import com.articlegate.core.model.FetchResult;
import com.articlegate.core.model.Purpose;
import com.articlegate.core.security.UrlValidator;
import com.articlegate.core.security.ValidationVerdict;
import com.articlegate.core.util.StructuredLog;
import com.articlegate.core.util.UrlLogSanitizer;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;

/**
 * 검증 + 리다이렉트 + 크기 제한을 묶은 페처.
 *
 * 상태: (현재 URL, 홉 수). 재귀 대신 제한된 루프로 돈다.
 *  1) 현재 URL 검증 (실패 → INVALID_URL)
 *  2) 리다이렉트 자동 추적 없이 요청
 *  3) 3xx: 비활성이면 실패, Location 해석 후 홉+1, 최대치 초과면 실패, 다음 루프에서 재검증
 *  4) 2xx 아니면 실패
 *  5) Content-Type 접두어 허용 목록 (헤더 없으면 통과)
 *  6) Content-Length 가 상한 초과면 본문을 읽지 않고 실패
 *  7) 64KiB 청크로 읽다가 누적이 상한을 넘는 순간 버퍼를 버리고 TOO_LARGE
 *
 * 예상 가능한 실패는 예외 대신 FetchOutcome 으로 돌려준다.
 * 호출 간 공유 상태는 불변 설정뿐이라 여러 스레드에서 그대로 써도 된다.
 */
public final class SecureFetcher implements IContentFetcher {

    static final int CHUNK_SIZE = 64 * 1024;
    private static final StructuredLog SLOG = StructuredLog.get(SecureFetcher.class);

    private static final String ACCEPT_ARTICLE = "text/html,application/xhtml+xml;q=0.9,text/plain;q=0.8";
    private static final String ACCEPT_FEED =
            "application/rss+xml,application/atom+xml;q=0.9,application/xml;q=0.8,text/xml;q=0.8,text/plain;q=0.5";

    /** HttpClient 가 직접 관리하는 헤더. 호출자 값은 버린다 */
    static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "date", "expect", "from", "host", "upgrade", "via", "warning");

    private final AcquisitionConfig config;
    private final UrlValidator validator;
    private final HttpTransport transport;

    public SecureFetcher(AcquisitionConfig config) {
        this(config, new UrlValidator(config), new JdkHttpTransport(config));
    }

    public SecureFetcher(AcquisitionConfig config, UrlValidator validator, HttpTransport transport) {
        this.config = Objects.requireNonNull(config, "config");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public FetchOutcome fetch(String url, Purpose purpose, Map<String, String> extraHeaders) {
        Objects.requireNonNull(purpose, "purpose");
        Map<String, String> headers = buildHeaders(purpose, extraHeaders);

        String current = url;
        int hops = 0;
        while (true) {
            ValidationVerdict verdict = validator.validate(current, purpose);
            if (!verdict.isAccepted()) {
                return FetchOutcome.rejected(verdict.reason(), verdict.detail());
            }
            URI target = verdict.url();

            TransportResponse res;
            try {
                res = transport.open(target, headers);
            } catch (IOException e) {
                SLOG.warn("fetch.connect_failed",
                        "url", UrlLogSanitizer.sanitize(target),
                        "error", e.getClass().getSimpleName());
                return FetchOutcome.failed(FetchError.CONNECTION_FAILURE,
                        e.getClass().getSimpleName() + ": " + e.getMessage());
            } catch (IllegalArgumentException e) {
                // HttpClient 가 요청 자체를 만들지 못함 (포트, 헤더 값 등)
                SLOG.warn("fetch.request_rejected",
                        "url", UrlLogSanitizer.sanitize(target),
                        "detail", e.getMessage());
                return FetchOutcome.failed(FetchError.INVALID_URL, "request rejected: " + e.getMessage());
            }

            try (res) {
                int status = res.statusCode();

                if (isRedirect(status)) {
                    if (!config.isAllowRedirects()) {
                        return FetchOutcome.failed(FetchError.REDIRECT_NOT_ALLOWED, "redirects are disabled (" + status + ")");
                    }
                    Optional<String> loc = res.header("Location").map(String::trim).filter(s -> !s.isEmpty());
                    if (loc.isEmpty()) {
                        return FetchOutcome.failed(FetchError.STATUS_ERROR, "redirect without Location (" + status + ")");
                    }
                    URI next;
                    try {
                        next = target.resolve(loc.get());
                    } catch (IllegalArgumentException e) {
                        return FetchOutcome.failed(FetchError.INVALID_URL, "unparseable redirect location");
                    }
                    hops++;
                    if (hops > config.getMaxRedirects()) {
                        return FetchOutcome.failed(FetchError.REDIRECT_LIMIT_EXCEEDED,
                                "more than " + config.getMaxRedirects() + " redirect(s)");
                    }
                    SLOG.debug("fetch.redirect",
                            "hop", hops,
                            "from", UrlLogSanitizer.sanitize(target),
                            "to", UrlLogSanitizer.sanitize(next));
                    current = next.toString();
                    continue;
                }

                if (status < 200 || status > 299) {
                    return FetchOutcome.failed(FetchError.STATUS_ERROR, "http status " + status);
                }

                String rawType = res.header("Content-Type").orElse("");
                String mediaType = mediaType(rawType);
                if (!mediaType.isEmpty() && !isAllowedType(mediaType, config.allowedContentTypes(purpose))) {
                    return FetchOutcome.failed(FetchError.UNSUPPORTED_CONTENT_TYPE, "content type not allowed: " + mediaType);
                }

                long max = config.maxBytes(purpose);
                OptionalLong declared = contentLength(res);
                if (declared.isPresent() && declared.getAsLong() > max) {
                    return FetchOutcome.failed(FetchError.TOO_LARGE,
                            "declared length " + declared.getAsLong() + " exceeds " + max);
                }

                byte[] body;
                try {
                    body = readCapped(res.body(), max);
                } catch (IOException e) {
                    return FetchOutcome.failed(FetchError.CONNECTION_FAILURE,
                            "body read failed: " + e.getClass().getSimpleName() + ": " + e.getMessage());
                }
                if (body == null) {
                    return FetchOutcome.failed(FetchError.TOO_LARGE, "body exceeds " + max + " bytes");
                }

                SLOG.debug("fetch.ok",
                        "purpose", purpose,
                        "url", UrlLogSanitizer.sanitize(target),
                        "bytes", body.length,
                        "redirects", hops);
                return FetchOutcome.ok(new FetchResult(target, body, mediaType, charset(rawType)));
            }
        }
    }

    /** 상한을 넘는 순간 null (부분 버퍼는 버린다) */
    static byte[] readCapped(InputStream in, long max) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        byte[] chunk = new byte[CHUNK_SIZE];
        long total = 0;
        int n;
        while ((n = in.read(chunk)) != -1) {
            if (n == 0) continue;
            total += n;
            if (total > max) {
                return null;
            }
            buf.write(chunk, 0, n);
        }
        return buf.toByteArray();
    }

    private Map<String, String> buildHeaders(Purpose purpose, Map<String, String> extra) {
        Map<String, String> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        h.put("User-Agent", config.getUserAgent());
        h.put("Accept", purpose == Purpose.FEED ? ACCEPT_FEED : ACCEPT_ARTICLE);
        if (extra == null) return h;
        for (Map.Entry<String, String> e : extra.entrySet()) {
            String name = e.getKey();
            if (name == null || e.getValue() == null) continue;
            if (RESTRICTED_HEADERS.contains(name.trim().toLowerCase(Locale.ROOT))) {
                SLOG.warn("fetch.header_dropped", "header", name);
                continue;
            }
            h.put(name, e.getValue());
        }
        return h;
    }

    static boolean isRedirect(int s) {
        return s == 301 || s == 302 || s == 303 || s == 307 || s == 308;
    }

    /** "text/html; charset=utf-8" → "text/html" */
    static String mediaType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String t = (semi >= 0) ? contentType.substring(0, semi) : contentType;
        return t.trim().toLowerCase(Locale.ROOT);
    }

    static String charset(String contentType) {
        if (contentType == null) return null;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String v = p.substring("charset=".length()).trim();
                if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) v = v.substring(1, v.length() - 1);
                return v.isEmpty() ? null : v;
            }
        }
        return null;
    }

    private static boolean isAllowedType(String mediaType, List<String> prefixes) {
        for (String p : prefixes) {
            if (mediaType.startsWith(p)) return true;
        }
        return false;
    }

    /** 숫자가 아니거나 음수면 없는 것으로 보고 스트림 상한에 맡긴다 */
    private static OptionalLong contentLength(TransportResponse res) {
        Optional<String> v = res.header("Content-Length");
        if (v.isEmpty()) return OptionalLong.empty();
        try {
            long n = Long.parseLong(v.get().trim());
            return n >= 0 ? OptionalLong.of(n) : OptionalLong.empty();
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
