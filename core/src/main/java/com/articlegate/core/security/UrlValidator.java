package com.articlegate.core.security;

import com.articlegate.core.config.AcquisitionConfig;
import com.articlegate.core.model.Purpose;
import com.articlegate.core.util.StructuredLog;
import com.articlegate.core.util.UrlLogSanitizer;
import com.articlegate.core.util.UrlUtils;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 외부 HTTP 접근용 URL 검증 (SSRF 방지).
 *
 * 검사 순서 (하나라도 실패하면 즉시 거부):
 *  1) 파싱: 스킴과 호스트 필수
 *  2) 스킴 허용 목록 (기본 https 만)
 *  3) userinfo(자격증명) 포함 거부
 *  4) "localhost" / "localhost." 거부
 *  5) 도메인 허용 목록이 설정돼 있으면 일치/서브도메인만
 *  6) DNS 로 모든 주소 해석. 주소 0개는 거부 (확인 불가 = 위험)
 *  7) 해석된 주소 중 하나라도 차단 범위면 거부 (IPv4-mapped 는 IPv4 로 풀어서 판정)
 *
 * 통과 시 입력 URL 을 그대로 돌려준다. 예외는 비ASCII 호스트뿐이며 punycode 로 바뀐다.
 * 포트는 0..65535 범위만 받는다.
 * 리다이렉트 매 홉마다 다시 호출되며 DNS 결과를 캐시하지 않는다.
 * 상태 없음: 여러 스레드에서 공유 가능.
 */
public final class UrlValidator {

    private static final StructuredLog SLOG = StructuredLog.get(UrlValidator.class);

    private final Set<String> allowedSchemes;
    private final DomainAllowlist allowlist;
    private final boolean blockPrivateIps;
    private final HostResolver resolver;
    private final BlockedAddressRules blocked;

    public UrlValidator(AcquisitionConfig config) {
        this(config, HostResolver.SYSTEM, BlockedAddressRules.defaults());
    }

    public UrlValidator(AcquisitionConfig config, HostResolver resolver) {
        this(config, resolver, BlockedAddressRules.defaults());
    }

    public UrlValidator(AcquisitionConfig config, HostResolver resolver, BlockedAddressRules blocked) {
        Objects.requireNonNull(config, "config");
        this.allowedSchemes = config.getAllowedSchemes();
        this.allowlist = new DomainAllowlist(config.getAllowlistDomains());
        this.blockPrivateIps = config.isBlockPrivateIps();
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.blocked = Objects.requireNonNull(blocked, "blocked");
    }

    public ValidationVerdict validate(String url, Purpose purpose) {
        ValidationVerdict v = check(url);
        if (!v.isAccepted()) {
            SLOG.info("url.rejected",
                    "purpose", purpose,
                    "reason", v.reason(),
                    "detail", v.detail(),
                    "url", UrlLogSanitizer.sanitize(url));
        }
        return v;
    }

    public ValidationVerdict validate(URI url, Purpose purpose) {
        return validate(url == null ? null : url.toString(), purpose);
    }

    private ValidationVerdict check(String url) {
        String raw = (url == null) ? "" : url.strip();
        if (raw.isEmpty()) {
            return ValidationVerdict.reject(RejectionReason.MALFORMED, "empty url");
        }

        // 1) 파싱
        URI u;
        try {
            u = UrlUtils.parse(raw);
        } catch (URISyntaxException e) {
            return ValidationVerdict.reject(RejectionReason.MALFORMED, "unparseable url");
        }
        if (u.getScheme() == null || u.getRawAuthority() == null) {
            return ValidationVerdict.reject(RejectionReason.MALFORMED, "scheme and host are required");
        }

        // 2) 스킴
        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        if (!allowedSchemes.contains(scheme)) {
            return ValidationVerdict.reject(RejectionReason.SCHEME_NOT_ALLOWED, "scheme not allowed: " + scheme);
        }

        // 3) userinfo 금지 (호스트 파싱 전에 본다: "user@host" 는 호스트 파싱이 실패할 수 있음)
        if (u.getRawUserInfo() != null || u.getRawAuthority().contains("@")) {
            return ValidationVerdict.reject(RejectionReason.CREDENTIALS_PRESENT, "credentials in url");
        }

        if (u.getPort() > 65535) {
            return ValidationVerdict.reject(RejectionReason.MALFORMED, "port out of range: " + u.getPort());
        }

        String host = UrlUtils.normalizeHost(u.getHost());
        if (host.isEmpty()) {
            return ValidationVerdict.reject(RejectionReason.MALFORMED, "invalid host");
        }

        // 4) localhost
        if (host.equals("localhost")) {
            return ValidationVerdict.reject(RejectionReason.LOCALHOST, "localhost is not allowed");
        }

        // 5) 도메인 허용 목록 (선택)
        if (allowlist.isEnabled() && !allowlist.allows(host)) {
            return ValidationVerdict.reject(RejectionReason.DOMAIN_NOT_ALLOWED, "domain not in allowlist: " + host);
        }

        // 6, 7) DNS 해석 + 내부 주소 차단
        if (blockPrivateIps) {
            List<InetAddress> addrs = resolve(host);
            if (addrs.isEmpty()) {
                return ValidationVerdict.reject(RejectionReason.UNRESOLVABLE, "host did not resolve: " + host);
            }
            for (InetAddress a : addrs) {
                Optional<AddressRule> hit = blocked.firstMatch(a);
                if (hit.isPresent()) {
                    return ValidationVerdict.reject(RejectionReason.BLOCKED_ADDRESS,
                            "blocked address " + a.getHostAddress() + " (" + hit.get().name() + ")");
                }
            }
        }

        return ValidationVerdict.accept(u);
    }

    private List<InetAddress> resolve(String host) {
        try {
            List<InetAddress> out = resolver.resolve(host);
            if (out == null) return List.of();
            // 중복 제거, 순서 유지
            return List.copyOf(new LinkedHashSet<>(out));
        } catch (UnknownHostException | SecurityException e) {
            SLOG.debug("dns.failed", "host", host, "error", e.getClass().getSimpleName());
            return List.of();
        }
    }
}
