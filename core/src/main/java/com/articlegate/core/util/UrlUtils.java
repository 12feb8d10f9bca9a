package com.articlegate.core.util;

import java.net.IDN;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/** 호스트 정규화 + 동일/하위 도메인 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 호스트 비교용 정규화:
     * - 소문자
     * - 끝의 '.' 제거 (FQDN 표기)
     * - IPv6 리터럴의 대괄호 제거
     * 비ASCII 호스트는 parse 단계에서 이미 punycode 로 바뀌어 들어온다.
     */
    public static String normalizeHost(String host) {
        if (host == null) return "";
        String h = host.trim().toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) h = h.substring(1, h.length() - 1);
        while (h.endsWith(".")) h = h.substring(0, h.length() - 1);
        return h;
    }

    /** URL 문자열의 정규화된 호스트. 파싱 실패/호스트 없음이면 empty */
    public static Optional<String> hostOf(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        try {
            String h = normalizeHost(parse(url.trim()).getHost());
            return h.isEmpty() ? Optional.empty() : Optional.of(h);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /** host 가 domain 과 같거나 그 서브도메인인지 (둘 다 정규화 후 비교) */
    public static boolean isSameOrSubdomain(String host, String domain) {
        String h = normalizeHost(host);
        String d = normalizeHost(domain);
        if (h.isEmpty() || d.isEmpty()) return false;
        return h.equals(d) || h.endsWith("." + d);
    }

    /** 절대 URL 로 볼 수 있는지 (스킴과 호스트가 모두 있음) */
    public static boolean looksAbsolute(String s) {
        if (s == null || s.isBlank()) return false;
        try {
            URI u = parse(s.trim());
            return u.getScheme() != null && u.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * URI 파싱. 호스트에 비ASCII 문자가 있으면 IDN.toASCII 로 punycode 변환한 뒤 파싱한다
     * (java.net.URI 는 비ASCII 호스트를 호스트로 인식하지 않음). 경로/쿼리는 건드리지 않는다.
     */
    public static URI parse(String raw) throws URISyntaxException {
        if (raw == null) throw new URISyntaxException("null", "url is null");
        return new URI(asciiHost(raw));
    }

    static String asciiHost(String raw) {
        int sep = raw.indexOf("://");
        if (sep <= 0) return raw;
        int start = sep + 3;
        int end = start;
        while (end < raw.length() && "/?#".indexOf(raw.charAt(end)) < 0) end++;
        String authority = raw.substring(start, end);
        if (authority.chars().allMatch(c -> c < 0x80)) return raw;

        int at = authority.lastIndexOf('@');
        String userInfo = authority.substring(0, at + 1);
        String hostPort = authority.substring(at + 1);
        String port = "";
        int colon = hostPort.lastIndexOf(':');
        if (colon >= 0 && !hostPort.startsWith("[")) {
            port = hostPort.substring(colon);
            hostPort = hostPort.substring(0, colon);
        }
        String host;
        try {
            host = IDN.toASCII(hostPort);
        } catch (IllegalArgumentException e) {
            // 변환 불가 라벨: 원문 그대로 두면 호스트 없음으로 거부된다
            return raw;
        }
        return raw.substring(0, start) + userInfo + host + port + raw.substring(end);
    }
}
