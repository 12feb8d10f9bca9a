package com.articlegate.core.security;

import com.articlegate.core.util.UrlUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 도메인 허용 목록.
 * - 완전 일치 또는 서브도메인 허용
 * - "*.example.com" 은 "example.com" 으로 취급
 * - 목록이 비어 있으면 비활성 (isEnabled()=false)
 */
public final class DomainAllowlist {

    private final List<String> domains;

    public DomainAllowlist(List<String> entries) {
        List<String> out = new ArrayList<>();
        if (entries != null) {
            for (String e : entries) {
                String d = UrlUtils.normalizeHost(e);
                if (d.startsWith("*.")) d = d.substring(2);
                if (!d.isEmpty()) out.add(d);
            }
        }
        this.domains = List.copyOf(out);
    }

    public boolean isEnabled() { return !domains.isEmpty(); }

    public List<String> domains() { return domains; }

    public boolean allows(String host) {
        String h = UrlUtils.normalizeHost(host);
        if (h.isEmpty()) return false;
        for (String d : domains) {
            if (UrlUtils.isSameOrSubdomain(h, d)) return true;
        }
        return false;
    }
}
