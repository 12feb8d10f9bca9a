package com.articlegate.core.model;

import java.util.Locale;
import java.util.Optional;

/** 피드 항목 링크를 페치 대상으로 받아들이는 범위 */
public enum LinkScopeMode {
    /** A: 피드와 같은 호스트(또는 그 서브도메인)만. 다른 호스트는 도메인 허용목록이 있을 때만 */
    SAME_SITE,
    /** B: 모두 허용하고 안전성은 Validator/Fetcher 에 맡김 */
    PERMISSIVE;

    /** "A"/"B" 약칭과 enum 이름 모두 허용 */
    public static Optional<LinkScopeMode> parse(String s) {
        if (s == null) return Optional.empty();
        String v = s.trim().toUpperCase(Locale.ROOT);
        switch (v) {
            case "A": return Optional.of(SAME_SITE);
            case "B": return Optional.of(PERMISSIVE);
            default:
                for (LinkScopeMode m : values()) {
                    if (m.name().equals(v)) return Optional.of(m);
                }
                return Optional.empty();
        }
    }
}
