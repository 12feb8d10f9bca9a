package com.articlegate.core.scope;

import com.articlegate.core.model.LinkScopeMode;
import com.articlegate.core.util.UrlUtils;

import java.util.List;
import java.util.Optional;

/**
 * 피드 항목 링크를 페처에 넘겨도 되는지 판정.
 * Validator 의 도메인 허용 목록과는 별개의 1차 관문이다.
 *
 * - SAME_SITE(A): 피드 호스트와 같거나 그 서브도메인이면 허용.
 *   아니면 도메인 허용 목록이 설정돼 있을 때만 허용 (최종 판정은 Validator 가 다시 한다),
 *   허용 목록이 없으면 거부 → 호출자는 그 항목만 건너뛴다.
 * - PERMISSIVE(B): 항상 허용. 안전성은 Validator/Fetcher 에 전적으로 맡김.
 */
public final class LinkScopePolicy {

    public enum Decision { ALLOW, DENY }

    private LinkScopePolicy() {}

    public static Decision decide(String itemLink, String feedUrl, LinkScopeMode mode, List<String> allowlist) {
        if (mode == LinkScopeMode.PERMISSIVE) return Decision.ALLOW;

        Optional<String> itemHost = UrlUtils.hostOf(itemLink);
        Optional<String> feedHost = UrlUtils.hostOf(feedUrl);
        if (itemHost.isPresent() && feedHost.isPresent()
                && UrlUtils.isSameOrSubdomain(itemHost.get(), feedHost.get())) {
            return Decision.ALLOW;
        }
        boolean hasAllowlist = allowlist != null && allowlist.stream().anyMatch(s -> s != null && !s.isBlank());
        return hasAllowlist ? Decision.ALLOW : Decision.DENY;
    }
}
