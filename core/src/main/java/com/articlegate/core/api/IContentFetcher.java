// IContentFetcher.java
package com.articlegate.core.api;

import com.articlegate.core.http.FetchOutcome;
import com.articlegate.core.model.Purpose;

import java.util.Map;

/** 페치 최소 계약: 검증 → 요청 → 리다이렉트/크기 제어까지 끝낸 결과를 돌려준다. 예외 대신 FetchOutcome. */
public interface IContentFetcher {
    FetchOutcome fetch(String url, Purpose purpose, Map<String, String> extraHeaders);

    default FetchOutcome fetch(String url, Purpose purpose) {
        return fetch(url, purpose, Map.of());
    }
}
