package com.articlegate.core.model;

import java.net.URI;
import java.util.Arrays;
import java.util.Objects;

/**
 * 페치 성공 결과.
 * - url: 리다이렉트를 모두 따라간 뒤 검증을 통과한 최종 URL
 * - body: 원본 바이트 (항상 상한 이하, 잘린 본문은 만들어지지 않음)
 * - contentType: 파라미터를 뗀 소문자 media type (헤더가 없으면 "")
 */
public final class FetchResult {
    private final URI url;
    private final byte[] body;
    private final String contentType;
    private final String charset;

    public FetchResult(URI url, byte[] body, String contentType, String charset) {
        this.url = Objects.requireNonNull(url, "url");
        this.body = Objects.requireNonNull(body, "body").clone();
        this.contentType = contentType == null ? "" : contentType;
        this.charset = charset;
    }

    public URI getUrl() { return url; }
    public byte[] getBody() { return body.clone(); }
    public int getSize() { return body.length; }
    public String getContentType() { return contentType; }

    /** Content-Type 의 charset 파라미터 (없으면 null) */
    public String getCharset() { return charset; }

    @Override
    public String toString() {
        return "FetchResult{url=" + url + ", size=" + body.length + ", contentType=" + contentType + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FetchResult that)) return false;
        return url.equals(that.url) && Arrays.equals(body, that.body) && contentType.equals(that.contentType);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(url, contentType) + Arrays.hashCode(body);
    }
}
