package com.articlegate.core.http;

import com.articlegate.core.config.AcquisitionConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * java.net.http.HttpClient 기반 전송.
 * - Redirect.NEVER: 리다이렉트는 SecureFetcher 가 홉마다 재검증하며 직접 따라간다
 * - connectTimeout: 클라이언트 단위
 * - readTimeout: 응답 헤더 대기(요청 timeout) + 본문 read 간 idle 제한
 *
 * 호스트명으로 접속하므로 검증 시점과 접속 시점의 DNS 응답이 다를 수 있다 (DESIGN.md 참고).
 */
public final class JdkHttpTransport implements HttpTransport {

    private final HttpClient client;
    private final Duration readTimeout;

    public JdkHttpTransport(AcquisitionConfig config) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .connectTimeout(config.getConnectTimeout())
                        .build(),
                config.getReadTimeout());
    }

    public JdkHttpTransport(HttpClient client, Duration readTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
        if (client.followRedirects() != HttpClient.Redirect.NEVER) {
            throw new IllegalArgumentException("client must not follow redirects");
        }
    }

    @Override
    public TransportResponse open(URI uri, Map<String, String> headers) throws IOException {
        HttpRequest.Builder rb = HttpRequest.newBuilder(uri)
                .timeout(readTimeout)
                .GET();
        if (headers != null) headers.forEach(rb::header);

        try {
            HttpResponse<InputStream> res = client.send(rb.build(), HttpResponse.BodyHandlers.ofInputStream());
            return new TransportResponse(res.statusCode(), res.headers().map(),
                    new IdleTimeoutInputStream(res.body(), readTimeout));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("request interrupted: " + e.getMessage());
        }
    }
}
