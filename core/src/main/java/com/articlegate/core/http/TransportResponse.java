package com.articlegate.core.http;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/** 상태 코드 + 헤더 + 아직 읽지 않은 본문 스트림. 사용 후 반드시 close. */
public final class TransportResponse implements Closeable {

    private static final Logger LOG = Logger.getLogger(TransportResponse.class.getName());

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final InputStream body;

    public TransportResponse(int statusCode, Map<String, List<String>> headers, InputStream body) {
        this.statusCode = statusCode;
        this.headers = (headers == null) ? Map.of() : headers;
        this.body = (body == null) ? InputStream.nullInputStream() : body;
    }

    /** 테스트/스텁용: 문자열 본문 */
    public static TransportResponse of(int statusCode, Map<String, List<String>> headers, String body) {
        byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        return new TransportResponse(statusCode, headers, new ByteArrayInputStream(bytes));
    }

    public int statusCode() { return statusCode; }

    public Map<String, List<String>> headers() { return headers; }

    /** 첫 번째 헤더 값(대소문자 무시) */
    public Optional<String> header(String name) {
        Objects.requireNonNull(name, "name");
        for (var e : headers.entrySet()) {
            String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? Optional.empty() : Optional.ofNullable(vs.get(0));
            }
        }
        return Optional.empty();
    }

    public InputStream body() { return body; }

    /** 본문을 읽지 않고 닫아도 된다. close 실패는 결과에 영향이 없으므로 로그만 남긴다 */
    @Override
    public void close() {
        try {
            body.close();
        } catch (IOException e) {
            LOG.log(Level.FINE, "response close failed: " + e.getMessage(), e);
        }
    }
}
