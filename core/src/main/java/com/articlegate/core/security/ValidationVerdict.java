package com.articlegate.core.security;

import java.net.URI;
import java.util.Objects;

/** 검증 결과: 통과(원본 그대로의 URI) 또는 거부(사유 코드 + 설명). */
public final class ValidationVerdict {

    private final URI url;
    private final RejectionReason reason;
    private final String detail;

    private ValidationVerdict(URI url, RejectionReason reason, String detail) {
        this.url = url;
        this.reason = reason;
        this.detail = detail;
    }

    public static ValidationVerdict accept(URI url) {
        return new ValidationVerdict(Objects.requireNonNull(url, "url"), null, "");
    }

    public static ValidationVerdict reject(RejectionReason reason, String detail) {
        return new ValidationVerdict(null, Objects.requireNonNull(reason, "reason"), detail == null ? "" : detail);
    }

    public boolean isAccepted() { return reason == null; }

    /** 통과한 URL. 거부 결과에서 호출하면 IllegalStateException */
    public URI url() {
        if (reason != null) throw new IllegalStateException("rejected: " + reason);
        return url;
    }

    /** 거부 사유 (통과 시 null) */
    public RejectionReason reason() { return reason; }

    public String detail() { return detail; }

    @Override
    public String toString() {
        return isAccepted() ? "Accept[" + url + "]" : "Reject[" + reason + ": " + detail + "]";
    }
}
