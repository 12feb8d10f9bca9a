package com.articlegate.core.http;

import com.articlegate.core.model.FetchResult;
import com.articlegate.core.security.RejectionReason;

import java.util.Objects;
import java.util.Optional;

/** 페치 결과: FetchResult 또는 (FetchError, 설명). INVALID_URL 이면 검증 거부 사유도 함께. */
public final class FetchOutcome {

    private final FetchResult result;
    private final FetchError error;
    private final String detail;
    private final RejectionReason rejection;

    private FetchOutcome(FetchResult result, FetchError error, String detail, RejectionReason rejection) {
        this.result = result;
        this.error = error;
        this.detail = detail;
        this.rejection = rejection;
    }

    public static FetchOutcome ok(FetchResult result) {
        return new FetchOutcome(Objects.requireNonNull(result, "result"), null, "", null);
    }

    public static FetchOutcome failed(FetchError error, String detail) {
        return new FetchOutcome(null, Objects.requireNonNull(error, "error"), detail == null ? "" : detail, null);
    }

    public static FetchOutcome rejected(RejectionReason reason, String detail) {
        Objects.requireNonNull(reason, "reason");
        return new FetchOutcome(null, FetchError.INVALID_URL, reason + ": " + (detail == null ? "" : detail), reason);
    }

    public boolean isOk() { return error == null; }

    /** 성공 결과. 실패에서 호출하면 IllegalStateException */
    public FetchResult result() {
        if (error != null) throw new IllegalStateException("fetch failed: " + error + " " + detail);
        return result;
    }

    /** 실패 종류 (성공이면 null) */
    public FetchError error() { return error; }

    public String detail() { return detail; }

    public Optional<RejectionReason> rejection() { return Optional.ofNullable(rejection); }

    @Override
    public String toString() {
        return isOk() ? "Ok[" + result + "]" : "Failed[" + error + ": " + detail + "]";
    }
}
