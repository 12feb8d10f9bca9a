package com.articlegate.core.model;

import java.util.Objects;

/**
 * 호출자에게 노출되는 실패. Kind 는 닫힌 집합이므로 switch 로 빠짐없이 처리할 수 있다.
 */
public record Failure(Kind kind, String reason) {

    public enum Kind {
        /** URL 정책 위반 (스킴/자격증명/차단 주소/허용목록 외 도메인 등) */
        INVALID_URL,
        /** 연결 실패, 타임아웃, 비정상 상태 코드, 리다이렉트 제한 */
        UNREACHABLE,
        TOO_LARGE,
        UNSUPPORTED_CONTENT,
        /** 후보는 있었지만 본문을 하나도 가져오지 못함 */
        NO_CANDIDATES,
        /** 피드 항목 중 키워드와 일치하는 것이 없음 (상위 워크플로의 정상 조기 종료) */
        NO_KEYWORD_MATCH,
        /** 피드 허용 목록이 비어 있음 (설정 오류) */
        NO_FEEDS_CONFIGURED
    }

    public Failure {
        Objects.requireNonNull(kind, "kind");
        reason = reason == null ? "" : reason;
    }

    public static Failure invalidUrl(String reason) { return new Failure(Kind.INVALID_URL, reason); }
    public static Failure unreachable(String reason) { return new Failure(Kind.UNREACHABLE, reason); }
    public static Failure tooLarge(String reason) { return new Failure(Kind.TOO_LARGE, reason); }
    public static Failure unsupportedContent(String reason) { return new Failure(Kind.UNSUPPORTED_CONTENT, reason); }
    public static Failure noCandidates(String reason) { return new Failure(Kind.NO_CANDIDATES, reason); }
    public static Failure noKeywordMatch(String reason) { return new Failure(Kind.NO_KEYWORD_MATCH, reason); }
    public static Failure noFeedsConfigured(String reason) { return new Failure(Kind.NO_FEEDS_CONFIGURED, reason); }

    /** 재시도해도 결과가 바뀌지 않는 실패인지 */
    public boolean isTerminal() {
        return switch (kind) {
            case INVALID_URL, TOO_LARGE, UNSUPPORTED_CONTENT, NO_KEYWORD_MATCH -> true;
            case UNREACHABLE, NO_CANDIDATES, NO_FEEDS_CONFIGURED -> false;
        };
    }
}
