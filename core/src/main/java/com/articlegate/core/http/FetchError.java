package com.articlegate.core.http;

/** 페치 실패 종류. 어느 것도 이 계층에서 재시도하지 않는다. */
public enum FetchError {
    /** 현재 홉(리다이렉트 대상 포함)이 URL 검증에 실패 */
    INVALID_URL,
    /** 연결 거부, 타임아웃, DNS 실패, 본문 읽기 중 끊김 */
    CONNECTION_FAILURE,
    /** 2xx 가 아닌 최종 상태, 또는 Location 없는 리다이렉트 */
    STATUS_ERROR,
    UNSUPPORTED_CONTENT_TYPE,
    /** 선언된 Content-Length 또는 실제 스트림이 상한 초과 */
    TOO_LARGE,
    REDIRECT_LIMIT_EXCEEDED,
    /** 리다이렉트 비활성 설정에서 3xx 수신 */
    REDIRECT_NOT_ALLOWED
}
