package com.articlegate.core.security;

/** URL 검증 거부 사유 코드 */
public enum RejectionReason {
    MALFORMED,
    SCHEME_NOT_ALLOWED,
    CREDENTIALS_PRESENT,
    LOCALHOST,
    DOMAIN_NOT_ALLOWED,
    UNRESOLVABLE,
    BLOCKED_ADDRESS
}
