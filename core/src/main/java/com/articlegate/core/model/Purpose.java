package com.articlegate.core.model;

/** 요청 목적: 목적별로 크기 상한과 허용 Content-Type 이 달라진다. */
public enum Purpose {
    ARTICLE,
    FEED
}
