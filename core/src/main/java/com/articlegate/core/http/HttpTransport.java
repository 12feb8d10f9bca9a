package com.articlegate.core.http;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * 단일 HTTP GET 송신 훅. 리다이렉트를 따라가지 않고 응답 헤더까지 받은 뒤 본문은 스트림으로 넘긴다.
 * 프로덕션은 JdkHttpTransport, 테스트는 가짜 구현을 주입한다.
 */
@FunctionalInterface
public interface HttpTransport {

    /** 연결/타임아웃 등 전송 계층 오류는 IOException */
    TransportResponse open(URI uri, Map<String, String> headers) throws IOException;
}
