package com.articlegate.core.security;

import java.net.InetAddress;

/** 차단 주소 판정 규칙 하나. 이름은 로그/거부 사유에 그대로 쓰인다. */
public interface AddressRule {

    String name();

    boolean matches(InetAddress address);
}
