package com.articlegate.core.security;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;

/** 호스트명 → 주소 목록 (IPv4/IPv6 모두). 테스트에서 DNS 를 대체하는 주입 지점. */
@FunctionalInterface
public interface HostResolver {

    List<InetAddress> resolve(String host) throws UnknownHostException;

    /** JVM 기본 리졸버 (InetAddress.getAllByName) */
    HostResolver SYSTEM = host -> Arrays.asList(InetAddress.getAllByName(host));
}
