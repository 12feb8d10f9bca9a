package com.articlegate.core.support;

import com.articlegate.core.security.HostResolver;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 테스트용 리졸버: 실제 DNS 없이 호스트 → 주소 표를 돌려준다.
 * - 표에 없는 이름은 공인 주소(93.184.216.34)
 * - 숫자 리터럴은 그대로 파싱 (getByName 은 리터럴이면 조회하지 않음)
 */
public final class StubResolver implements HostResolver {

    public static final String PUBLIC_IP = "93.184.216.34";

    private final Map<String, List<InetAddress>> table = new HashMap<>();
    private final List<String> lookups = new ArrayList<>();

    public StubResolver map(String host, InetAddress... addrs) {
        table.put(host, List.of(addrs));
        return this;
    }

    public StubResolver map(String host, String... literals) {
        List<InetAddress> out = new ArrayList<>();
        for (String l : literals) out.add(ip(l));
        table.put(host, out);
        return this;
    }

    /** 해석 실패 (UnknownHostException) */
    public StubResolver unresolvable(String host) {
        table.put(host, List.of());
        return this;
    }

    public List<String> lookups() { return lookups; }

    @Override
    public List<InetAddress> resolve(String host) throws UnknownHostException {
        lookups.add(host);
        List<InetAddress> hit = table.get(host);
        if (hit != null) {
            if (hit.isEmpty()) throw new UnknownHostException(host);
            return hit;
        }
        if (isLiteral(host)) return List.of(InetAddress.getByName(host));
        return List.of(ip(PUBLIC_IP));
    }

    public static InetAddress ip(String literal) {
        if (!isLiteral(literal)) throw new IllegalArgumentException("not a literal: " + literal);
        try {
            return InetAddress.getByName(literal);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException(literal, e);
        }
    }

    private static boolean isLiteral(String s) {
        return s.indexOf(':') >= 0 || s.matches("\\d{1,3}(\\.\\d{1,3}){3}");
    }
}
