package com.articlegate.core.security;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 내부/예약 주소 차단 규칙 목록.
 * 규칙은 순서 있는 독립 predicate 목록이다. 범위를 추가할 때 DEFAULT 목록에 한 줄만 넣으면 된다.
 * IPv4-mapped IPv6 (::ffff:a.b.c.d) 는 판정 전에 IPv4 로 풀어서 본다.
 */
public final class BlockedAddressRules {

    public static final List<AddressRule> DEFAULT_RULES = List.of(
            // IPv4
            CidrRule.of("ipv4-this-network", "0.0.0.0/8"),
            CidrRule.of("ipv4-private-10", "10.0.0.0/8"),
            CidrRule.of("ipv4-shared-cgnat", "100.64.0.0/10"),
            CidrRule.of("ipv4-loopback", "127.0.0.0/8"),
            CidrRule.of("ipv4-link-local", "169.254.0.0/16"),
            CidrRule.of("ipv4-private-172", "172.16.0.0/12"),
            CidrRule.of("ipv4-ietf-protocol", "192.0.0.0/24"),
            CidrRule.of("ipv4-test-net-1", "192.0.2.0/24"),
            CidrRule.of("ipv4-private-192", "192.168.0.0/16"),
            CidrRule.of("ipv4-benchmark", "198.18.0.0/15"),
            CidrRule.of("ipv4-test-net-2", "198.51.100.0/24"),
            CidrRule.of("ipv4-test-net-3", "203.0.113.0/24"),
            CidrRule.of("ipv4-multicast", "224.0.0.0/4"),
            CidrRule.of("ipv4-reserved", "240.0.0.0/4"),
            // IPv6
            CidrRule.of("ipv6-unspecified", "::/128"),
            CidrRule.of("ipv6-loopback", "::1/128"),
            CidrRule.of("ipv6-ipv4-compatible", "::/96"),
            CidrRule.of("ipv6-discard", "100::/64"),
            CidrRule.of("ipv6-documentation", "2001:db8::/32"),
            CidrRule.of("ipv6-unique-local", "fc00::/7"),
            CidrRule.of("ipv6-link-local", "fe80::/10"),
            CidrRule.of("ipv6-site-local", "fec0::/10"),
            CidrRule.of("ipv6-multicast", "ff00::/8")
    );

    private final List<AddressRule> rules;

    public BlockedAddressRules(List<AddressRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public static BlockedAddressRules defaults() {
        return new BlockedAddressRules(DEFAULT_RULES);
    }

    /** 기존 규칙 뒤에 규칙을 덧붙인 새 인스턴스 */
    public BlockedAddressRules with(AddressRule extra) {
        List<AddressRule> out = new ArrayList<>(rules);
        out.add(Objects.requireNonNull(extra, "extra"));
        return new BlockedAddressRules(out);
    }

    public List<AddressRule> rules() { return rules; }

    /** 처음 일치한 규칙. 없으면 empty */
    public Optional<AddressRule> firstMatch(InetAddress address) {
        InetAddress a = unwrapMapped(Objects.requireNonNull(address, "address"));
        for (AddressRule r : rules) {
            if (r.matches(a)) return Optional.of(r);
        }
        return Optional.empty();
    }

    public boolean isBlocked(InetAddress address) {
        return firstMatch(address).isPresent();
    }

    /**
     * ::ffff:a.b.c.d → a.b.c.d.
     * JDK 는 리터럴 파싱 시 이미 Inet4Address 로 바꾸지만, 리졸버가 16바이트 Inet6Address 를 그대로 넘길 수 있다.
     */
    public static InetAddress unwrapMapped(InetAddress address) {
        if (!(address instanceof Inet6Address)) return address;
        byte[] b = address.getAddress();
        for (int i = 0; i < 10; i++) {
            if (b[i] != 0) return address;
        }
        if ((b[10] & 0xFF) != 0xFF || (b[11] & 0xFF) != 0xFF) return address;
        try {
            return (Inet4Address) InetAddress.getByAddress(Arrays.copyOfRange(b, 12, 16));
        } catch (UnknownHostException e) {
            // 4바이트 배열이면 발생하지 않는다
            throw new IllegalStateException(e);
        }
    }
}
