package com.articlegate.core.security;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/** "10.0.0.0/8", "fe80::/10" 형태의 CIDR 범위 규칙. 주소 패밀리가 다르면 불일치. */
public final class CidrRule implements AddressRule {

    private final String name;
    private final String cidr;
    private final byte[] network;
    private final int prefixLength;

    private CidrRule(String name, String cidr, byte[] network, int prefixLength) {
        this.name = name;
        this.cidr = cidr;
        this.network = network;
        this.prefixLength = prefixLength;
    }

    /** cidr 은 숫자 리터럴만 허용 (DNS 조회 없음) */
    public static CidrRule of(String name, String cidr) {
        Objects.requireNonNull(cidr, "cidr");
        int slash = cidr.indexOf('/');
        if (slash < 0) throw new IllegalArgumentException("not a CIDR: " + cidr);
        String addr = cidr.substring(0, slash);
        int prefix = Integer.parseInt(cidr.substring(slash + 1));
        if (!isLiteral(addr)) throw new IllegalArgumentException("CIDR must use a numeric address: " + cidr);
        byte[] bytes;
        try {
            bytes = InetAddress.getByName(addr).getAddress();
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("bad CIDR address: " + cidr, e);
        }
        if (prefix < 0 || prefix > bytes.length * 8) {
            throw new IllegalArgumentException("bad prefix length: " + cidr);
        }
        return new CidrRule(name, cidr, bytes, prefix);
    }

    @Override public String name() { return name; }

    public String cidr() { return cidr; }

    @Override
    public boolean matches(InetAddress address) {
        if (address == null) return false;
        byte[] a = address.getAddress();
        if (a.length != network.length) return false;

        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (a[i] != network[i]) return false;
        }
        int rem = prefixLength % 8;
        if (rem == 0) return true;
        int mask = (0xFF << (8 - rem)) & 0xFF;
        return (a[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    private static boolean isLiteral(String s) {
        return s.indexOf(':') >= 0 || s.matches("\\d{1,3}(\\.\\d{1,3}){3}");
    }

    @Override
    public String toString() { return name + "(" + cidr + ")"; }
}
