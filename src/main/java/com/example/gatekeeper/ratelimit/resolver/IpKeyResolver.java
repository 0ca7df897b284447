package com.example.gatekeeper.ratelimit.resolver;

import com.example.gatekeeper.ratelimit.config.IdentifierType;
import com.google.common.net.InetAddresses;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.List;

/**
 * 클라이언트 IP 기반 키 생성
 *
 * 확인 순서:
 * 1. X-Forwarded-For (첫 번째 값)
 * 2. X-Real-IP
 * 3. CF-Connecting-IP
 * 4. 전송 계층 주소 (remote address)
 *
 * 헤더 값은 공인 IP 리터럴일 때만 사용하고, remote address 는 문법만 맞으면 사용한다.
 * DNS 조회는 하지 않는다 (Guava InetAddresses).
 * IPv6 는 정규 표기로 변환하고, 서브넷 prefix 가 설정되면 같은 /N 대역을 하나의 키로 묶는다.
 */
@Slf4j
public class IpKeyResolver implements KeyResolver {

    public static final String UNKNOWN = "unknown";

    private static final List<String> PROXY_HEADERS = List.of("X-Forwarded-For", "X-Real-IP", "CF-Connecting-IP");
    private static final int IPV4_BITS = 32;
    private static final int IPV6_BITS = 128;

    private final int ipv4SubnetPrefix;
    private final int ipv6SubnetPrefix;

    public IpKeyResolver() {
        this(IPV4_BITS, IPV6_BITS);
    }

    public IpKeyResolver(int ipv4SubnetPrefix, int ipv6SubnetPrefix) {
        if (ipv4SubnetPrefix < 0 || ipv4SubnetPrefix > IPV4_BITS) {
            throw new IllegalArgumentException("IPv4 subnet prefix must be between 0 and 32");
        }
        if (ipv6SubnetPrefix < 0 || ipv6SubnetPrefix > IPV6_BITS) {
            throw new IllegalArgumentException("IPv6 subnet prefix must be between 0 and 128");
        }
        this.ipv4SubnetPrefix = ipv4SubnetPrefix;
        this.ipv6SubnetPrefix = ipv6SubnetPrefix;
    }

    @Override
    public String resolve(RateLimitRequest request) {
        return "ip:" + clientAddress(request);
    }

    @Override
    public IdentifierType getType() {
        return IdentifierType.IP;
    }

    //키 접두사 없이 정규화된 클라이언트 주소 반환, 찾지 못하면 "unknown"
    public String clientAddress(RateLimitRequest request) {
        for (String header : PROXY_HEADERS) {
            InetAddress candidate = parse(firstValue(request.getHeader(header)));
            if (candidate != null && isPublic(candidate)) {
                return format(candidate);
            }
        }

        InetAddress remote = parse(request.getRemoteAddress());
        if (remote != null) {
            return format(remote);
        }

        log.debug("No valid client address found, using '{}'", UNKNOWN);
        return UNKNOWN;
    }

    private String format(InetAddress address) {
        int prefix = address instanceof Inet4Address ? ipv4SubnetPrefix : ipv6SubnetPrefix;
        int bits = address.getAddress().length * 8;
        if (prefix >= bits) {
            return InetAddresses.toAddrString(address);
        }
        return InetAddresses.toAddrString(mask(address, prefix)) + "/" + prefix;
    }

    // prefix 이후의 호스트 비트를 0으로 만든 네트워크 주소
    static InetAddress mask(InetAddress address, int prefix) {
        int bits = address.getAddress().length * 8;
        BigInteger hostMask = BigInteger.ONE.shiftLeft(bits - prefix).subtract(BigInteger.ONE);
        BigInteger network = InetAddresses.toBigInteger(address).andNot(hostMask);
        return address instanceof Inet4Address
                ? InetAddresses.fromIPv4BigInteger(network)
                : InetAddresses.fromIPv6BigInteger(network);
    }

    private static String firstValue(String headerValue) {
        if (headerValue == null) {
            return null;
        }
        return headerValue.split(",")[0].trim();
    }

    static InetAddress parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String candidate = value.trim();
        if (candidate.startsWith("[") && candidate.endsWith("]")) {
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        if (!InetAddresses.isInetAddress(candidate)) {
            return null;
        }
        return InetAddresses.forString(candidate);
    }

    // 사설/예약 대역이 아닌 주소인지 확인
    static boolean isPublic(InetAddress address) {
        if (address.isAnyLocalAddress() || address.isLoopbackAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isMulticastAddress()) {
            return false;
        }
        byte[] bytes = address.getAddress();
        int first = bytes[0] & 0xFF;
        if (bytes.length == 4) {
            int second = bytes[1] & 0xFF;
            boolean thisNetwork = first == 0;                                // 0.0.0.0/8
            boolean carrierGradeNat = first == 100 && (second & 0xC0) == 64; // 100.64.0.0/10
            boolean reserved = (first & 0xF0) == 0xF0;                       // 240.0.0.0/4
            return !(thisNetwork || carrierGradeNat || reserved);
        }
        return (first & 0xFE) != 0xFC; // fc00::/7 (unique local)
    }
}
