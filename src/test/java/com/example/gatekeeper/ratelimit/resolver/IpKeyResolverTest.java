package com.example.gatekeeper.ratelimit.resolver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IP Key Resolver 테스트")
class IpKeyResolverTest {

    private IpKeyResolver resolver;
    private MockHttpServletRequest servletRequest;

    @BeforeEach
    void setUp() {
        resolver = new IpKeyResolver();
        servletRequest = new MockHttpServletRequest();
        servletRequest.setRemoteAddr("10.0.0.5");
    }

    @Test
    @DisplayName("X-Forwarded-For 의 첫 번째 공인 IP 를 사용해야 함")
    void testForwardedForFirstValue() {
        servletRequest.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");

        assertEquals("ip:203.0.113.7", resolve());
    }

    @Test
    @DisplayName("사설/예약 대역 헤더 값은 무시하고 다음 후보를 사용해야 함")
    void testPrivateHeaderValuesAreIgnored() {
        servletRequest.addHeader("X-Forwarded-For", "192.168.1.10");
        servletRequest.addHeader("X-Real-IP", "100.64.3.4");
        servletRequest.addHeader("CF-Connecting-IP", "198.51.100.20");

        assertEquals("ip:198.51.100.20", resolve());
    }

    @Test
    @DisplayName("유효한 헤더가 없으면 사설 대역이라도 remote address 를 사용해야 함")
    void testFallsBackToRemoteAddress() {
        servletRequest.addHeader("X-Forwarded-For", "not-an-ip");
        servletRequest.addHeader("X-Real-IP", "127.0.0.1");

        assertEquals("ip:10.0.0.5", resolve());
    }

    @Test
    @DisplayName("어떤 후보도 유효하지 않으면 unknown")
    void testUnknown() {
        servletRequest.setRemoteAddr("");

        assertEquals("ip:unknown", resolve());
    }

    @Test
    @DisplayName("호스트 이름은 DNS 조회 없이 거부되어야 함")
    void testHostNamesAreRejected() {
        servletRequest.addHeader("X-Forwarded-For", "example.com");
        servletRequest.setRemoteAddr("localhost");

        assertEquals("ip:unknown", resolve());
    }

    @Test
    @DisplayName("IPv6 는 정규 표기로 변환되어야 함")
    void testIpv6Canonical() {
        servletRequest.addHeader("X-Forwarded-For", "2001:0DB8:0000:0000:0000:0000:0000:0001");

        assertEquals("ip:2001:db8::1", resolve());
    }

    @Test
    @DisplayName("IPv4-mapped IPv6 는 IPv4 로 취급되어야 함")
    void testIpv4MappedAddress() {
        servletRequest.setRemoteAddr("::ffff:8.8.8.8");

        assertEquals("ip:8.8.8.8", resolve());
    }

    @Test
    @DisplayName("unique local IPv6 헤더 값은 무시되어야 함")
    void testUniqueLocalIpv6Ignored() {
        servletRequest.addHeader("X-Forwarded-For", "fd12:3456::1");
        servletRequest.setRemoteAddr("[2001:db8::2]");

        assertEquals("ip:2001:db8::2", resolve());
    }

    @Test
    @DisplayName("서브넷 마스킹 - 같은 대역은 같은 키를 가져야 함")
    void testSubnetMasking() {
        IpKeyResolver masking = new IpKeyResolver(24, 64);

        MockHttpServletRequest first = new MockHttpServletRequest();
        first.setRemoteAddr("203.0.113.57");
        MockHttpServletRequest second = new MockHttpServletRequest();
        second.setRemoteAddr("203.0.113.200");
        MockHttpServletRequest v6 = new MockHttpServletRequest();
        v6.setRemoteAddr("2001:db8:1:2:aaaa:bbbb:cccc:dddd");

        assertEquals("ip:203.0.113.0/24", masking.resolve(wrap(first)));
        assertEquals(masking.resolve(wrap(first)), masking.resolve(wrap(second)));
        assertEquals("ip:2001:db8:1:2::/64", masking.resolve(wrap(v6)));
    }

    @Test
    @DisplayName("잘못된 서브넷 prefix 는 거부되어야 함")
    void testInvalidPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new IpKeyResolver(33, 128));
        assertThrows(IllegalArgumentException.class, () -> new IpKeyResolver(32, -1));
    }

    private String resolve() {
        return resolver.resolve(wrap(servletRequest));
    }

    static ServletRateLimitRequest wrap(MockHttpServletRequest request) {
        return new ServletRateLimitRequest(request, AuthenticatedUserLookup.principal());
    }
}
