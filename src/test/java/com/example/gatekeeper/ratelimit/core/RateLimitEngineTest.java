package com.example.gatekeeper.ratelimit.core;

import com.example.gatekeeper.ratelimit.algorithm.FixedWindowRateLimiter;
import com.example.gatekeeper.ratelimit.algorithm.RateLimitStrategy;
import com.example.gatekeeper.ratelimit.algorithm.SlidingWindowLogRateLimiter;
import com.example.gatekeeper.ratelimit.algorithm.TokenBucketRateLimiter;
import com.example.gatekeeper.ratelimit.config.IdentifierType;
import com.example.gatekeeper.ratelimit.config.RateLimitConfig;
import com.example.gatekeeper.ratelimit.config.StrategyType;
import com.example.gatekeeper.ratelimit.model.CounterRecordCodec;
import com.example.gatekeeper.ratelimit.resolver.AuthenticatedUserLookup;
import com.example.gatekeeper.ratelimit.resolver.IpKeyResolver;
import com.example.gatekeeper.ratelimit.resolver.ServletRateLimitRequest;
import com.example.gatekeeper.ratelimit.store.CounterStore;
import com.example.gatekeeper.ratelimit.store.CounterStoreException;
import com.example.gatekeeper.ratelimit.store.InMemoryCounterStore;
import com.example.gatekeeper.ratelimit.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.mock.web.MockHttpServletRequest;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * RateLimitEngine 테스트
 * 키 분리와 저장소 장애 시 fail-open 동작을 검증합니다.
 */
@Slf4j
@DisplayName("RateLimitEngine 테스트")
class RateLimitEngineTest {

    private final MutableClock clock = new MutableClock(1_000);

    @ParameterizedTest
    @EnumSource(StrategyType.class)
    @DisplayName("fail-open - 저장소가 항상 실패해도 예외 없이 허용되어야 함")
    void testFailOpenOnStoreError(StrategyType strategy) {
        log.info("=== fail-open 테스트 시작 - strategy: {} ===", strategy);

        CounterStore failingStore = mock(CounterStore.class);
        when(failingStore.get(anyString())).thenThrow(new CounterStoreException("connection refused"));
        when(failingStore.increment(anyString(), anyLong())).thenThrow(new CounterStoreException("connection refused"));
        RateLimitEngineFactory factory = factory(failingStore);

        RateLimitEngine engine = factory.createEngine(RateLimitConfig.of(5, 60, strategy, IdentifierType.IP));

        for (int i = 0; i < 10; i++) {
            RateLimitResult result = assertDoesNotThrow(() -> engine.attempt(request("203.0.113.1", null)));
            assertTrue(result.isAllowed(), "저장소 장애 시에는 허용되어야 합니다");
            assertTrue(result.isApproximate(), "추정 결과로 표시되어야 합니다");
            assertEquals(4, result.getRemaining());
            assertEquals(1_060, result.getResetTime());
        }
    }

    @Test
    @DisplayName("저장소 장애가 아닌 예외는 fail-open 하지 않고 전파되어야 함")
    void testProgrammingErrorsPropagate() {
        RateLimitStrategy brokenStrategy = mock(RateLimitStrategy.class);
        when(brokenStrategy.getType()).thenReturn(StrategyType.FIXED);
        when(brokenStrategy.attempt(anyString(), anyInt(), anyInt(), any(Clock.class)))
                .thenThrow(new IllegalStateException("bug"));
        RateLimitEngine engine = new RateLimitEngine(RateLimitConfig.of(5, 60, StrategyType.FIXED, IdentifierType.IP),
                new IpKeyResolver(), brokenStrategy, clock);

        assertThrows(IllegalStateException.class, () -> engine.attempt(request("203.0.113.1", null)));
    }

    @Test
    @DisplayName("fail-open - 손상된 레코드도 저장소 장애로 처리되어야 함")
    void testFailOpenOnCorruptRecord() {
        CounterStore corruptStore = mock(CounterStore.class);
        when(corruptStore.get(anyString())).thenReturn("not-json".getBytes(StandardCharsets.UTF_8));
        RateLimitEngine engine = factory(corruptStore)
                .createEngine(RateLimitConfig.of(5, 60, StrategyType.SLIDING, IdentifierType.IP));

        RateLimitResult result = engine.attempt(request("203.0.113.1", null));

        assertTrue(result.isAllowed());
        assertTrue(result.isApproximate());
    }

    @Test
    @DisplayName("키 분리 - 같은 IP 의 다른 사용자는 각자의 한도를 가져야 함")
    void testDistinctUsersBehindSameIp() {
        RateLimitEngine engine = factory(new InMemoryCounterStore(clock))
                .createEngine(RateLimitConfig.of(2, 60, StrategyType.FIXED, IdentifierType.USER));

        assertTrue(engine.attempt(request("203.0.113.9", "alice")).isAllowed());
        assertTrue(engine.attempt(request("203.0.113.9", "alice")).isAllowed());
        assertFalse(engine.attempt(request("203.0.113.9", "alice")).isAllowed(), "alice 는 한도 초과");

        assertTrue(engine.attempt(request("203.0.113.9", "bob")).isAllowed(), "bob 은 alice 와 카운터를 공유하지 않아야 합니다");
        assertTrue(engine.attempt(request("203.0.113.9", "bob")).isAllowed());
    }

    @Test
    @DisplayName("키 분리 - 다른 IP 의 같은 사용자는 카운터를 공유해야 함")
    void testSameUserOnDifferentIps() {
        RateLimitEngine engine = factory(new InMemoryCounterStore(clock))
                .createEngine(RateLimitConfig.of(2, 60, StrategyType.SLIDING, IdentifierType.USER));

        assertTrue(engine.attempt(request("203.0.113.9", "alice")).isAllowed());
        assertTrue(engine.attempt(request("198.51.100.4", "alice")).isAllowed());
        assertFalse(engine.attempt(request("192.0.2.200", "alice")).isAllowed(), "같은 사용자는 IP 와 무관하게 한도를 공유해야 합니다");
    }

    @Test
    @DisplayName("사용량 조회와 리셋은 호출자의 키 기준이어야 함")
    void testUsageAndReset() {
        RateLimitEngine engine = factory(new InMemoryCounterStore(clock))
                .createEngine(RateLimitConfig.of(2, 60, StrategyType.FIXED, IdentifierType.IP));

        engine.attempt(request("203.0.113.9", null));
        engine.attempt(request("203.0.113.9", null));
        Map<String, Object> usage = engine.usage(request("203.0.113.9", null));
        assertEquals("ip", usage.get("identifier"));
        assertEquals("ip:203.0.113.9", usage.get("key"));
        assertEquals(2L, usage.get("currentRequests"));

        engine.reset(request("203.0.113.9", null));
        assertTrue(engine.attempt(request("203.0.113.9", null)).isAllowed());
    }

    @Test
    @DisplayName("알고리즘은 저장소 오류가 아닌 결과를 그대로 반환해야 함")
    void testDelegatesResult() {
        RateLimitEngine engine = factory(new InMemoryCounterStore(clock))
                .createEngine(RateLimitConfig.of(1, 60, StrategyType.FIXED, IdentifierType.IP));

        engine.attempt(request("203.0.113.9", null));
        RateLimitResult denied = engine.attempt(request("203.0.113.9", null));

        assertFalse(denied.isAllowed());
        assertFalse(denied.isApproximate());
        assertEquals("ip:203.0.113.9", denied.getKey());
        assertEquals(StrategyType.FIXED, denied.getStrategy());
    }

    private RateLimitEngineFactory factory(CounterStore store) {
        CounterRecordCodec codec = new CounterRecordCodec(new ObjectMapper());
        return new RateLimitEngineFactory(
                new FixedWindowRateLimiter(store, "rate_limit"),
                new SlidingWindowLogRateLimiter(store, codec, "rate_limit"),
                new TokenBucketRateLimiter(store, codec, "rate_limit"),
                new IpKeyResolver(),
                clock);
    }

    private static ServletRateLimitRequest request(String remoteAddr, String user) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr(remoteAddr);
        if (user != null) {
            request.setUserPrincipal(() -> user);
        }
        return new ServletRateLimitRequest(request, AuthenticatedUserLookup.principal());
    }
}
