package com.example.gatekeeper.ratelimit.core;

import com.example.gatekeeper.ratelimit.algorithm.RateLimitStrategy;
import com.example.gatekeeper.ratelimit.config.RateLimitConfig;
import com.example.gatekeeper.ratelimit.resolver.KeyResolver;
import com.example.gatekeeper.ratelimit.resolver.RateLimitRequest;
import com.example.gatekeeper.ratelimit.store.CounterStoreException;
import com.example.gatekeeper.ratelimit.util.TimeUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 규칙 하나를 적용하는 엔진
 *
 * 키 생성(KeyResolver)과 판단(RateLimitStrategy)을 연결만 하고, HTTP 응답은 만들지 않는다.
 * 저장소 장애(CounterStoreException) 시에는 요청을 허용하고 approximate=true 결과를 돌려준다 (fail-open).
 * 그 외 예외는 프로그래밍 오류이므로 그대로 전파한다.
 */
@Slf4j
@Getter
public class RateLimitEngine {

    private final RateLimitConfig config;
    private final KeyResolver keyResolver;
    private final RateLimitStrategy strategy;
    private final Clock clock;

    public RateLimitEngine(RateLimitConfig config, KeyResolver keyResolver, RateLimitStrategy strategy, Clock clock) {
        this.config = config;
        this.keyResolver = keyResolver;
        this.strategy = strategy;
        this.clock = clock;
    }

    public RateLimitResult attempt(RateLimitRequest request) {
        return attemptForKey(resolveKey(request));
    }

    public RateLimitResult attemptForKey(String key) {
        try {
            return strategy.attempt(key, config.getLimit(), config.getWindowSeconds(), clock);
        } catch (CounterStoreException e) {
            log.warn("Rate limit store unavailable, allowing request - key: {}, strategy: {}, error: {}",
                    key, strategy.getType().getConfigName(), e.getMessage(), e);
            return RateLimitResult.failOpen(config.getLimit(), TimeUtil.currentTimeSeconds(clock),
                    config.getWindowSeconds(), key, strategy.getType());
        }
    }

    public String resolveKey(RateLimitRequest request) {
        return keyResolver.resolve(request);
    }

    //호출자의 현재 윈도우 상태 삭제
    public void reset(RateLimitRequest request) {
        String key = resolveKey(request);
        strategy.reset(key, config.getLimit(), config.getWindowSeconds(), clock);
        log.info("Rate limit reset - key: {}, strategy: {}", key, strategy.getType().getConfigName());
    }

    public Map<String, Object> usage(RateLimitRequest request) {
        String key = resolveKey(request);
        Map<String, Object> usage = new LinkedHashMap<>();
        usage.put("identifier", config.getIdentifier().getConfigName());
        usage.putAll(strategy.usage(key, config.getLimit(), config.getWindowSeconds(), clock));
        return usage;
    }
}
