package com.example.gatekeeper.ratelimit.core;

import com.example.gatekeeper.ratelimit.resolver.RateLimitRequest;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 여러 규칙을 순서대로 적용하는 엔진
 *
 * - 처음으로 거부된 결과를 즉시 반환 (이후 규칙은 소비하지 않음)
 * - 모두 허용되면 remaining 이 가장 작은 결과를 반환
 */
@Slf4j
public class PolicyEngine {

    private final List<RateLimitEngine> engines;

    public PolicyEngine(List<RateLimitEngine> engines) {
        if (engines == null || engines.isEmpty()) {
            throw new IllegalArgumentException("Policy engine requires at least one engine");
        }
        this.engines = List.copyOf(engines);
    }

    public RateLimitResult attempt(RateLimitRequest request) {
        return evaluate(request).getResult();
    }

    //결과와 그 결과를 만든 규칙을 함께 반환
    public Decision evaluate(RateLimitRequest request) {
        Decision tightest = null;
        for (RateLimitEngine engine : engines) {
            RateLimitResult result = engine.attempt(request);
            if (!result.isAllowed()) {
                log.debug("Policy denied by limit {}/{}s - key: {}",
                        engine.getConfig().getLimit(), engine.getConfig().getWindowSeconds(), result.getKey());
                return new Decision(engine, result);
            }
            if (tightest == null || result.getRemaining() < tightest.getResult().getRemaining()) {
                tightest = new Decision(engine, result);
            }
        }
        return tightest;
    }

    public void reset(RateLimitRequest request) {
        for (RateLimitEngine engine : engines) {
            engine.reset(request);
        }
    }

    public List<Map<String, Object>> usage(RateLimitRequest request) {
        List<Map<String, Object>> usage = new ArrayList<>();
        for (RateLimitEngine engine : engines) {
            usage.add(engine.usage(request));
        }
        return usage;
    }

    public List<RateLimitEngine> getEngines() {
        return engines;
    }

    @Getter
    @RequiredArgsConstructor
    public static class Decision {
        private final RateLimitEngine engine;
        private final RateLimitResult result;
    }
}
