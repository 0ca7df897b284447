package com.example.gatekeeper.ratelimit.core;

import com.example.gatekeeper.ratelimit.algorithm.FixedWindowRateLimiter;
import com.example.gatekeeper.ratelimit.algorithm.RateLimitStrategy;
import com.example.gatekeeper.ratelimit.algorithm.SlidingWindowLogRateLimiter;
import com.example.gatekeeper.ratelimit.algorithm.TokenBucketRateLimiter;
import com.example.gatekeeper.ratelimit.config.IdentifierType;
import com.example.gatekeeper.ratelimit.config.RateLimitConfig;
import com.example.gatekeeper.ratelimit.config.RateLimitPolicy;
import com.example.gatekeeper.ratelimit.config.StrategyType;
import com.example.gatekeeper.ratelimit.resolver.CompositeKeyResolver;
import com.example.gatekeeper.ratelimit.resolver.HeaderKeyResolver;
import com.example.gatekeeper.ratelimit.resolver.IpKeyResolver;
import com.example.gatekeeper.ratelimit.resolver.KeyResolver;
import com.example.gatekeeper.ratelimit.resolver.UserKeyResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * RateLimitConfig 로부터 엔진을 조립하는 팩토리
 *
 * 알고리즘 인스턴스는 상태를 저장소에만 두므로 타입별로 하나씩 공유한다.
 */
@Slf4j
public class RateLimitEngineFactory {

    private final FixedWindowRateLimiter fixedWindow;
    private final SlidingWindowLogRateLimiter slidingWindow;
    private final TokenBucketRateLimiter tokenBucket;
    private final IpKeyResolver ipKeyResolver;
    private final UserKeyResolver userKeyResolver;
    private final Clock clock;

    public RateLimitEngineFactory(FixedWindowRateLimiter fixedWindow,
                                  SlidingWindowLogRateLimiter slidingWindow,
                                  TokenBucketRateLimiter tokenBucket,
                                  IpKeyResolver ipKeyResolver,
                                  Clock clock) {
        this.fixedWindow = fixedWindow;
        this.slidingWindow = slidingWindow;
        this.tokenBucket = tokenBucket;
        this.ipKeyResolver = ipKeyResolver;
        this.userKeyResolver = new UserKeyResolver(ipKeyResolver);
        this.clock = clock;
    }

    public RateLimitEngine createEngine(RateLimitConfig config) {
        RateLimitEngine engine = new RateLimitEngine(config, createResolver(config), strategy(config.getStrategy()), clock);
        log.debug("Rate limit engine created - {}", config);
        return engine;
    }

    public PolicyEngine createPolicyEngine(RateLimitPolicy policy) {
        List<RateLimitEngine> engines = new ArrayList<>();
        for (RateLimitConfig config : policy.getLimits()) {
            engines.add(createEngine(config));
        }
        return new PolicyEngine(engines);
    }

    public RateLimitStrategy strategy(StrategyType type) {
        switch (type) {
            case FIXED:
                return fixedWindow;
            case SLIDING:
                return slidingWindow;
            case TOKEN_BUCKET:
                return tokenBucket;
            default:
                throw new IllegalStateException("Unsupported strategy: " + type);
        }
    }

    public KeyResolver createResolver(RateLimitConfig config) {
        if (config.getIdentifier() == IdentifierType.COMPOSITE) {
            List<KeyResolver> parts = new ArrayList<>();
            for (IdentifierType part : config.getCompositeParts()) {
                parts.add(simpleResolver(part, config));
            }
            return new CompositeKeyResolver(parts);
        }
        return simpleResolver(config.getIdentifier(), config);
    }

    private KeyResolver simpleResolver(IdentifierType type, RateLimitConfig config) {
        switch (type) {
            case IP:
                return ipKeyResolver;
            case USER:
                return userKeyResolver;
            case HEADER:
                return new HeaderKeyResolver(config.getHeaderName(), ipKeyResolver);
            case COMPOSITE:
                throw new IllegalStateException("Composite identifier cannot be nested");
            default:
                throw new IllegalStateException("Unsupported identifier: " + type);
        }
    }
}
