package com.example.gatekeeper.ratelimit.config;

import com.example.gatekeeper.ratelimit.algorithm.FixedWindowRateLimiter;
import com.example.gatekeeper.ratelimit.algorithm.SlidingWindowLogRateLimiter;
import com.example.gatekeeper.ratelimit.algorithm.TokenBucketRateLimiter;
import com.example.gatekeeper.ratelimit.core.RateLimitEngineFactory;
import com.example.gatekeeper.ratelimit.core.RateLimitHeaders;
import com.example.gatekeeper.ratelimit.core.RateLimitRegistry;
import com.example.gatekeeper.ratelimit.model.CounterRecordCodec;
import com.example.gatekeeper.ratelimit.resolver.AuthenticatedUserLookup;
import com.example.gatekeeper.ratelimit.resolver.IpKeyResolver;
import com.example.gatekeeper.ratelimit.store.CounterStore;
import com.example.gatekeeper.ratelimit.store.InMemoryCounterStore;
import com.example.gatekeeper.ratelimit.store.RedisCounterStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;

/**
 * Rate Limiter 구성 요소 Bean 등록
 *
 * 저장소는 rate-limiter.store 값에 따라 메모리 또는 Redis 중 하나가 등록된다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RateLimiterProperties.class)
public class RateLimiterConfiguration {

    @Bean
    public Clock rateLimitClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "rate-limiter", name = "store", havingValue = "memory", matchIfMissing = true)
    public CounterStore inMemoryCounterStore(Clock clock, RateLimiterProperties properties) {
        return new InMemoryCounterStore(clock, properties.getMemory().getMaxEntries());
    }

    @Bean
    @ConditionalOnProperty(prefix = "rate-limiter", name = "store", havingValue = "redis")
    public CounterStore redisCounterStore(@Qualifier("rateLimitRedisTemplate") RedisTemplate<String, String> redisTemplate) {
        return new RedisCounterStore(redisTemplate);
    }

    @Bean
    public CounterRecordCodec counterRecordCodec(ObjectMapper objectMapper) {
        return new CounterRecordCodec(objectMapper);
    }

    @Bean
    public AuthenticatedUserLookup authenticatedUserLookup() {
        return AuthenticatedUserLookup.principal();
    }

    @Bean
    public IpKeyResolver ipKeyResolver(RateLimiterProperties properties) {
        return new IpKeyResolver(properties.getIp().getIpv4SubnetPrefix(), properties.getIp().getIpv6SubnetPrefix());
    }

    @Bean
    public FixedWindowRateLimiter fixedWindowRateLimiter(CounterStore store, RateLimiterProperties properties) {
        return new FixedWindowRateLimiter(store, properties.getKeyPrefix());
    }

    @Bean
    public SlidingWindowLogRateLimiter slidingWindowLogRateLimiter(CounterStore store, CounterRecordCodec codec,
                                                                   RateLimiterProperties properties) {
        return new SlidingWindowLogRateLimiter(store, codec, properties.getKeyPrefix());
    }

    @Bean
    public TokenBucketRateLimiter tokenBucketRateLimiter(CounterStore store, CounterRecordCodec codec,
                                                         RateLimiterProperties properties) {
        return new TokenBucketRateLimiter(store, codec, properties.getKeyPrefix(),
                properties.getTokenBucket().getInitialTokens());
    }

    @Bean
    public RateLimitEngineFactory rateLimitEngineFactory(FixedWindowRateLimiter fixedWindow,
                                                         SlidingWindowLogRateLimiter slidingWindow,
                                                         TokenBucketRateLimiter tokenBucket,
                                                         IpKeyResolver ipKeyResolver,
                                                         Clock clock) {
        return new RateLimitEngineFactory(fixedWindow, slidingWindow, tokenBucket, ipKeyResolver, clock);
    }

    @Bean
    public RateLimitHeaders rateLimitHeaders(RateLimiterProperties properties) {
        return new RateLimitHeaders(properties.getHeaders());
    }

    @Bean
    public RateLimitRegistry rateLimitRegistry(RateLimiterProperties properties, RateLimitEngineFactory factory) {
        log.info("Rate limiter configured - enabled: {}, store: {}, keyPrefix: {}",
                properties.isEnabled(), properties.getStore(), properties.getKeyPrefix());
        return new RateLimitRegistry(properties, factory);
    }
}
