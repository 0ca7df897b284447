package com.example.gatekeeper.ratelimit.algorithm;

import com.example.gatekeeper.ratelimit.config.StrategyType;
import com.example.gatekeeper.ratelimit.core.RateLimitResult;
import com.example.gatekeeper.ratelimit.model.CounterRecordCodec;
import com.example.gatekeeper.ratelimit.model.TokenBucketState;
import com.example.gatekeeper.ratelimit.store.CounterStore;
import com.example.gatekeeper.ratelimit.util.StoreKeys;
import com.example.gatekeeper.ratelimit.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token Bucket 알고리즘
 *
 * 동작 원리:
 * - 버킷 용량은 limit, 초당 limit / window 개의 토큰이 보충됨
 * - 요청마다 경과 시간만큼 토큰을 보충한 뒤 1개 이상이면 소비하고 허용
 * - 새 버킷은 initialTokens 개로 시작 (기본 0, cold start)
 *
 * 장점: 용량 한도 안에서 순간적인 버스트 허용, 평균 속도는 rate 로 제한
 * 단점: remaining / resetTime 은 참고용 (버킷이 가득 차는 시각 기준)
 */
@Slf4j
public class TokenBucketRateLimiter implements RateLimitStrategy {

    // 비활성 버킷 보존 여유 시간
    private static final long TTL_BUFFER_SECONDS = 300;

    private final CounterStore store;
    private final CounterRecordCodec codec;
    private final String keyPrefix;
    private final double initialTokens;

    public TokenBucketRateLimiter(CounterStore store, CounterRecordCodec codec, String keyPrefix) {
        this(store, codec, keyPrefix, 0);
    }

    public TokenBucketRateLimiter(CounterStore store, CounterRecordCodec codec, String keyPrefix, double initialTokens) {
        if (initialTokens < 0) {
            throw new IllegalArgumentException("Initial tokens must not be negative");
        }
        this.store = store;
        this.codec = codec;
        this.keyPrefix = keyPrefix;
        this.initialTokens = initialTokens;

        log.info("TokenBucketRateLimiter initialized - keyPrefix: {}, initialTokens: {}", keyPrefix, initialTokens);
    }

    @Override
    public RateLimitResult attempt(String key, int limit, int windowSeconds, Clock clock) {
        RateLimitStrategy.validate(limit, windowSeconds);
        long now = TimeUtil.currentTimeSeconds(clock);
        double refillRate = (double) limit / windowSeconds;
        String storeKey = storeKey(key, limit, windowSeconds);

        TokenBucketState bucket = refill(storeKey, limit, refillRate, now);

        boolean allowed = bucket.getTokens() >= 1;
        if (allowed) {
            bucket.setTokens(bucket.getTokens() - 1);
        }
        store.put(storeKey, codec.encode(bucket), 2L * windowSeconds + TTL_BUFFER_SECONDS);

        double tokens = bucket.getTokens();
        long resetTime = now + TimeUtil.ceilSeconds((limit - tokens) / refillRate);

        if (allowed) {
            log.debug("Request allowed for key: {} - remaining tokens: {}", key, tokens);
            return RateLimitResult.allowed(limit, (long) Math.floor(tokens), resetTime, key, getType());
        }

        long retryAfter = Math.max(1, TimeUtil.ceilSeconds((1 - tokens) / refillRate));
        log.debug("Request rejected for key: {} - no tokens available ({}), retry after: {}s",
                key, tokens, retryAfter);
        return RateLimitResult.denied(limit, resetTime, retryAfter, key, getType());
    }

    @Override
    public void reset(String key, int limit, int windowSeconds, Clock clock) {
        store.delete(storeKey(key, limit, windowSeconds));
        log.debug("Reset bucket for key: {}", key);
    }

    @Override
    public Map<String, Object> usage(String key, int limit, int windowSeconds, Clock clock) {
        long now = TimeUtil.currentTimeSeconds(clock);
        double refillRate = (double) limit / windowSeconds;
        TokenBucketState bucket = refill(storeKey(key, limit, windowSeconds), limit, refillRate, now);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("algorithm", getType().getConfigName());
        stats.put("key", key);
        stats.put("capacity", limit);
        stats.put("currentTokens", bucket.getTokens());
        stats.put("remainingRequests", (long) Math.floor(bucket.getTokens()));
        stats.put("refillRatePerSecond", refillRate);
        stats.put("lastRefillTime", bucket.getLastRefill());
        stats.put("lastRefillTimeFormatted", TimeUtil.formatTimestamp(bucket.getLastRefill()));
        return stats;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.TOKEN_BUCKET;
    }

    // 저장된 버킷을 읽어 경과 시간만큼 토큰 보충 (저장하지 않음)
    private TokenBucketState refill(String storeKey, int capacity, double refillRate, long now) {
        TokenBucketState bucket = codec.decode(store.get(storeKey), TokenBucketState.class);
        if (bucket == null) {
            return TokenBucketState.createTokenBucket(Math.min(initialTokens, capacity), now);
        }
        long elapsed = Math.max(0, now - bucket.getLastRefill());
        bucket.setTokens(Math.min(capacity, bucket.getTokens() + elapsed * refillRate));
        bucket.setLastRefill(Math.max(now, bucket.getLastRefill()));
        return bucket;
    }

    private String storeKey(String key, int limit, int windowSeconds) {
        return StoreKeys.of(keyPrefix, getType().getConfigName(), limit, windowSeconds, key);
    }
}
