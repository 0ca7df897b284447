package com.example.gatekeeper.ratelimit.algorithm;

import com.example.gatekeeper.ratelimit.config.StrategyType;
import com.example.gatekeeper.ratelimit.core.RateLimitResult;
import com.example.gatekeeper.ratelimit.store.CounterStore;
import com.example.gatekeeper.ratelimit.store.CounterStoreException;
import com.example.gatekeeper.ratelimit.util.StoreKeys;
import com.example.gatekeeper.ratelimit.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed Window Counter 알고리즘
 *
 * 동작 원리:
 * - 시간을 windowSeconds 크기의 고정 구간(버킷)으로 나눈다 (bucket = floor(now / window))
 * - 버킷별 카운터를 원자적으로 증가시키고 count &lt;= limit 이면 허용
 * - 다음 버킷이 시작되면 새 카운터를 사용하므로 자동으로 리셋된다
 *
 * 장점: 구현이 단순하고 저장 공간이 작음, 원자적 증가로 초과 허용 없음
 * 단점: 윈도우 경계에서 최대 2 * limit 까지 몰릴 수 있음
 */
@Slf4j
public class FixedWindowRateLimiter implements RateLimitStrategy {

    // 만료 직전 요청을 위한 TTL 여유 시간
    private static final long TTL_BUFFER_SECONDS = 60;

    private final CounterStore store;
    private final String keyPrefix;

    public FixedWindowRateLimiter(CounterStore store, String keyPrefix) {
        this.store = store;
        this.keyPrefix = keyPrefix;

        log.info("FixedWindowRateLimiter initialized - keyPrefix: {}", keyPrefix);
    }

    @Override
    public RateLimitResult attempt(String key, int limit, int windowSeconds, Clock clock) {
        RateLimitStrategy.validate(limit, windowSeconds);
        long now = TimeUtil.currentTimeSeconds(clock);
        long bucket = TimeUtil.windowIndex(now, windowSeconds);
        long resetTime = (bucket + 1) * windowSeconds;

        long count = store.increment(storeKey(key, limit, windowSeconds, bucket), windowSeconds + TTL_BUFFER_SECONDS);

        if (count <= limit) {
            log.debug("Request allowed for key: {} - count: {}/{}", key, count, limit);
            return RateLimitResult.allowed(limit, limit - count, resetTime, key, getType());
        }

        long retryAfter = resetTime - now;
        log.debug("Request rejected for key: {} - limit exceeded {}/{}, retry after: {}s",
                key, count, limit, retryAfter);
        return RateLimitResult.denied(limit, resetTime, retryAfter, key, getType());
    }

    @Override
    public void reset(String key, int limit, int windowSeconds, Clock clock) {
        long bucket = TimeUtil.windowIndex(TimeUtil.currentTimeSeconds(clock), windowSeconds);
        store.delete(storeKey(key, limit, windowSeconds, bucket));
        log.debug("Reset window for key: {}", key);
    }

    @Override
    public Map<String, Object> usage(String key, int limit, int windowSeconds, Clock clock) {
        long now = TimeUtil.currentTimeSeconds(clock);
        long bucket = TimeUtil.windowIndex(now, windowSeconds);
        long windowStart = bucket * windowSeconds;
        long count = readCount(storeKey(key, limit, windowSeconds, bucket));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("algorithm", getType().getConfigName());
        stats.put("key", key);
        stats.put("currentRequests", count);
        stats.put("limit", limit);
        stats.put("remainingRequests", Math.max(0, limit - count));
        stats.put("windowStartTime", windowStart);
        stats.put("windowStartTimeFormatted", TimeUtil.formatTimestamp(windowStart));
        stats.put("windowSizeSeconds", windowSeconds);
        stats.put("windowEndTime", windowStart + windowSeconds);
        stats.put("windowEndTimeFormatted", TimeUtil.formatTimestamp(windowStart + windowSeconds));
        return stats;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.FIXED;
    }

    private long readCount(String storeKey) {
        byte[] value = store.get(storeKey);
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(new String(value, StandardCharsets.UTF_8).trim());
        } catch (NumberFormatException e) {
            throw new CounterStoreException("Counter value is not numeric for key: " + storeKey, e);
        }
    }

    private String storeKey(String key, int limit, int windowSeconds, long bucket) {
        return StoreKeys.of(keyPrefix, getType().getConfigName(), limit, windowSeconds, key, bucket);
    }
}
