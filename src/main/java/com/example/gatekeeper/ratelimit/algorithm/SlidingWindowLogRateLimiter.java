package com.example.gatekeeper.ratelimit.algorithm;

import com.example.gatekeeper.ratelimit.config.StrategyType;
import com.example.gatekeeper.ratelimit.core.RateLimitResult;
import com.example.gatekeeper.ratelimit.model.CounterRecordCodec;
import com.example.gatekeeper.ratelimit.model.SlidingWindowLogState;
import com.example.gatekeeper.ratelimit.store.CounterStore;
import com.example.gatekeeper.ratelimit.util.StoreKeys;
import com.example.gatekeeper.ratelimit.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sliding Window Log 알고리즘
 *
 * 동작 원리:
 * - 허용된 요청의 시각을 로그로 저장
 * - 매 요청마다 (now - window) 이전의 기록을 제거하고 남은 개수로 판단
 * - count &lt; limit 이면 현재 시각을 기록하고 허용
 *
 * 장점: 어느 구간을 잡아도 window 안에 limit 을 넘지 않음 (경계 버스트 없음)
 * 단점: 요청 시각을 모두 저장하므로 메모리 사용량이 limit 에 비례
 *
 * 저장소에서 읽고 다시 쓰는 방식이므로 동시에 들어온 N 개 요청은 최대 N-1 개까지 초과 허용될 수 있다.
 */
@Slf4j
public class SlidingWindowLogRateLimiter implements RateLimitStrategy {

    private static final long TTL_BUFFER_SECONDS = 60;

    private final CounterStore store;
    private final CounterRecordCodec codec;
    private final String keyPrefix;

    public SlidingWindowLogRateLimiter(CounterStore store, CounterRecordCodec codec, String keyPrefix) {
        this.store = store;
        this.codec = codec;
        this.keyPrefix = keyPrefix;

        log.info("SlidingWindowLogRateLimiter initialized - keyPrefix: {}", keyPrefix);
    }

    @Override
    public RateLimitResult attempt(String key, int limit, int windowSeconds, Clock clock) {
        RateLimitStrategy.validate(limit, windowSeconds);
        long now = TimeUtil.currentTimeSeconds(clock);
        String storeKey = storeKey(key, limit, windowSeconds);

        List<Long> timestamps = activeTimestamps(storeKey, now, windowSeconds);

        if (timestamps.size() < limit) {
            timestamps.add(now);
            Collections.sort(timestamps);
            store.put(storeKey, codec.encode(new SlidingWindowLogState(timestamps)),
                    windowSeconds + TTL_BUFFER_SECONDS);

            long resetTime = timestamps.get(0) + windowSeconds;
            log.debug("Request allowed for key: {} - count: {}/{}", key, timestamps.size(), limit);
            return RateLimitResult.allowed(limit, limit - timestamps.size(), resetTime, key, getType());
        }

        // 가장 오래된 기록이 윈도우에서 빠지는 시각
        long resetTime = timestamps.get(0) + windowSeconds;
        long retryAfter = Math.max(1, resetTime - now);
        log.debug("Request rejected for key: {} - limit exceeded {}/{}, retry after: {}s",
                key, timestamps.size(), limit, retryAfter);
        return RateLimitResult.denied(limit, resetTime, retryAfter, key, getType());
    }

    @Override
    public void reset(String key, int limit, int windowSeconds, Clock clock) {
        store.delete(storeKey(key, limit, windowSeconds));
        log.debug("Reset request log for key: {}", key);
    }

    @Override
    public Map<String, Object> usage(String key, int limit, int windowSeconds, Clock clock) {
        long now = TimeUtil.currentTimeSeconds(clock);
        List<Long> timestamps = activeTimestamps(storeKey(key, limit, windowSeconds), now, windowSeconds);
        long resetTime = timestamps.isEmpty() ? now + windowSeconds : timestamps.get(0) + windowSeconds;

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("algorithm", getType().getConfigName());
        stats.put("key", key);
        stats.put("currentRequests", timestamps.size());
        stats.put("limit", limit);
        stats.put("remainingRequests", Math.max(0, limit - timestamps.size()));
        stats.put("windowSizeSeconds", windowSeconds);
        stats.put("resetTime", resetTime);
        stats.put("resetTimeFormatted", TimeUtil.formatTimestamp(resetTime));
        return stats;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.SLIDING;
    }

    // 만료 기준: t <= now - window
    private List<Long> activeTimestamps(String storeKey, long now, int windowSeconds) {
        SlidingWindowLogState state = codec.decode(store.get(storeKey), SlidingWindowLogState.class);
        List<Long> active = new ArrayList<>();
        if (state == null || state.getTimestamps() == null) {
            return active;
        }
        long threshold = now - windowSeconds;
        for (Long timestamp : state.getTimestamps()) {
            if (timestamp != null && timestamp > threshold) {
                active.add(timestamp);
            }
        }
        Collections.sort(active);
        return active;
    }

    private String storeKey(String key, int limit, int windowSeconds) {
        return StoreKeys.of(keyPrefix, getType().getConfigName(), limit, windowSeconds, key);
    }
}
