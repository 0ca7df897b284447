package com.example.gatekeeper.ratelimit.core;

import com.example.gatekeeper.ratelimit.config.StrategyType;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.OptionalLong;

/**
 * Rate Limiting 결과를 담는 클래스
 *
 * 불변 조건:
 * - 0 &lt;= remaining &lt;= limit
 * - 거부된 경우 remaining = 0, retryAfter 존재
 * - 허용된 경우 retryAfter 없음
 */
@Getter
@ToString
public class RateLimitResult {

    private final boolean allowed; // 요청 허용 여부 (true: 허용, false: 거부)
    private final int limit; // 윈도우당 최대 요청 수
    private final long remaining; // 남은 요청 수
    private final long resetTime; // 리셋 시간 (epoch 초)
    @Getter(AccessLevel.NONE)
    private final Long retryAfter; // 재시도 권장 시간 (초), 거부된 경우에만 존재
    private final String key; // 호출자 식별 키
    private final StrategyType strategy; // 사용된 알고리즘
    private final boolean approximate; // 저장소 장애로 추정된 결과인지 여부 (fail-open)

    @Builder
    private RateLimitResult(boolean allowed, int limit, long remaining, long resetTime, Long retryAfter,
                            String key, StrategyType strategy, boolean approximate) {
        this.allowed = allowed;
        this.limit = limit;
        this.remaining = allowed ? Math.max(0, Math.min(remaining, limit)) : 0;
        this.resetTime = resetTime;
        this.retryAfter = allowed ? null : Math.max(0, retryAfter == null ? 0 : retryAfter);
        this.key = key;
        this.strategy = strategy;
        this.approximate = approximate;
    }

    public OptionalLong getRetryAfter() {
        return retryAfter == null ? OptionalLong.empty() : OptionalLong.of(retryAfter);
    }

    //허용된 요청을 생성하는 정적 메소드
    public static RateLimitResult allowed(int limit, long remaining, long resetTime, String key, StrategyType strategy) {
        return RateLimitResult.builder()
                .allowed(true)
                .limit(limit)
                .remaining(remaining)
                .resetTime(resetTime)
                .key(key)
                .strategy(strategy)
                .build();
    }

    //거부된 요청을 생성하는 정적 메소드
    public static RateLimitResult denied(int limit, long resetTime, long retryAfter, String key, StrategyType strategy) {
        return RateLimitResult.builder()
                .allowed(false)
                .limit(limit)
                .remaining(0)
                .resetTime(resetTime)
                .retryAfter(retryAfter)
                .key(key)
                .strategy(strategy)
                .build();
    }

    //저장소 장애 시 허용 결과 (추정치)
    public static RateLimitResult failOpen(int limit, long now, int windowSeconds, String key, StrategyType strategy) {
        return RateLimitResult.builder()
                .allowed(true)
                .limit(limit)
                .remaining(limit - 1L)
                .resetTime(now + windowSeconds)
                .key(key)
                .strategy(strategy)
                .approximate(true)
                .build();
    }
}
