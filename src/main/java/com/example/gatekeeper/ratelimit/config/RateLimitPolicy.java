package com.example.gatekeeper.ratelimit.config;

import com.example.gatekeeper.ratelimit.exception.InvalidRateLimitConfigException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 하나의 경로/메서드에 동시에 적용되는 규칙 목록
 * 예) "100,1|1000,60" : 분당 100회 그리고 시간당 1000회
 */
@Getter
@ToString
@EqualsAndHashCode
public class RateLimitPolicy {

    private final List<RateLimitConfig> limits;

    public RateLimitPolicy(List<RateLimitConfig> limits) {
        if (limits == null || limits.isEmpty()) {
            throw new InvalidRateLimitConfigException("Rate limit policy requires at least one limit");
        }
        this.limits = List.copyOf(limits);
    }

    public static RateLimitPolicy of(RateLimitConfig... limits) {
        return new RateLimitPolicy(List.of(limits));
    }
}
