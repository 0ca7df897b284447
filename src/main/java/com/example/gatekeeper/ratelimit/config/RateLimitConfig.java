package com.example.gatekeeper.ratelimit.config;

import com.example.gatekeeper.ratelimit.exception.InvalidRateLimitConfigException;
import com.example.gatekeeper.ratelimit.resolver.HeaderKeyResolver;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

/**
 * Rate Limit 규칙 하나 (불변)
 *
 * 생성 시점에 검증하므로 요청 처리 중에는 잘못된 설정이 나올 수 없다.
 * 기본값: FIXED 알고리즘, IP 식별, X-API-Key 헤더, 조합은 [IP, USER]
 */
@Getter
@ToString
@EqualsAndHashCode
public class RateLimitConfig {

    private final int limit; // 윈도우당 최대 요청 수
    private final int windowSeconds; // 윈도우 크기 (초)
    private final StrategyType strategy; // 사용할 알고리즘
    private final IdentifierType identifier; // 호출자 식별 방식
    private final String headerName; // HEADER 식별 시 토큰을 읽을 헤더
    private final List<IdentifierType> compositeParts; // COMPOSITE 식별 시 조합할 방식 (순서 유지)

    @Builder
    private RateLimitConfig(int limit, int windowSeconds, StrategyType strategy, IdentifierType identifier,
                            String headerName, List<IdentifierType> compositeParts) {
        if (limit <= 0) {
            throw new InvalidRateLimitConfigException("Limit must be positive: " + limit);
        }
        if (windowSeconds <= 0) {
            throw new InvalidRateLimitConfigException("Window size must be positive: " + windowSeconds);
        }
        if (strategy == null) {
            throw new InvalidRateLimitConfigException("Strategy must not be null");
        }
        if (identifier == null) {
            throw new InvalidRateLimitConfigException("Identifier must not be null");
        }
        if (headerName == null || headerName.isBlank()) {
            throw new InvalidRateLimitConfigException("Header name must not be blank");
        }
        if (compositeParts == null || compositeParts.stream().anyMatch(Objects::isNull)) {
            throw new InvalidRateLimitConfigException("Composite parts must not contain null");
        }
        if (identifier == IdentifierType.COMPOSITE) {
            if (compositeParts.size() < 2) {
                throw new InvalidRateLimitConfigException("Composite identifier requires at least two parts");
            }
            if (compositeParts.contains(IdentifierType.COMPOSITE)) {
                throw new InvalidRateLimitConfigException("Composite identifier cannot contain itself");
            }
        }

        this.limit = limit;
        this.windowSeconds = windowSeconds;
        this.strategy = strategy;
        this.identifier = identifier;
        this.headerName = headerName.trim();
        this.compositeParts = List.copyOf(compositeParts);
    }

    public static RateLimitConfigBuilder builder() {
        return new RateLimitConfigBuilder()
                .strategy(StrategyType.FIXED)
                .identifier(IdentifierType.IP)
                .headerName(HeaderKeyResolver.DEFAULT_HEADER)
                .compositeParts(List.of(IdentifierType.IP, IdentifierType.USER));
    }

    public static RateLimitConfig of(int limit, int windowSeconds, StrategyType strategy, IdentifierType identifier) {
        return builder()
                .limit(limit)
                .windowSeconds(windowSeconds)
                .strategy(strategy)
                .identifier(identifier)
                .build();
    }
}
