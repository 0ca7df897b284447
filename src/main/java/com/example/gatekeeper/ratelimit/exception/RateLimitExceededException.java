package com.example.gatekeeper.ratelimit.exception;

import com.example.gatekeeper.ratelimit.config.IdentifierType;
import com.example.gatekeeper.ratelimit.core.RateLimitResult;
import lombok.Getter;

/**
 * Rate Limit 초과 예외
 * {@code @RateLimit} 이 적용된 메서드 호출이 거부되었을 때 aspect 가 던지고,
 * RateLimitExceptionHandler 가 429 응답으로 변환한다.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final int limit; // 윈도우당 최대 요청 수
    private final int windowSeconds; // 윈도우 크기 (초)
    private final long retryAfter; // 재시도 권장 시간 (초)
    private final IdentifierType identifierKind; // 호출자 식별 방식
    private final transient RateLimitResult result; // 거부 결과 (헤더 생성용)

    public RateLimitExceededException(String message, int windowSeconds, IdentifierType identifierKind,
                                      RateLimitResult result) {
        super(message);
        this.limit = result.getLimit();
        this.windowSeconds = windowSeconds;
        this.retryAfter = result.getRetryAfter().orElse(0);
        this.identifierKind = identifierKind;
        this.result = result;
    }
}
