package com.example.gatekeeper.ratelimit.core;

import com.example.gatekeeper.ratelimit.config.RateLimiterProperties;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate Limiting 응답 헤더
 *
 * - Limit, Reset, Remaining 은 항상 설정 (거부 시 Remaining = 0)
 * - Retry-After 는 거부된 경우에만 설정
 */
@Slf4j
public class RateLimitHeaders {

    private final RateLimiterProperties.Headers names;

    public RateLimitHeaders(RateLimiterProperties.Headers names) {
        this.names = names;
    }

    public void apply(HttpServletResponse response, RateLimitResult result) {
        asMap(result).forEach(response::setHeader);

        log.debug("Rate limit headers set - limit: {}, remaining: {}, reset: {}, strategy: {}",
                result.getLimit(), result.getRemaining(), result.getResetTime(), result.getStrategy());
    }

    public Map<String, String> asMap(RateLimitResult result) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(names.getLimit(), String.valueOf(result.getLimit()));
        headers.put(names.getRemaining(), String.valueOf(result.isAllowed() ? result.getRemaining() : 0));
        headers.put(names.getReset(), String.valueOf(result.getResetTime()));
        if (!result.isAllowed()) {
            headers.put(names.getRetryAfter(), String.valueOf(result.getRetryAfter().orElse(0)));
        }
        return headers;
    }
}
