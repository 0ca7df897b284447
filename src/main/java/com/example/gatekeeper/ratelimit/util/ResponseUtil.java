package com.example.gatekeeper.ratelimit.util;

import com.example.gatekeeper.ratelimit.core.RateLimitResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate Limiting 응답 처리 유틸리티
 * 필터와 예외 핸들러가 같은 429 응답 본문을 쓰도록 한다.
 */
@Slf4j
public final class ResponseUtil {

    public static final String DEFAULT_MESSAGE = "Rate limit exceeded. Please try again later.";

    private ResponseUtil() {
    }

    /**
     * 429 Too Many Requests 응답 작성 (헤더는 호출 전에 설정되어 있어야 함)
     */
    public static void sendTooManyRequestsResponse(HttpServletResponse response, ObjectMapper objectMapper,
                                                   Map<String, Object> body) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");

        response.getWriter().write(objectMapper.writeValueAsString(body));
        response.getWriter().flush();
    }

    /**
     * 에러 응답 JSON 객체 생성
     */
    public static Map<String, Object> createErrorResponse(RateLimitResult result, String message, int windowSeconds,
                                                          String identifier, Clock clock) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", "Too Many Requests");
        error.put("message", message);
        error.put("status", HttpStatus.TOO_MANY_REQUESTS.value());
        error.put("timestamp", clock.millis());

        // Rate Limiting 상세 정보
        Map<String, Object> rateLimitInfo = new LinkedHashMap<>();
        rateLimitInfo.put("limit", result.getLimit());
        rateLimitInfo.put("windowSeconds", windowSeconds);
        rateLimitInfo.put("retryAfter", result.getRetryAfter().orElse(0));
        rateLimitInfo.put("identifier", identifier);
        rateLimitInfo.put("resetTime", result.getResetTime());
        rateLimitInfo.put("resetTimeFormatted", TimeUtil.formatTimestamp(result.getResetTime()));

        error.put("rateLimit", rateLimitInfo);
        return error;
    }

    public static void logAllowedRequest(RateLimitResult result, String requestPath) {
        log.debug("Request allowed - key: {}, path: {}, remaining: {}, strategy: {}",
                result.getKey(), requestPath, result.getRemaining(), result.getStrategy());
    }

    public static void logRejectedRequest(RateLimitResult result, String requestPath) {
        log.warn("Request rejected - key: {}, path: {}, strategy: {}, retry after: {}s",
                result.getKey(), requestPath, result.getStrategy(), result.getRetryAfter().orElse(0));
    }
}
