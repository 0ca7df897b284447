package com.example.gatekeeper.ratelimit.exception;

import com.example.gatekeeper.ratelimit.core.RateLimitHeaders;
import com.example.gatekeeper.ratelimit.util.ResponseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.Map;

/**
 * RateLimitExceededException 을 429 응답으로 변환
 * 본문 형식은 필터의 429 응답과 같다.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class RateLimitExceptionHandler {

    private final RateLimitHeaders rateLimitHeaders;
    private final Clock clock;

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimitExceeded(RateLimitExceededException e) {
        HttpHeaders headers = new HttpHeaders();
        rateLimitHeaders.asMap(e.getResult()).forEach(headers::set);

        Map<String, Object> body = ResponseUtil.createErrorResponse(e.getResult(), e.getMessage(),
                e.getWindowSeconds(), e.getIdentifierKind().getConfigName(), clock);

        log.debug("Rate limit exceeded response - limit: {}, retryAfter: {}s", e.getLimit(), e.getRetryAfter());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
