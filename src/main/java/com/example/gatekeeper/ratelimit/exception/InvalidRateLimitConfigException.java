package com.example.gatekeeper.ratelimit.exception;

/**
 * 잘못된 Rate Limit 설정 (limit/window 가 0 이하, 알 수 없는 알고리즘 등)
 * 요청 처리 중이 아니라 설정 생성 시점에 던진다.
 */
public class InvalidRateLimitConfigException extends IllegalArgumentException {

    public InvalidRateLimitConfigException(String message) {
        super(message);
    }

    public InvalidRateLimitConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
