package com.example.gatekeeper.ratelimit.store;

/**
 * 카운터 저장소 장애 (연결 실패, 직렬화 실패 등)
 * 엔진에서 잡아서 fail-open 처리한다.
 */
public class CounterStoreException extends RuntimeException {

    public CounterStoreException(String message) {
        super(message);
    }

    public CounterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
