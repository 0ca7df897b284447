package com.example.gatekeeper.ratelimit.algorithm;

import com.example.gatekeeper.ratelimit.config.StrategyType;
import com.example.gatekeeper.ratelimit.core.RateLimitResult;

import java.time.Clock;
import java.util.Map;

/**
 * Rate Limiting 알고리즘 인터페이스
 *
 * 구현체는 호출자별 상태를 직접 들고 있지 않고 CounterStore 에만 저장한다.
 * 저장소 키에 limit/window 가 들어가므로 하나의 인스턴스를 여러 규칙이 공유해도 상태가 섞이지 않는다.
 */
public interface RateLimitStrategy {

    /**
     * 요청 한 건의 허용 여부를 판단하고 상태를 갱신합니다.
     *
     * @param key 호출자 식별 키
     * @param limit 윈도우당 최대 요청 수 (양수)
     * @param windowSeconds 윈도우 크기 (초, 양수)
     * @param clock 현재 시각을 읽을 시계
     * @return Rate Limiting 결과
     * @throws com.example.gatekeeper.ratelimit.store.CounterStoreException 저장소 장애 시
     */
    RateLimitResult attempt(String key, int limit, int windowSeconds, Clock clock);

    //현재 윈도우의 상태를 삭제
    void reset(String key, int limit, int windowSeconds, Clock clock);

    //상태를 변경하지 않고 현재 사용량을 조회
    Map<String, Object> usage(String key, int limit, int windowSeconds, Clock clock);

    StrategyType getType();

    static void validate(int limit, int windowSeconds) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("Window size must be positive");
        }
    }
}
