package com.example.gatekeeper.ratelimit.store;

import java.nio.charset.StandardCharsets;

/**
 * Rate Limit 카운터 저장소 계약
 *
 * 모든 알고리즘은 이 인터페이스를 통해서만 상태(CounterRecord)를 읽고 쓴다.
 * 구현체는 프로세스 내부 메모리, Redis 등 무엇이든 될 수 있다.
 *
 * 동시성 보장:
 * - get / put 은 서로 독립된 연산이며 연산 간 원자성은 보장하지 않는다 (CAS 없음)
 * - increment 만 원자적 increment-and-get 이 될 수 있다 (구현체가 지원하는 경우)
 *
 * 저장소 장애는 {@link CounterStoreException} 으로 던진다.
 */
public interface CounterStore {

    /**
     * 키에 저장된 값을 조회합니다.
     *
     * @param key 저장소 키
     * @return 저장된 바이트, 없거나 만료되었으면 null
     */
    byte[] get(String key);

    /**
     * 값을 저장하고 TTL을 설정합니다.
     *
     * @param key 저장소 키
     * @param value 저장할 바이트
     * @param ttlSeconds 만료 시간 (초)
     */
    void put(String key, byte[] value, long ttlSeconds);

    /**
     * 정수 카운터를 1 증가시키고 증가된 값을 반환합니다.
     * 키가 없으면 0에서 시작하며, 처음 생성될 때 TTL이 설정됩니다.
     *
     * 기본 구현은 get 후 put 을 수행하므로 원자적이지 않습니다.
     * 원자적 증가를 제공하는 저장소는 반드시 오버라이드해야 합니다.
     *
     * @param key 저장소 키
     * @param ttlSeconds 키가 처음 생성될 때 설정할 만료 시간 (초)
     * @return 증가된 카운터 값
     */
    default long increment(String key, long ttlSeconds) {
        byte[] current = get(key);
        long next = 1;
        if (current != null) {
            try {
                next = Long.parseLong(new String(current, StandardCharsets.UTF_8).trim()) + 1;
            } catch (NumberFormatException e) {
                throw new CounterStoreException("Counter value is not numeric for key: " + key, e);
            }
        }
        put(key, String.valueOf(next).getBytes(StandardCharsets.UTF_8), ttlSeconds);
        return next;
    }

    /**
     * 키를 삭제합니다.
     *
     * @param key 저장소 키
     */
    void delete(String key);
}
