package com.example.gatekeeper.ratelimit.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Redis 기반 카운터 저장소
 *
 * 동작 원리:
 * - 레코드는 UTF-8 문자열로 저장 (RedisTemplate&lt;String, String&gt;)
 * - increment 는 INCR 로 원자적으로 증가시키고, 값이 1일 때만 EXPIRE 설정
 *
 * 장점: 여러 인스턴스가 같은 카운터를 공유 (분산 환경)
 * 단점: 네트워크 왕복 비용, Redis 장애 시 fail-open 으로 동작
 */
@Slf4j
public class RedisCounterStore implements CounterStore {

    private final RedisTemplate<String, String> redisTemplate;

    public RedisCounterStore(RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
        log.info("RedisCounterStore initialized");
    }

    @Override
    public byte[] get(String key) {
        try {
            String value = redisTemplate.opsForValue().get(key);
            return value == null ? null : value.getBytes(StandardCharsets.UTF_8);
        } catch (DataAccessException e) {
            throw new CounterStoreException("Redis GET failed for key: " + key, e);
        }
    }

    @Override
    public void put(String key, byte[] value, long ttlSeconds) {
        try {
            redisTemplate.opsForValue().set(key, new String(value, StandardCharsets.UTF_8),
                    Duration.ofSeconds(ttlSeconds));
        } catch (DataAccessException e) {
            throw new CounterStoreException("Redis SET failed for key: " + key, e);
        }
    }

    @Override
    public long increment(String key, long ttlSeconds) {
        try {
            Long count = redisTemplate.opsForValue().increment(key);
            if (count == null) {
                // 파이프라인/트랜잭션 안에서 호출된 경우
                throw new CounterStoreException("Redis INCR returned no value for key: " + key);
            }
            if (count == 1L) {
                redisTemplate.expire(key, Duration.ofSeconds(ttlSeconds));
            }
            return count;
        } catch (DataAccessException e) {
            throw new CounterStoreException("Redis INCR failed for key: " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new CounterStoreException("Redis DEL failed for key: " + key, e);
        }
    }
}
