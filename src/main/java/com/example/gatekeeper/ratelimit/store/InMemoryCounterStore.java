package com.example.gatekeeper.ratelimit.store;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 내부 메모리 기반 카운터 저장소
 *
 * 동작 원리:
 * - ConcurrentHashMap 에 (값, 만료시각) 엔트리를 저장
 * - 만료된 엔트리는 조회 시점에 지연 삭제
 * - 엔트리 수가 maxEntries 를 넘으면 만료된 엔트리를 일괄 정리
 *
 * 장점: 외부 의존성 없음, increment 가 compute 로 원자적
 * 단점: 인스턴스 간 상태 공유 불가 (단일 노드 전용)
 */
@Slf4j
public class InMemoryCounterStore implements CounterStore {

    private static final int DEFAULT_MAX_ENTRIES = 100_000;

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;

    public InMemoryCounterStore(Clock clock) {
        this(clock, DEFAULT_MAX_ENTRIES);
    }

    public InMemoryCounterStore(Clock clock, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Max entries must be positive");
        }
        this.clock = clock;
        this.maxEntries = maxEntries;

        log.info("InMemoryCounterStore initialized - maxEntries: {}", maxEntries);
    }

    @Override
    public byte[] get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(now())) {
            entries.remove(key, entry);
            return null;
        }
        return entry.value.clone();
    }

    @Override
    public void put(String key, byte[] value, long ttlSeconds) {
        entries.put(key, new Entry(value.clone(), expiresAt(ttlSeconds)));
        purgeIfFull();
    }

    @Override
    public long increment(String key, long ttlSeconds) {
        long currentTime = now();
        Entry updated = entries.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(currentTime)) {
                return new Entry(encode(1), currentTime + ttlSeconds * 1000);
            }
            // TTL 은 처음 생성될 때만 설정 (Redis INCR + EXPIRE 와 동일)
            return new Entry(encode(decode(k, existing.value) + 1), existing.expiresAtMillis);
        });
        purgeIfFull();
        return decode(key, updated.value);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    //현재 저장된 엔트리 수 (만료 포함)
    public int size() {
        return entries.size();
    }

    //만료된 엔트리 정리
    public int cleanupExpired() {
        long currentTime = now();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(currentTime));
        int removed = before - entries.size();
        if (removed > 0) {
            log.info("Cleaned up {} expired counter entries", removed);
        }
        return removed;
    }

    private void purgeIfFull() {
        if (entries.size() > maxEntries) {
            cleanupExpired();
        }
    }

    private long expiresAt(long ttlSeconds) {
        return now() + ttlSeconds * 1000;
    }

    private long now() {
        return clock.millis();
    }

    private static byte[] encode(long value) {
        return String.valueOf(value).getBytes(StandardCharsets.UTF_8);
    }

    private static long decode(String key, byte[] value) {
        try {
            return Long.parseLong(new String(value, StandardCharsets.UTF_8).trim());
        } catch (NumberFormatException e) {
            throw new CounterStoreException("Counter value is not numeric for key: " + key, e);
        }
    }

    private static final class Entry {
        private final byte[] value;
        private final long expiresAtMillis;

        private Entry(byte[] value, long expiresAtMillis) {
            this.value = value;
            this.expiresAtMillis = expiresAtMillis;
        }

        private boolean isExpired(long currentTimeMillis) {
            return currentTimeMillis >= expiresAtMillis;
        }
    }
}
