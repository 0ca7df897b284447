package com.example.gatekeeper.ratelimit.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CounterStore 기본 increment 테스트")
class CounterStoreDefaultIncrementTest {

    // get/put 만 구현한 저장소
    private static class MapCounterStore implements CounterStore {
        private final Map<String, byte[]> values = new HashMap<>();
        private final Map<String, Long> ttls = new HashMap<>();

        @Override
        public byte[] get(String key) {
            return values.get(key);
        }

        @Override
        public void put(String key, byte[] value, long ttlSeconds) {
            values.put(key, value);
            ttls.put(key, ttlSeconds);
        }

        @Override
        public void delete(String key) {
            values.remove(key);
        }
    }

    @Test
    @DisplayName("없는 키는 1부터 시작")
    void testIncrementFromEmpty() {
        MapCounterStore store = new MapCounterStore();

        assertEquals(1L, store.increment("k", 30));
        assertEquals(2L, store.increment("k", 30));
        assertEquals("2", new String(store.get("k"), StandardCharsets.UTF_8));
        assertEquals(30L, store.ttls.get("k"));
    }

    @Test
    @DisplayName("숫자가 아닌 값이면 CounterStoreException")
    void testNonNumericValue() {
        MapCounterStore store = new MapCounterStore();
        store.put("k", "abc".getBytes(StandardCharsets.UTF_8), 30);

        assertThrows(CounterStoreException.class, () -> store.increment("k", 30));
    }
}
