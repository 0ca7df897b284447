package com.example.gatekeeper.ratelimit.store;

import com.example.gatekeeper.ratelimit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryCounterStore 테스트")
class InMemoryCounterStoreTest {

    private MutableClock clock;
    private InMemoryCounterStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000);
        store = new InMemoryCounterStore(clock);
    }

    @Test
    @DisplayName("저장 후 조회 - TTL 이 지나면 null 이어야 함")
    void testPutGetAndExpire() {
        assertNull(store.get("k"), "없는 키는 null 이어야 합니다");

        store.put("k", bytes("hello"), 10);
        assertEquals("hello", text(store.get("k")));

        clock.advanceSeconds(9);
        assertNotNull(store.get("k"), "TTL 이전에는 조회되어야 합니다");

        clock.advanceSeconds(1);
        assertNull(store.get("k"), "TTL 이 지나면 만료되어야 합니다");
    }

    @Test
    @DisplayName("increment - 0에서 시작하고 TTL 은 처음 생성될 때만 설정")
    void testIncrement() {
        assertEquals(1, store.increment("c", 10));
        clock.advanceSeconds(8);
        assertEquals(2, store.increment("c", 10));

        clock.advanceSeconds(2);
        assertEquals(1, store.increment("c", 10), "처음 TTL 이 지나면 새 카운터로 시작해야 합니다");
    }

    @Test
    @DisplayName("increment - 숫자가 아닌 값이면 CounterStoreException")
    void testIncrementNonNumeric() {
        store.put("c", bytes("{\"count\":1}"), 10);

        assertThrows(CounterStoreException.class, () -> store.increment("c", 10));
    }

    @Test
    @DisplayName("삭제 및 만료 엔트리 정리")
    void testDeleteAndCleanup() {
        store.put("a", bytes("1"), 5);
        store.put("b", bytes("1"), 50);
        store.delete("missing");
        store.delete("b");
        assertNull(store.get("b"));

        clock.advanceSeconds(5);
        assertEquals(1, store.cleanupExpired());
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("저장된 배열을 외부에서 바꿔도 값이 변하지 않아야 함")
    void testValuesAreCopied() {
        byte[] value = bytes("abc");
        store.put("k", value, 10);
        value[0] = 'x';

        byte[] read = store.get("k");
        read[1] = 'y';

        assertEquals("abc", text(store.get("k")));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }
}
