package com.example.gatekeeper.ratelimit.util;

/**
 * 저장소 키 생성 유틸리티
 * 형식: {prefix}:{strategy}:{limit}/{window}:{key}[:{bucket}]
 *
 * 같은 알고리즘과 식별 키를 쓰는 규칙이라도 limit/window 가 다르면 서로 다른 레코드를 사용한다.
 */
public final class StoreKeys {

    public static final String DEFAULT_PREFIX = "rate_limit";

    private StoreKeys() {
    }

    public static String of(String prefix, String strategy, int limit, int windowSeconds, String key) {
        return prefix + ":" + strategy + ":" + limit + "/" + windowSeconds + ":" + key;
    }

    public static String of(String prefix, String strategy, int limit, int windowSeconds, String key, long bucket) {
        return of(prefix, strategy, limit, windowSeconds, key) + ":" + bucket;
    }
}
