package com.example.gatekeeper.ratelimit.config;

import com.example.gatekeeper.ratelimit.exception.InvalidRateLimitConfigException;

import java.util.Locale;

/**
 * Rate Limiting 알고리즘 타입
 */
public enum StrategyType {
    FIXED("fixed"),
    SLIDING("sliding"),
    TOKEN_BUCKET("token_bucket");

    private final String configName;

    StrategyType(String configName) {
        this.configName = configName;
    }

    // 설정 문자열과 저장소 키에 쓰이는 이름
    public String getConfigName() {
        return configName;
    }

    public static StrategyType fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (StrategyType type : values()) {
            if (type.configName.equals(normalized)) {
                return type;
            }
        }
        throw new InvalidRateLimitConfigException("Unknown rate limit strategy: '" + name + "'");
    }
}
