package com.example.gatekeeper.ratelimit.config;

import com.example.gatekeeper.ratelimit.exception.InvalidRateLimitConfigException;

import java.util.Locale;

/**
 * Rate Limit 키 생성 방식
 */
public enum IdentifierType {
    IP,        // 클라이언트 IP 주소 기반
    USER,      // 인증된 사용자 -> 세션 -> IP 순
    HEADER,    // API 키 등 요청 헤더 기반
    COMPOSITE; // 여러 방식의 조합

    public String getConfigName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IdentifierType fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (IdentifierType type : values()) {
            if (type.getConfigName().equals(normalized)) {
                return type;
            }
        }
        throw new InvalidRateLimitConfigException("Unknown rate limit identifier: '" + name + "'");
    }
}
