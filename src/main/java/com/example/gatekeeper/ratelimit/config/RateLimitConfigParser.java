package com.example.gatekeeper.ratelimit.config;

import com.example.gatekeeper.ratelimit.exception.InvalidRateLimitConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rate Limit 설정 문자열 파서
 *
 * 문법: requests,windowMinutes[,strategy[,identifier]] 를 '|' 로 여러 개 연결
 * - strategy   : fixed | sliding | token_bucket (기본 fixed)
 * - identifier : ip | user | header | header:{Name} | composite | {a}+{b}[+...] (기본 ip)
 *
 * 예) "60,1"                       분당 60회, IP 기준
 *     "10,1,sliding,user"          분당 10회, 사용자 기준 sliding window
 *     "100,1|1000,60,fixed,ip+user" 분당 100회 + 시간당 1000회, IP+사용자 조합
 */
public final class RateLimitConfigParser {

    private static final String HEADER_PREFIX = "header:";

    private RateLimitConfigParser() {
    }

    public static RateLimitPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRateLimitConfigException("Rate limit configuration must not be blank");
        }
        List<RateLimitConfig> limits = new ArrayList<>();
        for (String rule : value.split("\\|", -1)) {
            limits.add(parseRule(rule.trim(), value));
        }
        return new RateLimitPolicy(limits);
    }

    public static RateLimitConfig parseRule(String rule) {
        return parseRule(rule, rule);
    }

    private static RateLimitConfig parseRule(String rule, String source) {
        String[] parts = rule.split(",", -1);
        if (parts.length < 2 || parts.length > 4) {
            throw new InvalidRateLimitConfigException(
                    "Expected 'requests,windowMinutes[,strategy[,identifier]]' but got '" + rule + "' in '" + source + "'");
        }

        int requests = parsePositive(parts[0], "requests", source);
        int windowMinutes = parsePositive(parts[1], "windowMinutes", source);
        if (windowMinutes > Integer.MAX_VALUE / 60) {
            throw new InvalidRateLimitConfigException("windowMinutes is too large in '" + source + "'");
        }

        RateLimitConfig.RateLimitConfigBuilder builder = RateLimitConfig.builder()
                .limit(requests)
                .windowSeconds(windowMinutes * 60);

        if (parts.length >= 3 && !parts[2].isBlank()) {
            builder.strategy(StrategyType.fromName(parts[2]));
        }
        if (parts.length == 4 && !parts[3].isBlank()) {
            applyIdentifier(builder, parts[3].trim());
        }
        return builder.build();
    }

    private static void applyIdentifier(RateLimitConfig.RateLimitConfigBuilder builder, String identifier) {
        if (identifier.contains("+")) {
            List<IdentifierType> compositeParts = new ArrayList<>();
            for (String part : identifier.split("\\+", -1)) {
                String trimmed = part.trim();
                if (isHeaderWithName(trimmed)) {
                    builder.headerName(headerName(trimmed));
                    compositeParts.add(IdentifierType.HEADER);
                } else {
                    compositeParts.add(IdentifierType.fromName(trimmed));
                }
            }
            builder.identifier(IdentifierType.COMPOSITE).compositeParts(compositeParts);
            return;
        }

        if (isHeaderWithName(identifier)) {
            builder.identifier(IdentifierType.HEADER).headerName(headerName(identifier));
            return;
        }
        builder.identifier(IdentifierType.fromName(identifier));
    }

    private static boolean isHeaderWithName(String identifier) {
        return identifier.toLowerCase(Locale.ROOT).startsWith(HEADER_PREFIX);
    }

    private static String headerName(String identifier) {
        String name = identifier.substring(HEADER_PREFIX.length()).trim();
        if (name.isEmpty()) {
            throw new InvalidRateLimitConfigException("Header name is missing in identifier '" + identifier + "'");
        }
        return name;
    }

    private static int parsePositive(String value, String field, String source) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRateLimitConfigException(field + " must be an integer in '" + source + "'", e);
        }
        if (parsed <= 0) {
            throw new InvalidRateLimitConfigException(field + " must be positive in '" + source + "'");
        }
        return parsed;
    }
}
