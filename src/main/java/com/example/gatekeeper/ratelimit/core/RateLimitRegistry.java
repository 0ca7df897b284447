package com.example.gatekeeper.ratelimit.core;

import com.example.gatekeeper.ratelimit.config.RateLimitConfigParser;
import com.example.gatekeeper.ratelimit.config.RateLimiterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.AntPathMatcher;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * URL 패턴별 PolicyEngine 목록
 *
 * 설정 문자열은 생성 시점(애플리케이션 시작)에 한 번만 파싱되며,
 * 잘못된 설정은 InvalidRateLimitConfigException 으로 시작을 실패시킨다.
 * 패턴은 선언된 순서대로 매칭한다.
 */
@Slf4j
public class RateLimitRegistry {

    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final Map<String, PolicyEngine> patternEngines = new LinkedHashMap<>();
    private final List<String> excludedPaths;
    private final PolicyEngine defaultEngine;

    public RateLimitRegistry(RateLimiterProperties properties, RateLimitEngineFactory factory) {
        for (Map.Entry<String, String> entry : properties.getUrlPatterns().entrySet()) {
            patternEngines.put(entry.getKey(),
                    factory.createPolicyEngine(RateLimitConfigParser.parse(entry.getValue())));
            log.info("Rate limit rule registered - pattern: {}, rule: {}", entry.getKey(), entry.getValue());
        }
        String defaultRule = properties.getDefaultRule();
        this.defaultEngine = defaultRule == null || defaultRule.isBlank()
                ? null
                : factory.createPolicyEngine(RateLimitConfigParser.parse(defaultRule));
        this.excludedPaths = List.copyOf(properties.getExcludedPaths());

        log.info("RateLimitRegistry initialized - patterns: {}, defaultRule: {}, excluded: {}",
                patternEngines.keySet(), defaultRule, excludedPaths);
    }

    //경로에 적용할 엔진 (패턴 -> 기본 규칙 순), 없으면 empty
    public Optional<PolicyEngine> find(String path) {
        for (Map.Entry<String, PolicyEngine> entry : patternEngines.entrySet()) {
            if (pathMatcher.match(entry.getKey(), path)) {
                log.debug("Matched pattern '{}' for path '{}'", entry.getKey(), path);
                return Optional.of(entry.getValue());
            }
        }
        return Optional.ofNullable(defaultEngine);
    }

    //패턴 이름으로 조회 (관리용), "default" 는 기본 규칙
    public Optional<PolicyEngine> forPattern(String pattern) {
        if ("default".equals(pattern)) {
            return Optional.ofNullable(defaultEngine);
        }
        return Optional.ofNullable(patternEngines.get(pattern));
    }

    public boolean isExcluded(String path) {
        for (String excluded : excludedPaths) {
            if (pathMatcher.match(excluded, path)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getPatterns() {
        return List.copyOf(patternEngines.keySet());
    }
}
