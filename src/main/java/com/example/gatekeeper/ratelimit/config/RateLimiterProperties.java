package com.example.gatekeeper.ratelimit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rate Limiter 설정 프로퍼티
 */
@Data
@ConfigurationProperties(prefix = "rate-limiter")
public class RateLimiterProperties {

    private boolean enabled = true; // Rate Limiter 활성화
    private StoreType store = StoreType.MEMORY; // 카운터 저장소
    private String keyPrefix = "rate_limit"; // 저장소 키 접두사
    private String defaultRule; // 매칭되는 패턴이 없을 때 적용할 규칙 (없으면 통과)
    private Map<String, String> urlPatterns = new LinkedHashMap<>(); // URL 패턴별 규칙 (선언 순서대로 매칭)
    private List<String> excludedPaths = new ArrayList<>(List.of("/actuator/**", "/api/admin/**")); // 제외 경로
    private Headers headers = new Headers();
    private Ip ip = new Ip();
    private TokenBucket tokenBucket = new TokenBucket();
    private Memory memory = new Memory();
    private Admin admin = new Admin();

    public enum StoreType {
        MEMORY,
        REDIS
    }

    @Data
    public static class Headers {
        private String limit = "X-RateLimit-Limit";
        private String remaining = "X-RateLimit-Remaining";
        private String reset = "X-RateLimit-Reset";
        private String retryAfter = "Retry-After";
    }

    @Data
    public static class Ip {
        private int ipv4SubnetPrefix = 32; // 32 이면 마스킹 없음
        private int ipv6SubnetPrefix = 128; // 128 이면 마스킹 없음
    }

    @Data
    public static class TokenBucket {
        private double initialTokens = 0; // 새 버킷의 시작 토큰 수
    }

    @Data
    public static class Memory {
        private int maxEntries = 100_000; // 초과 시 만료 엔트리 정리
    }

    @Data
    public static class Admin {
        private boolean enabled = false; // 관리 API 노출 여부 (인증 없는 환경에서는 끄기)
    }
}
