package com.example.gatekeeper.application;

import com.example.gatekeeper.ratelimit.annotation.RateLimit;
import com.example.gatekeeper.ratelimit.config.IdentifierType;
import com.example.gatekeeper.ratelimit.config.StrategyType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class AppController {

    @GetMapping("/")
    @RateLimit(
        requests = 100,
        windowMinutes = 1,
        message = "메인 페이지 접근 제한 초과! 1분 후 다시 시도해주세요."
    )
    public String home() {
        return "Gatekeeper - Rate Limiting Demo\n\n" +
               "어노테이션(@RateLimit) 기반:\n" +
               "- GET /api/demo/user    (사용자 기준 sliding window, 분당 10회)\n" +
               "- GET /api/demo/key     (X-API-Key 기준 token bucket, 분당 30회)\n" +
               "- GET /api/demo/multi   (분당 5회 + 시간당 50회, IP+사용자 조합)\n\n" +
               "필터(rate-limiter.url-patterns) 기반:\n" +
               "- GET /api/public/ping\n\n" +
               "관리 (rate-limiter.admin.enabled=true 일 때):\n" +
               "- GET    /api/admin/rate-limit/rules\n" +
               "- GET    /api/admin/rate-limit/usage?rule={pattern}\n" +
               "- DELETE /api/admin/rate-limit?rule={pattern}";
    }

    @GetMapping("/api/demo/user")
    @RateLimit(
        requests = 10,
        windowMinutes = 1,
        strategy = StrategyType.SLIDING,
        identifier = IdentifierType.USER,
        message = "사용자별 요청 한도 초과! 잠시 후 다시 시도해주세요."
    )
    public Map<String, Object> userDemo() {
        return Map.of("endpoint", "user", "strategy", "sliding", "identifier", "user");
    }

    @GetMapping("/api/demo/key")
    @RateLimit(
        requests = 30,
        windowMinutes = 1,
        strategy = StrategyType.TOKEN_BUCKET,
        identifier = IdentifierType.HEADER,
        message = "API 키별 요청 한도 초과! Token Bucket으로 제한되었습니다."
    )
    public Map<String, Object> apiKeyDemo() {
        return Map.of("endpoint", "key", "strategy", "token_bucket", "identifier", "header");
    }

    @GetMapping("/api/demo/multi")
    @RateLimit(rule = "5,1|50,60,fixed,ip+user")
    public Map<String, Object> multiLimitDemo() {
        return Map.of("endpoint", "multi", "limits", "5/min, 50/hour");
    }

    @GetMapping("/api/public/ping")
    public Map<String, Object> ping() {
        return Map.of("status", "ok");
    }
}
